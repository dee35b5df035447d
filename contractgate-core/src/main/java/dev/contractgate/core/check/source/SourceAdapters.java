package dev.contractgate.core.check.source;

import dev.contractgate.core.exception.SourceParseException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of language adapters keyed by language.
 */
public class SourceAdapters {

    private final Map<SourceLanguage, SourceAdapter> adapters = new EnumMap<>(SourceLanguage.class);

    public SourceAdapters register(SourceAdapter adapter) {
        adapters.put(adapter.language(), adapter);
        return this;
    }

    /**
     * Registry with the Python and Java adapters.
     */
    public static SourceAdapters defaults() {
        return new SourceAdapters()
                .register(new PythonSourceAdapter())
                .register(new JavaSourceAdapter());
    }

    public boolean supports(String path) {
        return SourceLanguage.forPath(path).map(adapters::containsKey).orElse(false);
    }

    public Optional<SourceAdapter> forPath(String path) {
        return SourceLanguage.forPath(path).map(adapters::get);
    }

    /**
     * Read and parse a repository file.
     *
     * @param repoRoot repository root
     * @param path repository-relative path of a supported file
     * @return the parsed unit
     * @throws IOException when the file cannot be read
     * @throws SourceParseException when the file is not valid source or not valid UTF-8
     */
    public SourceUnit parse(Path repoRoot, String path) throws IOException {
        SourceAdapter adapter = forPath(path)
                .orElseThrow(() -> new IllegalArgumentException("No source adapter for " + path));
        String content;
        try {
            content = StandardCharsets.UTF_8.newDecoder().decode(ByteBuffer.wrap(Files.readAllBytes(repoRoot.resolve(path)))).toString();
        } catch (CharacterCodingException e) {
            throw new SourceParseException("File is not valid UTF-8", 0, e);
        }
        return adapter.parse(path, content);
    }
}
