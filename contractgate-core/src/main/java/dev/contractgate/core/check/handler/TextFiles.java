package dev.contractgate.core.check.handler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads repository files as UTF-8 text, skipping binary and unreadable ones.
 */
final class TextFiles {

    private static final Logger logger = LoggerFactory.getLogger(TextFiles.class);

    private TextFiles() {
    }

    static Optional<String> read(Path repoRoot, String path) {
        try {
            byte[] bytes = Files.readAllBytes(repoRoot.resolve(path));
            return Optional.of(StandardCharsets.UTF_8.newDecoder().decode(ByteBuffer.wrap(bytes)).toString());
        } catch (CharacterCodingException e) {
            logger.debug("Skipping non UTF-8 file {}", path);
            return Optional.empty();
        } catch (IOException e) {
            logger.warn("Cannot read {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * 1-based line number of a character offset.
     */
    static int lineAt(String content, int offset) {
        return 1 + countNewlines(content, 0, offset);
    }

    static int countNewlines(String content, int from, int to) {
        int count = 0;
        for (int i = from; i < to && i < content.length(); i++) {
            if (content.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }

    static String truncate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }
}
