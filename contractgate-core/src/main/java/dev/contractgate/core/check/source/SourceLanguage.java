package dev.contractgate.core.check.source;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Languages with a structural adapter.
 */
public enum SourceLanguage {
    PYTHON(".py", List.of("#")),
    JAVA(".java", List.of("//", "/*", "*", "*/"));

    private final String extension;
    private final List<String> commentPrefixes;

    SourceLanguage(String extension, List<String> commentPrefixes) {
        this.extension = extension;
        this.commentPrefixes = commentPrefixes;
    }

    public static Optional<SourceLanguage> forPath(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        for (SourceLanguage language : values()) {
            if (lower.endsWith(language.extension)) {
                return Optional.of(language);
            }
        }
        return Optional.empty();
    }

    /**
     * Whether a source line holds nothing but a comment.
     */
    public boolean isCommentOnly(String line) {
        String trimmed = line.trim();
        return commentPrefixes.stream().anyMatch(trimmed::startsWith);
    }

    public String extension() {
        return extension;
    }
}
