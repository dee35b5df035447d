package dev.contractgate.core.check.source;

/**
 * Turns the source of one language into the language-neutral syntax tree.
 */
public interface SourceAdapter {

    SourceLanguage language();

    /**
     * Parse a file.
     *
     * @param path repository-relative path
     * @param content file content
     * @return the parsed unit
     * @throws dev.contractgate.core.exception.SourceParseException when the source is not valid
     */
    SourceUnit parse(String path, String content);
}
