package dev.contractgate.core.exception;

/**
 * Thrown when a language adapter cannot parse a source file.
 */
public class SourceParseException extends ContractGateException {

    private final int line;

    public SourceParseException(String message, int line) {
        super(message);
        this.line = line;
    }

    public SourceParseException(String message, int line, Throwable cause) {
        super(message, cause);
        this.line = line;
    }

    /**
     * Get the line the parser stopped at, or 0 when unknown.
     *
     * @return the 1-based line number
     */
    public int getLine() {
        return line;
    }
}
