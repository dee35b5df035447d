package dev.contractgate.core.exception;

/**
 * Thrown when a git command fails or times out.
 */
public class GitException extends ContractGateException {

    public GitException(String message) {
        super(message);
    }

    public GitException(String message, Throwable cause) {
        super(message, cause);
    }
}
