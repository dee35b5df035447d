package dev.contractgate.core.exception;

/**
 * Thrown when a baseline is required but missing or unreadable.
 */
public class BaselineException extends ContractGateException {

    public BaselineException(String message) {
        super(message);
    }

    public BaselineException(String message, Throwable cause) {
        super(message, cause);
    }
}
