package dev.contractgate.core.exception;

/**
 * Thrown for an operation that does not fit the current conformance state,
 * such as initializing twice or resolving an unknown violation.
 */
public class ConformanceStateException extends ContractGateException {

    public ConformanceStateException(String message) {
        super(message);
    }

    public ConformanceStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
