package dev.contractgate.core.exception;

/**
 * Base exception for ContractGate errors.
 */
public class ContractGateException extends RuntimeException {

    public ContractGateException(String message) {
        super(message);
    }

    public ContractGateException(String message, Throwable cause) {
        super(message, cause);
    }
}
