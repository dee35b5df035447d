package dev.contractgate.core.exception;

/**
 * Thrown by a check handler that cannot complete its scan.
 * <p>
 * The executor converts it into an ERROR result for the failing check only.
 */
public class CheckExecutionException extends ContractGateException {

    private final String checkId;

    public CheckExecutionException(String checkId, String message) {
        super(message);
        this.checkId = checkId;
    }

    public CheckExecutionException(String checkId, String message, Throwable cause) {
        super(message, cause);
        this.checkId = checkId;
    }

    public String getCheckId() {
        return checkId;
    }
}
