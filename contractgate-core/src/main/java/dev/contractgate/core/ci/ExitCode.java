package dev.contractgate.core.ci;

/**
 * Process exit codes of a CI run.
 */
public enum ExitCode {
    SUCCESS(0, "Success (no violations or only warnings)"),
    VIOLATIONS_FOUND(1, "Violations found (errors)"),
    CONFIG_ERROR(2, "Configuration error"),
    RUNTIME_ERROR(3, "Runtime error"),
    BASELINE_NOT_FOUND(4, "Baseline not found (when required)");

    private final int code;
    private final String description;

    ExitCode(int code, String description) {
        this.code = code;
        this.description = description;
    }

    public int code() {
        return code;
    }

    public String description() {
        return description;
    }
}
