package dev.contractgate.core.contract;

import java.util.Locale;

/**
 * Severity declared on a check definition.
 */
public enum CheckSeverity {
    ERROR,
    WARNING,
    INFO;

    /**
     * Parse a severity name, defaulting to WARNING for anything unrecognized.
     *
     * @param value the declared severity, may be null
     * @return the parsed severity
     */
    public static CheckSeverity fromValue(String value) {
        if (value == null) {
            return WARNING;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "error", "blocker", "critical" -> ERROR;
            case "info", "note", "minor" -> INFO;
            default -> WARNING;
        };
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Rank used for deterministic ordering, most severe first.
     */
    public int rank() {
        return ordinal();
    }
}
