package dev.contractgate.core.ci;

import java.util.Locale;

/**
 * How much of the repository a CI run checks.
 */
public enum CIMode {
    /** Every file. */
    FULL,
    /** Only changed or explicitly listed files. */
    INCREMENTAL,
    /** Changed files, compared against the baseline. */
    PR;

    /**
     * Parse a mode name, defaulting to FULL for anything unrecognized.
     */
    public static CIMode fromValue(String value) {
        if (value != null) {
            for (CIMode mode : values()) {
                if (mode.value().equals(value.trim().toLowerCase(Locale.ROOT))) {
                    return mode;
                }
            }
        }
        return FULL;
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
