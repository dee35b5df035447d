package dev.contractgate.core.exemption;

import java.util.Locale;

/**
 * Lifecycle status of an exemption.
 */
public enum ExemptionStatus {
    ACTIVE,
    EXPIRED,
    RESOLVED,
    UNDER_REVIEW;

    public static ExemptionStatus fromValue(String value) {
        if (value == null || value.isBlank()) {
            return ACTIVE;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
