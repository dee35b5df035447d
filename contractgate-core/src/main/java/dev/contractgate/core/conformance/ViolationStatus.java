package dev.contractgate.core.conformance;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle state of a tracked violation.
 */
public enum ViolationStatus {
    OPEN,
    RESOLVED,
    STALE,
    EXEMPTION_EXPIRED;

    @JsonCreator
    public static ViolationStatus fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Whether a violation in this state still needs attention.
     */
    public boolean isActive() {
        return this == OPEN || this == EXEMPTION_EXPIRED;
    }
}
