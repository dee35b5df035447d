package dev.contractgate.core.conformance;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import dev.contractgate.core.contract.CheckSeverity;

import java.util.Locale;

/**
 * Severity of a tracked violation, ordered most severe first.
 */
public enum ViolationSeverity {
    BLOCKER(5),
    CRITICAL(4),
    MAJOR(3),
    MINOR(2),
    INFO(1);

    private final int weight;

    ViolationSeverity(int weight) {
        this.weight = weight;
    }

    public static ViolationSeverity fromCheckSeverity(CheckSeverity severity) {
        if (severity == null) {
            return MAJOR;
        }
        return switch (severity) {
            case ERROR -> BLOCKER;
            case WARNING -> MAJOR;
            case INFO -> MINOR;
        };
    }

    @JsonCreator
    public static ViolationSeverity fromValue(String value) {
        if (value == null) {
            return MAJOR;
        }
        for (ViolationSeverity severity : values()) {
            if (severity.value().equals(value.trim().toLowerCase(Locale.ROOT))) {
                return severity;
            }
        }
        return fromCheckSeverity(CheckSeverity.fromValue(value));
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public int weight() {
        return weight;
    }
}
