package dev.contractgate.core.conformance;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RunType {
    FULL,
    INCREMENTAL;

    public static RunType of(boolean fullRun) {
        return fullRun ? FULL : INCREMENTAL;
    }

    @JsonCreator
    public static RunType fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
