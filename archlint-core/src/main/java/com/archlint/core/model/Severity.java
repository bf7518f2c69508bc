package com.archlint.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity attached to an invariant and to the violations it produces.
 */
public enum Severity {
    ERROR,
    WARNING,
    INFO;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a severity from its configuration value, ignoring case.
     *
     * @param value configuration value
     * @return matching severity, or null if unknown
     */
    @JsonCreator
    public static Severity fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (Severity severity : values()) {
            if (severity.value().equalsIgnoreCase(value.trim())) {
                return severity;
            }
        }
        return null;
    }
}
