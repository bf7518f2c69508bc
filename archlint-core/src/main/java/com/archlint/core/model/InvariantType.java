package com.archlint.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of architectural invariant.
 *
 * <p>Values are read and written in lower case ({@code boundary}, {@code pattern}, ...).
 * Unknown values deserialize to {@code null} so that a single malformed rule can be skipped
 * without rejecting the whole configuration file.
 */
public enum InvariantType {

    /** Files matching a glob must not import matching targets. */
    BOUNDARY,

    /** Files matching a glob must not contain a line matching a regular expression. */
    PATTERN,

    /** Files matching a glob must follow a file-organization convention. */
    CONVENTION,

    /** A named package may only be used from allowed locations. */
    DEPENDENCY;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a type from its configuration value, ignoring case.
     *
     * @param value configuration value
     * @return matching type, or null if unknown
     */
    @JsonCreator
    public static InvariantType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (InvariantType type : values()) {
            if (type.value().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return null;
    }
}
