package com.archlint.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A single breach of an {@link Invariant} in one file.
 *
 * <p>{@code importSpecifier} is set for boundary violations, {@code line} (1-based) for pattern
 * violations and {@code packageName} for dependency violations. Absent fields are omitted from
 * the JSON form.
 *
 * @param rule id of the violated invariant
 * @param severity severity copied from the invariant
 * @param message human-readable message
 * @param file project-relative path of the offending file
 * @param importSpecifier offending import specifier (boundary only)
 * @param line 1-based offending line (pattern only)
 * @param packageName offending package (dependency only)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Violation(
    @JsonProperty("rule") String rule,
    @JsonProperty("severity") Severity severity,
    @JsonProperty("message") String message,
    @JsonProperty("file") String file,
    @JsonProperty("import") String importSpecifier,
    @JsonProperty("line") Integer line,
    @JsonProperty("package") String packageName
) {
    public Violation {
        Objects.requireNonNull(rule, "rule must not be null");
        Objects.requireNonNull(file, "file must not be null");
        severity = severity != null ? severity : Severity.ERROR;
        message = message != null ? message : "";
    }

    /**
     * Creates a violation without location details.
     */
    public static Violation of(Invariant invariant, String file, String message) {
        return new Violation(invariant.id(), invariant.severity(), message, file, null, null, null);
    }

    /**
     * Creates a boundary violation for a forbidden import.
     */
    public static Violation forImport(Invariant invariant, String file, String importSpecifier) {
        return new Violation(invariant.id(), invariant.severity(), invariant.description(), file,
            importSpecifier, null, null);
    }

    /**
     * Creates a pattern violation at a 1-based line.
     */
    public static Violation atLine(Invariant invariant, String file, int line) {
        return new Violation(invariant.id(), invariant.severity(), invariant.description(), file,
            null, line, null);
    }

    /**
     * Creates a dependency violation for a restricted package.
     */
    public static Violation forPackage(Invariant invariant, String file, String packageName) {
        return new Violation(invariant.id(), invariant.severity(), invariant.description(), file,
            null, null, packageName);
    }
}
