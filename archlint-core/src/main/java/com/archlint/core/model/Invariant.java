package com.archlint.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A declared architectural rule.
 *
 * <p>Only the fields relevant to the invariant's {@link InvariantType} are consulted:
 * <ul>
 *   <li>{@code boundary} - {@code forbiddenImports}, {@code allowedImports}</li>
 *   <li>{@code pattern} - {@code forbiddenPattern}</li>
 *   <li>{@code convention} - {@code rule}</li>
 *   <li>{@code dependency} - {@code packageName}, {@code allowedIn}</li>
 * </ul>
 * Scoping uses {@code sourceGlob} (or {@code scopeGlob} when no source glob is set) and
 * {@code scopeGlobExclude}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * invariants:
 *   - id: routes-no-db
 *     type: boundary
 *     severity: error
 *     description: Route handlers must not import the database layer
 *     source_glob: "src/routes/**"
 *     forbidden_imports: ["src/db/**"]
 * }</pre>
 *
 * @param id unique rule identifier
 * @param type rule kind, null when the configured value is unknown
 * @param severity violation severity, defaults to {@link Severity#ERROR}
 * @param description human-readable message used for violations
 * @param sourceGlob glob selecting the files the rule applies to
 * @param scopeGlob alternative scope glob, used when {@code sourceGlob} is absent
 * @param scopeGlobExclude globs removing files from scope
 * @param forbiddenImports glob or literal import targets that are forbidden
 * @param allowedImports glob or literal import targets that override a forbidden match
 * @param forbiddenPattern regular expression that must not match any line
 * @param rule free-text convention rule
 * @param packageName package name whose usage is restricted
 * @param allowedIn globs of files allowed to use {@code packageName}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Invariant(
    @JsonProperty("id") String id,
    @JsonProperty("type") InvariantType type,
    @JsonProperty("severity") Severity severity,
    @JsonProperty("description") String description,
    @JsonProperty("source_glob") String sourceGlob,
    @JsonProperty("scope_glob") String scopeGlob,
    @JsonProperty("scope_glob_exclude") List<String> scopeGlobExclude,
    @JsonProperty("forbidden_imports") List<String> forbiddenImports,
    @JsonProperty("allowed_imports") List<String> allowedImports,
    @JsonProperty("forbidden_pattern") String forbiddenPattern,
    @JsonProperty("rule") String rule,
    @JsonProperty("package") String packageName,
    @JsonProperty("allowed_in") List<String> allowedIn
) {
    public Invariant {
        severity = severity != null ? severity : Severity.ERROR;
        description = description != null ? description : "";
        scopeGlobExclude = scopeGlobExclude != null ? List.copyOf(scopeGlobExclude) : List.of();
        forbiddenImports = forbiddenImports != null ? List.copyOf(forbiddenImports) : List.of();
        allowedImports = allowedImports != null ? List.copyOf(allowedImports) : List.of();
        allowedIn = allowedIn != null ? List.copyOf(allowedIn) : List.of();
    }

    /**
     * Returns the glob that decides whether a file is in scope.
     *
     * @return source glob, else scope glob, else null
     */
    public String effectiveScopeGlob() {
        if (sourceGlob != null && !sourceGlob.isEmpty()) {
            return sourceGlob;
        }
        return scopeGlob != null && !scopeGlob.isEmpty() ? scopeGlob : null;
    }

    /**
     * Creates a builder for an invariant of the given id and type.
     *
     * @param id rule identifier
     * @param type rule kind
     * @return new builder
     */
    public static Builder builder(String id, InvariantType type) {
        return new Builder(id, type);
    }

    /**
     * Builder for {@link Invariant} instances.
     */
    public static final class Builder {
        private final String id;
        private final InvariantType type;
        private Severity severity = Severity.ERROR;
        private String description;
        private String sourceGlob;
        private String scopeGlob;
        private final List<String> scopeGlobExclude = new ArrayList<>();
        private final List<String> forbiddenImports = new ArrayList<>();
        private final List<String> allowedImports = new ArrayList<>();
        private String forbiddenPattern;
        private String rule;
        private String packageName;
        private final List<String> allowedIn = new ArrayList<>();

        private Builder(String id, InvariantType type) {
            this.id = Objects.requireNonNull(id, "id must not be null");
            this.type = type;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder sourceGlob(String sourceGlob) {
            this.sourceGlob = sourceGlob;
            return this;
        }

        public Builder scopeGlob(String scopeGlob) {
            this.scopeGlob = scopeGlob;
            return this;
        }

        public Builder scopeGlobExclude(String... globs) {
            this.scopeGlobExclude.addAll(List.of(globs));
            return this;
        }

        public Builder forbiddenImports(String... imports) {
            this.forbiddenImports.addAll(List.of(imports));
            return this;
        }

        public Builder allowedImports(String... imports) {
            this.allowedImports.addAll(List.of(imports));
            return this;
        }

        public Builder forbiddenPattern(String forbiddenPattern) {
            this.forbiddenPattern = forbiddenPattern;
            return this;
        }

        public Builder rule(String rule) {
            this.rule = rule;
            return this;
        }

        public Builder packageName(String packageName) {
            this.packageName = packageName;
            return this;
        }

        public Builder allowedIn(String... globs) {
            this.allowedIn.addAll(List.of(globs));
            return this;
        }

        public Invariant build() {
            return new Invariant(id, type, severity, description, sourceGlob, scopeGlob,
                scopeGlobExclude, forbiddenImports, allowedImports, forbiddenPattern,
                rule, packageName, allowedIn);
        }
    }
}
