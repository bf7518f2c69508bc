package com.archlint.core.config;

import com.archlint.core.model.Invariant;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Root of an invariants configuration file.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * invariants:
 *   - id: no-console
 *     type: pattern
 *     severity: warning
 *     description: Use the logger instead of console output
 *     source_glob: "src/**"
 *     forbidden_pattern: "console\\.log"
 * }</pre>
 *
 * @param invariants declared invariants in file order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InvariantConfig(
    @JsonProperty("invariants") List<Invariant> invariants
) {
    public InvariantConfig {
        invariants = invariants != null
            ? invariants.stream().filter(Objects::nonNull).toList()
            : List.of();
    }
}
