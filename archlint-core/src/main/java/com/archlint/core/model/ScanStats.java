package com.archlint.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Violation counts of a scan.
 *
 * @param total number of violations
 * @param errors number of {@link Severity#ERROR} violations
 * @param warnings number of {@link Severity#WARNING} violations
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScanStats(
    @JsonProperty("total") int total,
    @JsonProperty("errors") int errors,
    @JsonProperty("warnings") int warnings
) {
    /**
     * Counts the given violations.
     *
     * @param violations violations to count
     * @return computed stats
     */
    public static ScanStats of(List<Violation> violations) {
        int errors = 0;
        int warnings = 0;
        for (Violation violation : violations) {
            if (violation.severity() == Severity.ERROR) {
                errors++;
            } else if (violation.severity() == Severity.WARNING) {
                warnings++;
            }
        }
        return new ScanStats(violations.size(), errors, warnings);
    }

    public static ScanStats empty() {
        return new ScanStats(0, 0, 0);
    }
}
