package com.archlint.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Aggregated result of a batch scan.
 *
 * <p>A report with a non-null {@code error} describes a scan that could not run (typically
 * because the invariant configuration is missing or unreadable); it carries no violations.
 *
 * @param scope scanned sub-directory, empty for the whole project
 * @param filesChecked number of files requested for checking
 * @param violations violations in file order, then invariant order
 * @param stats violation counts
 * @param error failure message, or null for a completed scan
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScanReport(
    @JsonProperty("scope") String scope,
    @JsonProperty("files_checked") int filesChecked,
    @JsonProperty("violations") List<Violation> violations,
    @JsonProperty("stats") ScanStats stats,
    @JsonProperty("error") String error
) {
    public ScanReport {
        scope = scope != null ? scope : "";
        violations = violations != null ? List.copyOf(violations) : List.of();
        stats = stats != null ? stats : ScanStats.of(violations);
    }

    /**
     * Creates a completed report, computing stats from the violations.
     */
    public static ScanReport of(String scope, int filesChecked, List<Violation> violations) {
        return new ScanReport(scope, filesChecked, violations, ScanStats.of(violations), null);
    }

    /**
     * Creates a report for a scan that could not run.
     */
    public static ScanReport failed(String scope, String error) {
        return new ScanReport(scope, 0, List.of(), ScanStats.empty(), error);
    }

    @JsonIgnore
    public boolean isFailed() {
        return error != null;
    }

    @JsonIgnore
    public boolean hasErrors() {
        return stats.errors() > 0;
    }
}
