package com.archlint.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Structural summary of a project, used to seed and review invariants.
 *
 * @param rawStructure directories up to three levels deep, sorted
 * @param detectedLayers conventional layer directory names found anywhere in the tree
 * @param namingPatterns most frequent multi-part source extensions such as {@code .service.ts}
 * @param testGaps source files without a colocated test, sorted
 * @param fileCounts file counts per top-level directory, sorted by directory
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StructureReport(
    @JsonProperty("raw_structure") List<String> rawStructure,
    @JsonProperty("detected_layers") List<String> detectedLayers,
    @JsonProperty("naming_patterns") List<String> namingPatterns,
    @JsonProperty("test_gaps") List<String> testGaps,
    @JsonProperty("file_counts") List<DirectoryCount> fileCounts
) {
    public StructureReport {
        rawStructure = rawStructure != null ? List.copyOf(rawStructure) : List.of();
        detectedLayers = detectedLayers != null ? List.copyOf(detectedLayers) : List.of();
        namingPatterns = namingPatterns != null ? List.copyOf(namingPatterns) : List.of();
        testGaps = testGaps != null ? List.copyOf(testGaps) : List.of();
        fileCounts = fileCounts != null ? List.copyOf(fileCounts) : List.of();
    }
}
