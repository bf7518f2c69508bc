package com.archlint.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A node of the module adjacency graph.
 *
 * <p>Modules that are only ever import targets have no files and a file count of zero.
 *
 * @param id module identifier derived from file paths
 * @param files member files, sorted
 * @param fileCount number of member files
 * @param violations number of rule violations on imports originating in this module
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModuleNode(
    @JsonProperty("id") String id,
    @JsonProperty("files") List<String> files,
    @JsonProperty("file_count") int fileCount,
    @JsonProperty("violations") int violations
) {
    public ModuleNode {
        Objects.requireNonNull(id, "id must not be null");
        files = files != null ? List.copyOf(files) : List.of();
    }
}
