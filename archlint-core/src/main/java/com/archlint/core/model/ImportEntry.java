package com.archlint.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * Raw import specifiers extracted from one source file.
 *
 * @param file project-relative path
 * @param imports specifiers in order of first appearance
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ImportEntry(
    @JsonProperty("file") String file,
    @JsonProperty("imports") List<String> imports
) {
    public ImportEntry {
        Objects.requireNonNull(file, "file must not be null");
        imports = imports != null ? List.copyOf(imports) : List.of();
    }
}
