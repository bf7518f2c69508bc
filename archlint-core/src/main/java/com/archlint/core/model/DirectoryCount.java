package com.archlint.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Number of files below a top-level directory.
 *
 * @param dir top-level directory name
 * @param count files anywhere below it
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DirectoryCount(
    @JsonProperty("dir") String dir,
    @JsonProperty("count") int count
) {
}
