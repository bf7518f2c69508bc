package com.archlint.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One observed cross-module import.
 *
 * @param source importing file
 * @param target import specifier as written
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ImportDetail(
    @JsonProperty("source") String source,
    @JsonProperty("target") String target
) {}
