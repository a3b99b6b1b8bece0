package com.forgeloop.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Where a toolchain left its change: the workcell branch and an optional diff reference.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PatchRef(String branch, @JsonProperty("diff_ref") String diffRef) {
}
