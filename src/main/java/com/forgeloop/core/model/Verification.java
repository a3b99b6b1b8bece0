package com.forgeloop.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Gate verification block of a {@link Proof}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Verification(
        Map<String, GateResult> gates,
        @JsonProperty("all_passed") boolean allPassed,
        @JsonProperty("blocking_failures") List<String> blockingFailures
) {

    public Verification {
        gates = gates == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(gates));
        blockingFailures = blockingFailures == null ? List.of() : List.copyOf(blockingFailures);
    }

    public static Verification none() {
        return new Verification(Map.of(), false, List.of());
    }
}
