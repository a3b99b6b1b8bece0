package com.forgeloop.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of a single quality gate as reported by the toolchain.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GateResult(
        boolean passed,
        Double score,
        @JsonProperty("fail_codes") List<String> failCodes
) {

    public GateResult {
        failCodes = failCodes == null ? List.of() : List.copyOf(failCodes);
    }

    public static GateResult pass() {
        return new GateResult(true, 1.0, List.of());
    }

    public static GateResult fail(String... codes) {
        return new GateResult(false, 0.0, List.of(codes));
    }
}
