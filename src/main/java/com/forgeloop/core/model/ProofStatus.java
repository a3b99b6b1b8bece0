package com.forgeloop.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ProofStatus {
    SUCCESS,
    PARTIAL,
    FAILED,
    TIMEOUT,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ProofStatus fromWire(String value) {
        return ProofStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /** Success and partial results both count as a successful dispatch. */
    public boolean isSuccessful() {
        return this == SUCCESS || this == PARTIAL;
    }
}
