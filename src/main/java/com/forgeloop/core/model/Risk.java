package com.forgeloop.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Risk classification of an issue. Higher risk sorts first among equal priorities
 * and can trigger speculative fan-out.
 */
public enum Risk {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Risk fromWire(String value) {
        return Risk.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
