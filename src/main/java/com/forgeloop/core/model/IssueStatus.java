package com.forgeloop.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle status of an {@link Issue} in the work graph.
 */
public enum IssueStatus {
    OPEN,
    READY,
    RUNNING,
    DONE,
    ESCALATED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static IssueStatus fromWire(String value) {
        return IssueStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    /** Whether the scheduler may pick up an issue in this status. */
    public boolean isSchedulable() {
        return this == OPEN || this == READY;
    }
}
