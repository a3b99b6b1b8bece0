package com.forgeloop.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Directed dependency edge between two issues.
 *
 * @param fromId the issue that must finish first
 * @param toId   the issue that waits on {@code fromId}
 * @param type   edge type; only {@value #BLOCKS} edges gate scheduling
 */
public record Dependency(
        @JsonProperty("from_id") String fromId,
        @JsonProperty("to_id") String toId,
        @JsonProperty("dep_type") String type
) {

    public static final String BLOCKS = "blocks";

    public Dependency {
        if (type == null || type.isBlank()) {
            type = BLOCKS;
        }
    }

    public static Dependency blocks(String fromId, String toId) {
        return new Dependency(fromId, toId, BLOCKS);
    }

    @JsonIgnore
    public boolean isBlocking() {
        return BLOCKS.equals(type);
    }
}
