package com.forgeloop.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Append-only log entry for one resolved dispatch.
 * {@code transitionId} is a content hash, so re-inserting the same record is a no-op.
 */
public record TransitionRecord(
        @JsonProperty("transition_id") String transitionId,
        @JsonProperty("transition_kind") String transitionKind,
        @JsonProperty("from_state") StateSnapshot fromState,
        @JsonProperty("to_state") StateSnapshot toState,
        @JsonProperty("action_label") Map<String, Object> actionLabel,
        Map<String, Object> context,
        Map<String, Object> observations,
        boolean verified,
        Instant timestamp
) {
}
