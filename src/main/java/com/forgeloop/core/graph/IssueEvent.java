package com.forgeloop.core.graph;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Audit entry attached to an issue.
 */
public record IssueEvent(
        @JsonProperty("issue_id") String issueId,
        String kind,
        Map<String, Object> payload,
        Instant timestamp
) {
}
