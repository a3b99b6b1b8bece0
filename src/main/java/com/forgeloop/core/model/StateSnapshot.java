package com.forgeloop.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Abstract state of an issue around a dispatch, as recorded in the transition log.
 * {@code stateId} is a content hash of the remaining fields.
 */
public record StateSnapshot(
        @JsonProperty("state_id") String stateId,
        String domain,
        @JsonProperty("job_type") String jobType,
        Map<String, Object> features,
        @JsonProperty("policy_key") String policyKey
) {
}
