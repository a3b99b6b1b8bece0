package com.forgeloop.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured result a toolchain writes as {@code proof.json} at the end of a dispatch.
 * Read-only once produced.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Proof(
        @JsonProperty("schema_version") String schemaVersion,
        @JsonProperty("workcell_id") String workcellId,
        @JsonProperty("issue_id") String issueId,
        ProofStatus status,
        PatchRef patch,
        Verification verification,
        Double confidence,
        Map<String, Object> metadata
) {

    public static final String SCHEMA_VERSION = "1.0.0";
    public static final double DEFAULT_CONFIDENCE = 0.5;

    public Proof {
        schemaVersion = schemaVersion == null ? SCHEMA_VERSION : schemaVersion;
        status = status == null ? ProofStatus.ERROR : status;
        verification = verification == null ? Verification.none() : verification;
        confidence = confidence == null ? DEFAULT_CONFIDENCE : confidence;
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Copy carrying the given workcell and issue ids where the toolchain left them out.
     */
    public Proof withMissingIds(String workcellId, String issueId) {
        boolean hasWorkcell = this.workcellId != null && !this.workcellId.isBlank();
        boolean hasIssue = this.issueId != null && !this.issueId.isBlank();
        if (hasWorkcell && hasIssue) {
            return this;
        }
        return new Proof(schemaVersion, hasWorkcell ? this.workcellId : workcellId,
                hasIssue ? this.issueId : issueId, status, patch, verification, confidence, metadata);
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return status.isSuccessful();
    }
}
