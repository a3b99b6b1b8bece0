package com.forgeloop.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Execution contract handed to a toolchain for one dispatch, persisted as
 * {@code manifest.json} in the workcell. Field names are a stable wire format
 * shared with adapters written in other languages.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
@JsonIgnoreProperties(ignoreUnknown = true)
public record Manifest(
        @JsonProperty("schema_version") String schemaVersion,
        @JsonProperty("workcell_id") String workcellId,
        @JsonProperty("branch_name") String branchName,
        @JsonProperty("apply_patch") boolean applyPatch,
        @JsonProperty("issue") IssueSpec issue,
        @JsonProperty("job_type") String jobType,
        @JsonProperty("toolchain") String toolchain,
        @JsonProperty("toolchain_config") ToolchainSettings toolchainConfig,
        @JsonProperty("quality_gates") Map<String, String> qualityGates,
        @JsonProperty("speculate_mode") boolean speculateMode,
        @JsonProperty("speculate_tag") String speculateTag,
        @JsonProperty("control") Map<String, Object> control,
        @JsonProperty("planner") Map<String, Object> planner
) {

    public static final String SCHEMA_VERSION = "1.0.0";
    public static final String JOB_TYPE_CODE = "code";
    public static final String TIMEOUT_OVERRIDE_KEY = "timeout_seconds_override";

    public Manifest {
        qualityGates = qualityGates == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(qualityGates));
        control = control == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(control));
    }

    /**
     * Planner-supplied timeout, honoured only when it is a positive whole number of seconds.
     */
    @JsonIgnore
    public Optional<Integer> timeoutOverrideSeconds() {
        if (planner == null) {
            return Optional.empty();
        }
        Object value = planner.get(TIMEOUT_OVERRIDE_KEY);
        if (value instanceof Integer seconds && seconds > 0) {
            return Optional.of(seconds);
        }
        if (value instanceof Long seconds && seconds > 0 && seconds <= Integer.MAX_VALUE) {
            return Optional.of(seconds.intValue());
        }
        return Optional.empty();
    }

    /** Names of the gates this dispatch declares; the verifier requires every one of them. */
    @JsonIgnore
    public Set<String> declaredGates() {
        return qualityGates.keySet();
    }

    /**
     * Issue snapshot as seen by the toolchain.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record IssueSpec(
            String id,
            String title,
            String description,
            @JsonProperty("acceptance_criteria") List<String> acceptanceCriteria,
            @JsonProperty("context_files") List<String> contextFiles,
            @JsonProperty("forbidden_paths") List<String> forbiddenPaths,
            @JsonProperty("estimated_tokens") long estimatedTokens,
            List<String> tags
    ) {
        public static IssueSpec of(Issue issue) {
            return new IssueSpec(issue.id(), issue.title(), issue.description(),
                    issue.acceptanceCriteria(), issue.contextFiles(), issue.forbiddenPaths(),
                    issue.estimatedTokens(), issue.tags());
        }
    }

    /**
     * Model and sampling parameters for the chosen toolchain.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ToolchainSettings(String model, Map<String, Object> sampling) {
    }
}
