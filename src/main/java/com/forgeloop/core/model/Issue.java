package com.forgeloop.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A unit of work tracked by the work graph.
 * <p>
 * Issues are immutable snapshots; state changes go through
 * {@link com.forgeloop.core.graph.WorkGraphClient} and are observed on the next load.
 *
 * @param id                 stable issue identifier
 * @param title              short human-readable title
 * @param description        free-form description handed to the toolchain
 * @param status             lifecycle status
 * @param tags               labels; drive gate selection, routing and escalation detection
 * @param priority           scheduling priority, P0 first
 * @param risk               risk classification, may trigger speculation
 * @param size               t-shirt size (XS..XL), used by routing rules
 * @param attempts           resolved dispatches so far, never decreases
 * @param maxAttempts        retry budget before escalation
 * @param toolHint           preferred toolchain name, if any
 * @param forbiddenPaths     paths the toolchain must not touch
 * @param acceptanceCriteria criteria listed in the manifest
 * @param contextFiles       files the toolchain should read first
 * @param estimatedTokens    estimated token cost, counted against the cycle token budget
 * @param speculate          explicit request for speculative fan-out
 * @param applyPatch         whether a verified result is merged into the main branch
 * @param qualityGates       explicit gate name to command override; empty means derive from tags
 * @param parentId           originating issue for derived (escalation) issues
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Issue(
        String id,
        String title,
        String description,
        IssueStatus status,
        List<String> tags,
        Priority priority,
        Risk risk,
        String size,
        int attempts,
        @JsonProperty("max_attempts") int maxAttempts,
        @JsonProperty("tool_hint") String toolHint,
        @JsonProperty("forbidden_paths") List<String> forbiddenPaths,
        @JsonProperty("acceptance_criteria") List<String> acceptanceCriteria,
        @JsonProperty("context_files") List<String> contextFiles,
        @JsonProperty("estimated_tokens") long estimatedTokens,
        boolean speculate,
        @JsonProperty("apply_patch") Boolean applyPatch,
        @JsonProperty("quality_gates") Map<String, String> qualityGates,
        @JsonProperty("parent_id") String parentId
) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_ESTIMATED_TOKENS = 50_000L;
    public static final String ESCALATION_TITLE_PREFIX = "[ESCALATION]";
    public static final Set<String> ESCALATION_TAGS =
            Set.of("escalation", "needs-human", "@human-escalated", "human-escalated");

    public Issue {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Issue id must not be blank");
        }
        title = title == null ? "" : title;
        description = description == null ? "" : description;
        status = status == null ? IssueStatus.OPEN : status;
        tags = tags == null ? List.of() : List.copyOf(tags);
        priority = priority == null ? Priority.P2 : priority;
        risk = risk == null ? Risk.MEDIUM : risk;
        size = size == null || size.isBlank() ? "M" : size;
        maxAttempts = maxAttempts <= 0 ? DEFAULT_MAX_ATTEMPTS : maxAttempts;
        forbiddenPaths = forbiddenPaths == null ? List.of() : List.copyOf(forbiddenPaths);
        acceptanceCriteria = acceptanceCriteria == null ? List.of() : List.copyOf(acceptanceCriteria);
        contextFiles = contextFiles == null ? List.of() : List.copyOf(contextFiles);
        estimatedTokens = estimatedTokens <= 0 ? DEFAULT_ESTIMATED_TOKENS : estimatedTokens;
        applyPatch = applyPatch == null ? Boolean.TRUE : applyPatch;
        qualityGates = qualityGates == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(qualityGates));
    }

    /**
     * True when this issue is itself a human escalation, detected by tag or title convention.
     * Such issues are never scheduled and never escalated again.
     */
    @JsonIgnore
    public boolean isEscalation() {
        for (String tag : tags) {
            if (ESCALATION_TAGS.contains(tag)) {
                return true;
            }
        }
        return title.startsWith(ESCALATION_TITLE_PREFIX);
    }

    @JsonIgnore
    public boolean attemptsExhausted() {
        return attempts >= maxAttempts;
    }

    public Issue withStatus(IssueStatus newStatus) {
        return toBuilder().status(newStatus).build();
    }

    public Issue withAttempts(int newAttempts) {
        return toBuilder().attempts(newAttempts).build();
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public Builder toBuilder() {
        return new Builder(id)
                .title(title).description(description).status(status).tags(tags)
                .priority(priority).risk(risk).size(size)
                .attempts(attempts).maxAttempts(maxAttempts).toolHint(toolHint)
                .forbiddenPaths(forbiddenPaths).acceptanceCriteria(acceptanceCriteria)
                .contextFiles(contextFiles).estimatedTokens(estimatedTokens)
                .speculate(speculate).applyPatch(applyPatch)
                .qualityGates(qualityGates).parentId(parentId);
    }

    /**
     * Fluent builder, mainly for tests and for issues created by the kernel itself.
     */
    public static final class Builder {
        private final String id;
        private String title = "";
        private String description = "";
        private IssueStatus status = IssueStatus.OPEN;
        private List<String> tags = new ArrayList<>();
        private Priority priority = Priority.P2;
        private Risk risk = Risk.MEDIUM;
        private String size = "M";
        private int attempts;
        private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
        private String toolHint;
        private List<String> forbiddenPaths = List.of();
        private List<String> acceptanceCriteria = List.of();
        private List<String> contextFiles = List.of();
        private long estimatedTokens = DEFAULT_ESTIMATED_TOKENS;
        private boolean speculate;
        private boolean applyPatch = true;
        private Map<String, String> qualityGates = Map.of();
        private String parentId;

        private Builder(String id) {
            this.id = id;
        }

        public Builder title(String title) { this.title = title; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder status(IssueStatus status) { this.status = status; return this; }
        public Builder tags(List<String> tags) { this.tags = tags; return this; }
        public Builder tags(String... tags) { this.tags = List.of(tags); return this; }
        public Builder priority(Priority priority) { this.priority = priority; return this; }
        public Builder risk(Risk risk) { this.risk = risk; return this; }
        public Builder size(String size) { this.size = size; return this; }
        public Builder attempts(int attempts) { this.attempts = attempts; return this; }
        public Builder maxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; return this; }
        public Builder toolHint(String toolHint) { this.toolHint = toolHint; return this; }
        public Builder forbiddenPaths(List<String> forbiddenPaths) { this.forbiddenPaths = forbiddenPaths; return this; }
        public Builder acceptanceCriteria(List<String> acceptanceCriteria) { this.acceptanceCriteria = acceptanceCriteria; return this; }
        public Builder contextFiles(List<String> contextFiles) { this.contextFiles = contextFiles; return this; }
        public Builder estimatedTokens(long estimatedTokens) { this.estimatedTokens = estimatedTokens; return this; }
        public Builder speculate(boolean speculate) { this.speculate = speculate; return this; }
        public Builder applyPatch(boolean applyPatch) { this.applyPatch = applyPatch; return this; }
        public Builder qualityGates(Map<String, String> qualityGates) { this.qualityGates = qualityGates; return this; }
        public Builder parentId(String parentId) { this.parentId = parentId; return this; }

        public Issue build() {
            return new Issue(id, title, description, status, tags, priority, risk, size,
                    attempts, maxAttempts, toolHint, forbiddenPaths, acceptanceCriteria,
                    contextFiles, estimatedTokens, speculate, applyPatch, qualityGates, parentId);
        }
    }
}
