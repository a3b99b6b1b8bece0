package com.forgeloop.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of one scheduling pass.
 *
 * @param scheduledLanes      admitted issues in scheduling order, one lane each
 * @param speculateIssues     ids of admitted issues that fan out to several toolchains
 * @param speculateToolchains per speculate issue, the toolchains to fan out to (one workcell each)
 * @param skippedIssues       issues passed over, with reasons
 */
public record ScheduleResult(
        List<Issue> scheduledLanes,
        List<String> speculateIssues,
        Map<String, List<String>> speculateToolchains,
        List<SkippedIssue> skippedIssues
) {

    public ScheduleResult {
        scheduledLanes = List.copyOf(scheduledLanes);
        speculateIssues = List.copyOf(speculateIssues);
        var toolchains = new LinkedHashMap<String, List<String>>();
        speculateToolchains.forEach((id, names) -> toolchains.put(id, List.copyOf(names)));
        speculateToolchains = Collections.unmodifiableMap(toolchains);
        skippedIssues = List.copyOf(skippedIssues);
    }

    public boolean isEmpty() {
        return scheduledLanes.isEmpty();
    }

    public boolean isSpeculate(String issueId) {
        return speculateIssues.contains(issueId);
    }

    public List<String> toolchainsFor(String issueId) {
        return speculateToolchains.getOrDefault(issueId, List.of());
    }
}
