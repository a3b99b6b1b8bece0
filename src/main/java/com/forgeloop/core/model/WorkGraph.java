package com.forgeloop.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable snapshot of all issues and their dependency edges, re-read every cycle.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkGraph(List<Issue> issues, List<Dependency> dependencies) {

    public WorkGraph {
        issues = issues == null ? List.of() : List.copyOf(issues);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    public static WorkGraph empty() {
        return new WorkGraph(List.of(), List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return issues.isEmpty();
    }

    public Optional<Issue> issue(String id) {
        return issues.stream().filter(i -> i.id().equals(id)).findFirst();
    }

    /**
     * Issues that block {@code issueId}. Edges pointing at unknown issues are ignored.
     */
    public List<Issue> blockingDeps(String issueId) {
        var blockers = new ArrayList<Issue>();
        for (Dependency dep : dependencies) {
            if (dep.isBlocking() && dep.toId().equals(issueId)) {
                issue(dep.fromId()).ifPresent(blockers::add);
            }
        }
        return blockers;
    }

    /**
     * Ids of blockers of {@code issueId} that are not yet {@link IssueStatus#DONE}.
     * A blocker edge to an issue missing from the snapshot counts as unresolved.
     */
    public List<String> unresolvedBlockers(String issueId) {
        var open = new ArrayList<String>();
        for (Dependency dep : dependencies) {
            if (!dep.isBlocking() || !dep.toId().equals(issueId)) {
                continue;
            }
            Optional<Issue> blocker = issue(dep.fromId());
            if (blocker.isEmpty() || blocker.get().status() != IssueStatus.DONE) {
                open.add(dep.fromId());
            }
        }
        return open;
    }

    /**
     * Narrows the graph to one issue, its direct blockers and the issues it directly blocks.
     * Returns an empty graph when the issue is unknown.
     */
    public WorkGraph filterToIssue(String issueId) {
        if (issue(issueId).isEmpty()) {
            return empty();
        }
        Set<String> keep = new LinkedHashSet<>();
        keep.add(issueId);
        for (Dependency dep : dependencies) {
            if (dep.toId().equals(issueId)) {
                keep.add(dep.fromId());
            }
            if (dep.fromId().equals(issueId)) {
                keep.add(dep.toId());
            }
        }
        List<Issue> kept = issues.stream().filter(i -> keep.contains(i.id())).toList();
        List<Dependency> edges = dependencies.stream()
                .filter(d -> keep.contains(d.fromId()) && keep.contains(d.toId()))
                .toList();
        return new WorkGraph(kept, edges);
    }
}
