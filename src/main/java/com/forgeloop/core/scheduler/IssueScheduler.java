package com.forgeloop.core.scheduler;

import com.forgeloop.core.config.KernelProperties;
import com.forgeloop.core.model.Issue;
import com.forgeloop.core.model.ScheduleResult;
import com.forgeloop.core.model.SkippedIssue;
import com.forgeloop.core.model.WorkGraph;
import com.forgeloop.core.routing.ExplorationController;
import com.forgeloop.core.routing.RoutingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

/**
 * Selects the issues to dispatch this cycle and splits them into single and
 * speculative lanes.
 * <p>
 * Issues are visited in priority order (P0 first), then by risk (high first), then by id.
 * An issue is a candidate when it is open or ready, has attempts left, all its blockers
 * are done, it is not an escalation and it is not already running. Candidates are admitted
 * until the concurrency budget or the token budget runs out. The result depends only on
 * the graph, the running set, configuration and the controller snapshot of the cycle.
 */
@Service
public class IssueScheduler {

    private static final Logger log = LoggerFactory.getLogger(IssueScheduler.class);

    static final Comparator<Issue> SCHEDULING_ORDER = Comparator
            .comparing(Issue::priority)
            .thenComparing(Issue::risk, Comparator.reverseOrder())
            .thenComparing(Issue::id);

    private final KernelProperties properties;
    private final RoutingPolicy routing;
    private final ExplorationController controller;

    public IssueScheduler(KernelProperties properties, RoutingPolicy routing, ExplorationController controller) {
        this.properties = properties;
        this.routing = routing;
        this.controller = controller;
    }

    public ScheduleResult schedule(WorkGraph graph, Set<String> runningIssueIds) {
        int budget = Math.max(0, properties.getScheduling().getMaxConcurrentWorkcells() - runningIssueIds.size());
        long tokenBudget = properties.getScheduling().getMaxConcurrentTokens();

        var lanes = new ArrayList<Issue>();
        var speculate = new ArrayList<String>();
        var speculateToolchains = new LinkedHashMap<String, List<String>>();
        var skipped = new ArrayList<SkippedIssue>();
        long tokensAdmitted = 0;

        List<Issue> ordered = graph.issues().stream().sorted(SCHEDULING_ORDER).toList();
        for (Issue issue : ordered) {
            String reason = ineligibility(issue, graph, runningIssueIds);
            if (reason == null && lanes.size() >= budget) {
                reason = "concurrency budget exhausted";
            }
            if (reason == null && !lanes.isEmpty() && tokensAdmitted + issue.estimatedTokens() > tokenBudget) {
                reason = "token budget exhausted";
            }
            if (reason != null) {
                log.debug("  {} skipped: {}", issue.id(), reason);
                skipped.add(new SkippedIssue(issue, reason));
                continue;
            }

            lanes.add(issue);
            tokensAdmitted += issue.estimatedTokens();

            List<String> fanOut = speculateToolchains(issue);
            if (!fanOut.isEmpty()) {
                speculate.add(issue.id());
                speculateToolchains.put(issue.id(), fanOut);
                log.debug("  {} admitted (speculate x{}: {})", issue.id(), fanOut.size(), fanOut);
            } else {
                log.debug("  {} admitted", issue.id());
            }
        }

        log.info("Scheduled {} lane(s) ({} speculative), skipped {}, running {}",
                lanes.size(), speculate.size(), skipped.size(), runningIssueIds.size());
        return new ScheduleResult(lanes, speculate, speculateToolchains, skipped);
    }

    /**
     * Why the issue cannot be dispatched right now, ignoring budgets; null when it can.
     */
    public String ineligibility(Issue issue, WorkGraph graph, Set<String> runningIssueIds) {
        if (!issue.status().isSchedulable()) {
            return "status=" + issue.status().wireName();
        }
        if (issue.attemptsExhausted()) {
            return "attempts exhausted (%d/%d)".formatted(issue.attempts(), issue.maxAttempts());
        }
        List<String> blockers = graph.unresolvedBlockers(issue.id());
        if (!blockers.isEmpty()) {
            return "blocked by " + String.join(", ", blockers);
        }
        if (issue.isEscalation()) {
            return "escalated";
        }
        if (runningIssueIds.contains(issue.id())) {
            return "already running";
        }
        return null;
    }

    /**
     * Toolchains to fan out to, or an empty list for a single dispatch.
     */
    private List<String> speculateToolchains(Issue issue) {
        KernelProperties.Speculation speculation = properties.getSpeculation();
        if (!speculation.isEnabled() || !wantsSpeculation(issue)) {
            return List.of();
        }
        List<String> candidates = routing.speculateCandidates(issue);
        if (candidates.isEmpty()) {
            log.debug("  {} wants speculation but no toolchain is available", issue.id());
            return List.of();
        }
        int desired = routing.ruleParallelism(issue).orElse(controller.current().speculateParallelism());
        int width = Math.max(1, Math.min(Math.min(desired, candidates.size()), speculation.getMaxParallelism()));
        return List.copyOf(candidates.subList(0, width));
    }

    private boolean wantsSpeculation(Issue issue) {
        return properties.getRunner().isForceSpeculate()
                || issue.speculate()
                || properties.getSpeculation().getRiskLevels().contains(issue.risk())
                || routing.ruleRequestsSpeculation(issue);
    }
}
