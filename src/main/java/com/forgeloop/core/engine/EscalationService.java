package com.forgeloop.core.engine;

import com.forgeloop.core.graph.WorkGraphClient;
import com.forgeloop.core.metrics.KernelMetrics;
import com.forgeloop.core.model.Issue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Opens a human-facing follow-up issue when an issue runs out of attempts.
 * Issues that are already escalations never produce another one.
 */
@Service
public class EscalationService {

    private static final Logger log = LoggerFactory.getLogger(EscalationService.class);

    static final String ESCALATION_TAG = "escalation";
    static final String NEEDS_HUMAN_TAG = "needs-human";

    private final WorkGraphClient workGraph;
    private final KernelMetrics metrics;

    public EscalationService(WorkGraphClient workGraph, KernelMetrics metrics) {
        this.workGraph = workGraph;
        this.metrics = metrics;
    }

    /**
     * @return id of the created escalation issue, or empty when the issue is itself an escalation
     *         or the escalation issue could not be created
     */
    public Optional<String> escalate(Issue issue, int attempts, String failureSummary) {
        if (issue.isEscalation()) {
            log.info("Issue {} is already an escalation; not creating another", issue.id());
            metrics.incrementEscalations(false);
            return Optional.empty();
        }

        TreeSet<String> tags = new TreeSet<>(issue.tags());
        tags.add(ESCALATION_TAG);
        tags.add(NEEDS_HUMAN_TAG);

        String escalationId;
        try {
            escalationId = workGraph.createIssue(
                    Issue.ESCALATION_TITLE_PREFIX + " " + issue.title(),
                    description(issue, attempts, failureSummary),
                    issue.priority(),
                    new ArrayList<>(tags));
        } catch (RuntimeException e) {
            log.error("Failed to create escalation issue for {}", issue.id(), e);
            metrics.incrementEscalations(false);
            return Optional.empty();
        }

        Map<String, Object> link = new LinkedHashMap<>();
        link.put("parent_id", issue.id());
        workGraph.addEvent(escalationId, "escalation.created", link);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("escalation_id", escalationId);
        payload.put("attempts", attempts);
        workGraph.addEvent(issue.id(), "issue.escalated", payload);

        metrics.incrementEscalations(true);
        log.warn("Issue {} escalated after {} attempt(s); created {}", issue.id(), attempts, escalationId);
        return Optional.of(escalationId);
    }

    static String description(Issue issue, int attempts, String failureSummary) {
        List<String> lines = new ArrayList<>();
        lines.add("Automated processing failed after %d attempt(s).".formatted(attempts));
        lines.add("");
        lines.add("## Original Issue #" + issue.id());
        lines.add("");
        lines.add("**" + issue.title() + "**");
        lines.add("");
        lines.add(issue.description().isBlank() ? "_No description._" : issue.description());
        lines.add("");
        lines.add("## Failure Details");
        lines.add("");
        lines.add("```");
        lines.add(failureSummary == null || failureSummary.isBlank() ? "unknown failure" : failureSummary);
        lines.add("```");
        lines.add("");
        lines.add("## Action Required");
        lines.add("");
        lines.add("- Review the failure details and the archived workcell logs.");
        lines.add("- Fix the underlying problem or split the issue into smaller pieces.");
        lines.add("- Reopen #" + issue.id() + " or close it once handled.");
        return String.join("\n", lines);
    }
}
