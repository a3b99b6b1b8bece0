package com.forgeloop.core.engine;

import com.forgeloop.core.graph.InMemoryWorkGraphClient;
import com.forgeloop.core.graph.WorkGraphException;
import com.forgeloop.core.metrics.KernelMetrics;
import com.forgeloop.core.model.Issue;
import com.forgeloop.core.model.Priority;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class EscalationServiceTest {

    private InMemoryWorkGraphClient workGraph;
    private SimpleMeterRegistry registry;
    private EscalationService service;

    @BeforeEach
    void setUp() {
        workGraph = new InMemoryWorkGraphClient();
        registry = new SimpleMeterRegistry();
        service = new EscalationService(workGraph, new KernelMetrics(registry));
    }

    @Test
    @DisplayName("Creates a tagged escalation issue linked to the original")
    void createsEscalation() {
        Issue issue = Issue.builder("I3").title("Fix flaky test").priority(Priority.P1).tags("ci").build();
        workGraph.put(issue);

        Optional<String> id = service.escalate(issue, 3, "Gate failures: test");

        Issue escalation = workGraph.load().issue(id.orElseThrow()).orElseThrow();
        assertEquals("[ESCALATION] Fix flaky test", escalation.title());
        assertEquals(Priority.P1, escalation.priority());
        assertEquals(List.of("ci", "escalation", "needs-human"), escalation.tags());
        assertTrue(escalation.isEscalation());
        assertTrue(escalation.description().contains("## Original Issue #I3"));
        assertTrue(escalation.description().contains("Gate failures: test"));
        assertEquals("issue.escalated", workGraph.events("I3").get(0).kind());
        assertEquals("I3", workGraph.events(id.get()).get(0).payload().get("parent_id"));
        assertEquals(1.0, registry.get("forgeloop.escalations.total").tag("created", "true").counter().count());
    }

    @Test
    @DisplayName("Escalations are never escalated again")
    void noRecursiveEscalation() {
        Issue escalation = Issue.builder("I4").title("[ESCALATION] Fix flaky test").tags("escalation").build();
        workGraph.put(escalation);

        assertTrue(service.escalate(escalation, 3, "still failing").isEmpty());
        assertEquals(1, workGraph.load().issues().size());
        assertEquals(1.0, registry.get("forgeloop.escalations.total").tag("created", "false").counter().count());
    }

    @Test
    @DisplayName("A work graph that cannot create the escalation issue does not break the caller")
    void createFailureIsContained() {
        var failing = new InMemoryWorkGraphClient() {
            @Override
            public String createIssue(String title, String description, Priority priority, List<String> tags) {
                throw new WorkGraphException("graph is read-only");
            }
        };
        var failingService = new EscalationService(failing, new KernelMetrics(registry));
        Issue issue = Issue.builder("I3").title("Fix flaky test").build();
        failing.put(issue);

        assertTrue(failingService.escalate(issue, 3, "Gate failures: test").isEmpty());
        assertTrue(failing.events("I3").isEmpty());
        assertEquals(1.0, registry.get("forgeloop.escalations.total").tag("created", "false").counter().count());
    }

    @Test
    @DisplayName("Description states attempts and a fallback when the failure is unknown")
    void description() {
        String text = EscalationService.description(Issue.builder("x").title("T").build(), 2, null);

        assertTrue(text.startsWith("Automated processing failed after 2 attempt(s)."));
        assertTrue(text.contains("unknown failure"));
        assertTrue(text.contains("## Action Required"));
    }
}
