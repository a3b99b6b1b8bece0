package com.forgeloop.core.graph;

import com.forgeloop.core.model.Dependency;
import com.forgeloop.core.model.Issue;
import com.forgeloop.core.model.IssueStatus;
import com.forgeloop.core.model.Priority;
import com.forgeloop.core.model.WorkGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryWorkGraphClientTest {

    private InMemoryWorkGraphClient client;

    @BeforeEach
    void setUp() {
        client = new InMemoryWorkGraphClient(
                List.of(Issue.builder("a").build(), Issue.builder("b").build()),
                List.of(Dependency.blocks("a", "b")));
    }

    @Test
    @DisplayName("load returns a snapshot unaffected by later mutations")
    void snapshot() {
        WorkGraph before = client.load();
        client.updateStatus("a", IssueStatus.DONE);

        assertEquals(IssueStatus.OPEN, before.issue("a").orElseThrow().status());
        assertEquals(IssueStatus.DONE, client.load().issue("a").orElseThrow().status());
        assertEquals(1, client.load().dependencies().size());
    }

    @Test
    @DisplayName("incrementAttempts returns the new count")
    void incrementAttempts() {
        assertEquals(1, client.incrementAttempts("a"));
        assertEquals(2, client.incrementAttempts("a"));
        assertEquals(2, client.load().issue("a").orElseThrow().attempts());
    }

    @Test
    @DisplayName("Concurrent increments are not lost")
    void concurrentIncrements() {
        var futures = new ArrayList<CompletableFuture<Void>>();
        for (int i = 0; i < 50; i++) {
            futures.add(CompletableFuture.runAsync(() -> client.incrementAttempts("b")));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        assertEquals(50, client.load().issue("b").orElseThrow().attempts());
    }

    @Test
    @DisplayName("Unknown issues are reported as WorkGraphException")
    void unknownIssue() {
        assertThrows(WorkGraphException.class, () -> client.updateStatus("zzz", IssueStatus.DONE));
        assertThrows(WorkGraphException.class, () -> client.incrementAttempts("zzz"));
    }

    @Test
    @DisplayName("createIssue adds an open issue with a fresh id")
    void createIssue() {
        String id = client.createIssue("Follow up", "details", Priority.P1, List.of("escalation"));

        Issue created = client.load().issue(id).orElseThrow();
        assertEquals("Follow up", created.title());
        assertEquals(IssueStatus.OPEN, created.status());
        assertEquals(Priority.P1, created.priority());
        assertEquals(List.of("escalation"), created.tags());
        assertNotEquals(id, client.createIssue("Another", "", Priority.P2, List.of()));
    }

    @Test
    @DisplayName("Events are kept per issue")
    void events() {
        client.addEvent("a", "workcell.created", Map.of("toolchain", "codex"));
        client.addEvent("b", "issue.completed", null);

        assertEquals(1, client.events("a").size());
        assertEquals("workcell.created", client.events("a").get(0).kind());
        assertTrue(client.events("b").get(0).payload().isEmpty());
        assertEquals(2, client.events().size());
    }

    @Test
    @DisplayName("filterToIssue narrows the loaded graph")
    void filter() {
        client.put(Issue.builder("c").build());
        assertEquals(2, client.filterToIssue("b").issues().size());
    }
}
