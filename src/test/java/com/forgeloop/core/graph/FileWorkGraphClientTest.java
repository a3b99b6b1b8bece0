package com.forgeloop.core.graph;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forgeloop.core.config.JsonConfig;
import com.forgeloop.core.model.IssueStatus;
import com.forgeloop.core.model.Priority;
import com.forgeloop.core.model.WorkGraph;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FileWorkGraphClientTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = JsonConfig.kernelObjectMapper();

    private Path writeGraph(String json) throws Exception {
        Path file = tempDir.resolve("graph.json");
        Files.writeString(file, json);
        return file;
    }

    @Test
    @DisplayName("Missing file reads as an empty graph")
    void missingFile() {
        var client = new FileWorkGraphClient(tempDir.resolve("none.json"), mapper);
        assertTrue(client.load().isEmpty());
    }

    @Test
    @DisplayName("Reads issues and dependencies from the JSON document")
    void readsGraph() throws Exception {
        Path file = writeGraph("""
                {"issues": [{"id": "a", "status": "done"}, {"id": "b", "risk": "high"}],
                 "dependencies": [{"from_id": "a", "to_id": "b", "dep_type": "blocks"}]}
                """);

        WorkGraph graph = new FileWorkGraphClient(file, mapper).load();

        assertEquals(2, graph.issues().size());
        assertTrue(graph.unresolvedBlockers("b").isEmpty());
    }

    @Test
    @DisplayName("Mutations are written back and visible to a fresh client")
    void writesBack() throws Exception {
        Path file = writeGraph("""
                {"issues": [{"id": "a"}], "dependencies": []}
                """);
        var client = new FileWorkGraphClient(file, mapper);

        client.updateStatus("a", IssueStatus.RUNNING);
        client.incrementAttempts("a");
        String created = client.createIssue("[ESCALATION] a", "body", Priority.P0, List.of("escalation"));

        WorkGraph reread = new FileWorkGraphClient(file, mapper).load();
        assertEquals(IssueStatus.RUNNING, reread.issue("a").orElseThrow().status());
        assertEquals(1, reread.issue("a").orElseThrow().attempts());
        assertTrue(reread.issue(created).orElseThrow().isEscalation());
    }

    @Test
    @DisplayName("External edits are picked up on the next load")
    void externalEdits() throws Exception {
        Path file = writeGraph("""
                {"issues": [{"id": "a"}]}
                """);
        var client = new FileWorkGraphClient(file, mapper);
        assertEquals(1, client.load().issues().size());

        Files.writeString(file, """
                {"issues": [{"id": "a"}, {"id": "b"}]}
                """);

        assertEquals(2, client.load().issues().size());
    }

    @Test
    @DisplayName("Events are appended to events.jsonl next to the graph file")
    void eventsFile() throws Exception {
        Path file = writeGraph("""
                {"issues": [{"id": "a"}]}
                """);
        var client = new FileWorkGraphClient(file, mapper);

        client.addEvent("a", "workcell.created", Map.of("toolchain", "codex"));
        client.addEvent("a", "issue.completed", Map.of());

        List<String> lines = Files.readAllLines(tempDir.resolve("events.jsonl"));
        assertEquals(2, lines.size());
        assertTrue(lines.get(0).contains("workcell.created"));
    }

    @Test
    @DisplayName("Malformed JSON is reported as WorkGraphException")
    void malformed() throws Exception {
        Path file = writeGraph("{not json");
        assertThrows(WorkGraphException.class, () -> new FileWorkGraphClient(file, mapper).load());
    }
}
