package com.forgeloop.core.graph;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forgeloop.core.model.WorkGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Work graph stored as one JSON document ({@code issues} and {@code dependencies}).
 * <p>
 * Every read and every mutation starts by re-reading the file so edits made by other tools are picked up
 * on the next cycle. Mutations rewrite the file atomically through a temp file; issue
 * events are appended to {@code events.jsonl} next to it.
 */
public class FileWorkGraphClient extends InMemoryWorkGraphClient {

    private static final Logger log = LoggerFactory.getLogger(FileWorkGraphClient.class);

    private final Path graphFile;
    private final Path eventsFile;
    private final ObjectMapper objectMapper;

    public FileWorkGraphClient(Path graphFile, ObjectMapper objectMapper) {
        this.graphFile = graphFile;
        this.eventsFile = graphFile.resolveSibling("events.jsonl");
        this.objectMapper = objectMapper;
    }

    @Override
    protected void refresh() {
        replace(readFile());
    }

    public Path graphFile() {
        return graphFile;
    }

    @Override
    protected void afterMutation() {
        WorkGraph snapshot = snapshot();
        try {
            Path parent = graphFile.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, graphFile.getFileName().toString(), ".tmp");
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), snapshot);
            Files.move(temp, graphFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new WorkGraphException("Failed to write work graph " + graphFile, e);
        }
    }

    @Override
    protected void onEvent(IssueEvent event) {
        try {
            Path parent = eventsFile.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            String line = objectMapper.writeValueAsString(event) + System.lineSeparator();
            Files.writeString(eventsFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new WorkGraphException("Failed to append event for issue " + event.issueId(), e);
        }
    }

    private WorkGraph readFile() {
        if (!Files.exists(graphFile)) {
            log.debug("Work graph file {} does not exist yet", graphFile);
            return WorkGraph.empty();
        }
        try {
            return objectMapper.readValue(graphFile.toFile(), WorkGraph.class);
        } catch (IOException e) {
            throw new WorkGraphException("Failed to read work graph " + graphFile, e);
        }
    }
}
