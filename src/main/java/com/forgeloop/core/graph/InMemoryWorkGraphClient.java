package com.forgeloop.core.graph;

import com.forgeloop.core.model.Dependency;
import com.forgeloop.core.model.Issue;
import com.forgeloop.core.model.IssueStatus;
import com.forgeloop.core.model.Priority;
import com.forgeloop.core.model.WorkGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

/**
 * Work graph held in memory. Thread-safe; mutations are serialized by a single lock.
 * Subclasses can back it with external storage through {@link #refresh()},
 * {@link #afterMutation()} and {@link #onEvent(IssueEvent)}.
 */
public class InMemoryWorkGraphClient implements WorkGraphClient {

    private static final Logger log = LoggerFactory.getLogger(InMemoryWorkGraphClient.class);

    protected final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Issue> issues = new LinkedHashMap<>();
    private final List<Dependency> dependencies = new ArrayList<>();
    private final List<IssueEvent> events = new ArrayList<>();
    private final AtomicInteger createdCounter = new AtomicInteger();

    public InMemoryWorkGraphClient() {
    }

    public InMemoryWorkGraphClient(Collection<Issue> issues, Collection<Dependency> dependencies) {
        replace(new WorkGraph(List.copyOf(issues), List.copyOf(dependencies)));
    }

    @Override
    public WorkGraph load() {
        lock.lock();
        try {
            refresh();
            return snapshot();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void updateStatus(String issueId, IssueStatus status) {
        mutate(issueId, issue -> issue.withStatus(status));
        log.debug("Issue {} -> {}", issueId, status.wireName());
    }

    @Override
    public int incrementAttempts(String issueId) {
        return mutate(issueId, issue -> issue.withAttempts(issue.attempts() + 1)).attempts();
    }

    @Override
    public void addEvent(String issueId, String kind, Map<String, Object> payload) {
        var event = new IssueEvent(issueId, kind,
                payload == null ? Map.of() : new LinkedHashMap<>(payload), Instant.now());
        lock.lock();
        try {
            events.add(event);
            onEvent(event);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String createIssue(String title, String description, Priority priority, List<String> tags) {
        lock.lock();
        try {
            refresh();
            String id;
            do {
                id = "fl-%04d".formatted(createdCounter.incrementAndGet());
            } while (issues.containsKey(id));
            Issue issue = Issue.builder(id)
                    .title(title)
                    .description(description)
                    .priority(priority)
                    .tags(tags)
                    .status(IssueStatus.OPEN)
                    .build();
            issues.put(id, issue);
            afterMutation();
            log.info("Created issue {}: {}", id, title);
            return id;
        } finally {
            lock.unlock();
        }
    }

    /** Adds or replaces an issue. */
    public void put(Issue issue) {
        lock.lock();
        try {
            refresh();
            issues.put(issue.id(), issue);
            afterMutation();
        } finally {
            lock.unlock();
        }
    }

    public void addDependency(Dependency dependency) {
        lock.lock();
        try {
            refresh();
            dependencies.add(dependency);
            afterMutation();
        } finally {
            lock.unlock();
        }
    }

    public List<IssueEvent> events(String issueId) {
        lock.lock();
        try {
            return events.stream().filter(e -> e.issueId().equals(issueId)).toList();
        } finally {
            lock.unlock();
        }
    }

    public List<IssueEvent> events() {
        lock.lock();
        try {
            return List.copyOf(events);
        } finally {
            lock.unlock();
        }
    }

    /** Current in-memory state. Caller must hold the lock. */
    protected WorkGraph snapshot() {
        return new WorkGraph(new ArrayList<>(issues.values()), new ArrayList<>(dependencies));
    }

    /** Replaces the whole graph, e.g. after re-reading a backing file. */
    protected void replace(WorkGraph graph) {
        lock.lock();
        try {
            issues.clear();
            for (Issue issue : graph.issues()) {
                issues.put(issue.id(), issue);
            }
            dependencies.clear();
            dependencies.addAll(graph.dependencies());
        } finally {
            lock.unlock();
        }
    }

    /** Called with the lock held before every read or change. */
    protected void refresh() {
    }

    /** Called with the lock held after every change to issues or dependencies. */
    protected void afterMutation() {
    }

    /** Called with the lock held after every recorded event. */
    protected void onEvent(IssueEvent event) {
    }

    private Issue mutate(String issueId, UnaryOperator<Issue> change) {
        lock.lock();
        try {
            refresh();
            Issue current = issues.get(issueId);
            if (current == null) {
                throw new WorkGraphException("Unknown issue: " + issueId);
            }
            Issue updated = change.apply(current);
            issues.put(issueId, updated);
            afterMutation();
            return updated;
        } finally {
            lock.unlock();
        }
    }
}
