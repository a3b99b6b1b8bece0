package com.forgeloop.core.graph;

import com.forgeloop.core.model.IssueStatus;
import com.forgeloop.core.model.Priority;
import com.forgeloop.core.model.WorkGraph;

import java.util.List;
import java.util.Map;

/**
 * Access to the persistent work graph. Every call is its own unit of work;
 * implementations must be safe to call from concurrent dispatch lanes for
 * different issues.
 * <p>
 * Failures are reported as {@link WorkGraphException}.
 */
public interface WorkGraphClient {

    /** Fresh snapshot of every issue and dependency. */
    WorkGraph load();

    /** Snapshot narrowed to one issue, its direct blockers and the issues it blocks. */
    default WorkGraph filterToIssue(String issueId) {
        return load().filterToIssue(issueId);
    }

    void updateStatus(String issueId, IssueStatus status);

    /**
     * Increments the attempt counter and returns the new value.
     */
    int incrementAttempts(String issueId);

    void addEvent(String issueId, String kind, Map<String, Object> payload);

    /**
     * Creates a new open issue and returns its id.
     */
    String createIssue(String title, String description, Priority priority, List<String> tags);
}
