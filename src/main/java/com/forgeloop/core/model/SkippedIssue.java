package com.forgeloop.core.model;

/**
 * An issue the scheduler passed over this cycle, with a short diagnostic reason.
 */
public record SkippedIssue(Issue issue, String reason) {

    public String issueId() {
        return issue.id();
    }
}
