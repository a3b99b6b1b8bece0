package com.forgeloop.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while the kernel processes an issue.
 *
 * @param eventType  event type (e.g. "workcell.created", "issue.completed", "issue.escalated")
 * @param issueId    the issue this event belongs to
 * @param workcellId the workcell involved (nullable for issue-level events)
 * @param payload    arbitrary key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record KernelEvent(
    String eventType,
    String issueId,
    String workcellId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static KernelEvent of(String eventType, String issueId, String workcellId, Map<String, Object> payload) {
        return new KernelEvent(eventType, issueId, workcellId, payload, Instant.now());
    }
}
