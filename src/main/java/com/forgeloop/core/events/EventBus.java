package com.forgeloop.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for kernel events.
 * <p>
 * Supports per-issue subscriptions and global subscriptions that receive all events.
 * Safe for concurrent publish from dispatch lanes.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<KernelEvent>>> issueSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<KernelEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to the subscribers of its issue and to all global subscribers.
     * A failing subscriber never affects the publisher or other subscribers.
     */
    public void publish(KernelEvent event) {
        log.debug("Publishing event: {} for issue {}", event.eventType(), event.issueId());

        List<Consumer<KernelEvent>> issueSubs = issueSubscribers.get(event.issueId());
        if (issueSubs != null) {
            for (Consumer<KernelEvent> subscriber : issueSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<KernelEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    public Subscription subscribe(String issueId, Consumer<KernelEvent> consumer) {
        issueSubscribers.computeIfAbsent(issueId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to issue {}", issueId);
        return () -> {
            CopyOnWriteArrayList<Consumer<KernelEvent>> subs = issueSubscribers.get(issueId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<KernelEvent> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<KernelEvent> subscriber, KernelEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
