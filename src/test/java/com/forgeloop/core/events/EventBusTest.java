package com.forgeloop.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to issue subscriber")
        void deliversToIssueSubscriber() {
            List<KernelEvent> received = new ArrayList<>();
            eventBus.subscribe("I1", received::add);

            var event = KernelEvent.of("workcell.created", "I1", "wc-1", Map.of("toolchain", "codex"));
            eventBus.publish(event);

            assertEquals(List.of(event), received);
        }

        @Test
        @DisplayName("does not deliver to subscribers of a different issue")
        void doesNotDeliverToDifferentIssue() {
            List<KernelEvent> received = new ArrayList<>();
            eventBus.subscribe("I2", received::add);

            eventBus.publish(KernelEvent.of("issue.completed", "I1", null, Map.of()));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("global subscriber receives events from all issues")
        void globalSubscriber() {
            List<KernelEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(KernelEvent.of("issue.started", "I1", null, Map.of()));
            eventBus.publish(KernelEvent.of("issue.started", "I2", null, Map.of()));

            assertEquals(List.of("I1", "I2"), received.stream().map(KernelEvent::issueId).toList());
        }
    }

    @Nested
    @DisplayName("isolation")
    class IsolationTests {

        @Test
        @DisplayName("a throwing subscriber does not stop delivery to others")
        void throwingSubscriber() {
            List<KernelEvent> received = new ArrayList<>();
            eventBus.subscribe("I1", e -> {
                throw new IllegalStateException("boom");
            });
            eventBus.subscribeAll(received::add);

            assertDoesNotThrow(() -> eventBus.publish(KernelEvent.of("issue.failed", "I1", null, Map.of())));
            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("unsubscribing stops delivery of future events")
        void unsubscribe() {
            List<KernelEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe("I1", received::add);

            eventBus.publish(KernelEvent.of("issue.started", "I1", null, Map.of()));
            subscription.unsubscribe();
            eventBus.publish(KernelEvent.of("issue.completed", "I1", null, Map.of()));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("concurrent publishers lose no events")
        void concurrentPublish() {
            List<KernelEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribeAll(received::add);

            var futures = new ArrayList<CompletableFuture<Void>>();
            for (int i = 0; i < 20; i++) {
                String issueId = "I" + i;
                futures.add(CompletableFuture.runAsync(() ->
                        eventBus.publish(KernelEvent.of("issue.started", issueId, null, Map.of()))));
            }
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

            assertEquals(20, received.size());
        }
    }
}
