package com.triagebot.core.events;

import com.triagebot.core.model.TriageStage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

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

    private static TriageEvent event(String type, int issueNumber) {
        return event(type, issueNumber, TriageStage.CLASSIFIED);
    }

    private static TriageEvent event(String type, int issueNumber, TriageStage stage) {
        return new TriageEvent(type, issueNumber, stage, Map.of(), Instant.now());
    }

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers event to issue subscriber")
        void deliversToIssueSubscriber() {
            List<TriageEvent> received = new ArrayList<>();
            eventBus.subscribe(7, received::add);

            eventBus.publish(event("issue.classified", 7));

            assertEquals(1, received.size());
            assertEquals("issue.classified", received.get(0).eventType());
        }

        @Test
        @DisplayName("does not deliver events for other issues")
        void filtersByIssue() {
            List<TriageEvent> received = new ArrayList<>();
            eventBus.subscribe(7, received::add);

            eventBus.publish(event("issue.classified", 8));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("global subscriber receives every event")
        void globalSubscriber() {
            List<TriageEvent> received = new ArrayList<>();
            eventBus.subscribeAll(received::add);

            eventBus.publish(event("issue.classified", 1));
            eventBus.publish(event("issue.classified", 2));

            assertEquals(2, received.size());
        }

        @Test
        @DisplayName("unsubscribe stops delivery")
        void unsubscribe() {
            List<TriageEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe(7, received::add);
            subscription.unsubscribe();

            eventBus.publish(event("issue.classified", 7));

            assertTrue(received.isEmpty());
        }
    }

    @Nested
    @DisplayName("stage filters")
    class StageFilterTests {

        @Test
        @DisplayName("issue subscription with stages skips other stages")
        void issueAndStage() {
            List<TriageEvent> received = new ArrayList<>();
            eventBus.subscribe(7, Set.of(TriageStage.STORED), received::add);

            eventBus.publish(event("issue.classified", 7, TriageStage.CLASSIFIED));
            eventBus.publish(event("issue.stored", 8, TriageStage.STORED));
            eventBus.publish(event("issue.stored", 7, TriageStage.STORED));

            assertEquals(1, received.size());
            assertEquals(7, received.get(0).issueNumber());
            assertEquals(TriageStage.STORED, received.get(0).stage());
        }

        @Test
        @DisplayName("stage subscription spans all issues")
        void stageAcrossIssues() {
            List<Integer> failed = new ArrayList<>();
            eventBus.subscribeToStages(EnumSet.of(TriageStage.FAILED), e -> failed.add(e.issueNumber()));

            eventBus.publish(event("issue.failed", 3, TriageStage.FAILED));
            eventBus.publish(event("issue.classified", 4, TriageStage.CLASSIFIED));
            eventBus.publish(event("issue.failed", 5, TriageStage.FAILED));

            assertEquals(List.of(3, 5), failed);
        }

        @Test
        @DisplayName("outcome subscription receives DONE and FAILED only")
        void outcomes() {
            List<String> received = new ArrayList<>();
            eventBus.subscribeToOutcomes(e -> received.add(e.eventType()));

            eventBus.publish(event("issue.fetched", 1, TriageStage.FETCHED));
            eventBus.publish(event("issue.triaged", 1, TriageStage.DONE));
            eventBus.publish(event("issue.failed", 2, TriageStage.FAILED));

            assertEquals(List.of("issue.triaged", "issue.failed"), received);
        }

        @Test
        @DisplayName("batch events without a stage reach only unfiltered subscribers")
        void batchEvents() {
            List<TriageEvent> filtered = new ArrayList<>();
            List<TriageEvent> unfiltered = new ArrayList<>();
            eventBus.subscribeToOutcomes(filtered::add);
            eventBus.subscribeAll(unfiltered::add);

            eventBus.publish(event("batch.completed", 0, null));

            assertTrue(filtered.isEmpty());
            assertEquals(1, unfiltered.size());
        }

        @Test
        @DisplayName("empty stage filter is rejected")
        void emptyFilter() {
            assertThrows(IllegalArgumentException.class,
                    () -> eventBus.subscribeToStages(Set.of(), e -> { }));
        }

        @Test
        @DisplayName("unsubscribe removes a stage subscription")
        void unsubscribeStage() {
            List<TriageEvent> received = new ArrayList<>();
            EventBus.Subscription subscription =
                    eventBus.subscribeToStages(EnumSet.of(TriageStage.DONE), received::add);
            subscription.unsubscribe();

            eventBus.publish(event("issue.triaged", 1, TriageStage.DONE));

            assertTrue(received.isEmpty());
        }
    }

    @Test
    @DisplayName("a throwing subscriber does not affect other subscribers")
    void isolatesFailingSubscriber() {
        List<TriageEvent> received = new ArrayList<>();
        eventBus.subscribeAll(e -> {
            throw new IllegalStateException("boom");
        });
        eventBus.subscribeAll(received::add);

        assertDoesNotThrow(() -> eventBus.publish(event("issue.failed", 3)));
        assertEquals(1, received.size());
    }
}
