package com.triagebot.core.events;

import com.triagebot.core.model.TriageStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub for triage events, the pipeline's observer hook.
 * <p>
 * A subscription can be narrowed to one issue, to a set of stages, or both. Batch-level
 * events carry no stage and reach only subscriptions without a stage filter.
 * Thread-safe for concurrent publish and subscribe; a failing subscriber never
 * affects the pipeline or other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private static final int ANY_ISSUE = -1;

    private final CopyOnWriteArrayList<Subscriber> subscribers = new CopyOnWriteArrayList<>();

    public void publish(TriageEvent event) {
        log.debug("Publishing event: {} for issue #{} at {}", event.eventType(), event.issueNumber(), event.stage());
        for (Subscriber subscriber : subscribers) {
            if (subscriber.accepts(event)) {
                deliverSafely(subscriber.consumer(), event);
            }
        }
    }

    /**
     * Subscribe to every event for a single issue.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(int issueNumber, Consumer<TriageEvent> consumer) {
        return register(new Subscriber(issueNumber, Set.of(), consumer));
    }

    /**
     * Subscribe to a single issue's events for the given stages only.
     */
    public Subscription subscribe(int issueNumber, Set<TriageStage> stages, Consumer<TriageEvent> consumer) {
        return register(new Subscriber(issueNumber, requireStages(stages), consumer));
    }

    /**
     * Subscribe to the given stages across all issues, e.g. {@code FAILED} for alerting.
     */
    public Subscription subscribeToStages(Set<TriageStage> stages, Consumer<TriageEvent> consumer) {
        return register(new Subscriber(ANY_ISSUE, requireStages(stages), consumer));
    }

    /**
     * Receives exactly one event per triaged issue: the {@code DONE} or {@code FAILED} one.
     */
    public Subscription subscribeToOutcomes(Consumer<TriageEvent> consumer) {
        return subscribeToStages(EnumSet.of(TriageStage.DONE, TriageStage.FAILED), consumer);
    }

    public Subscription subscribeAll(Consumer<TriageEvent> consumer) {
        return register(new Subscriber(ANY_ISSUE, Set.of(), consumer));
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private Subscription register(Subscriber subscriber) {
        subscribers.add(subscriber);
        log.debug("Subscribed to {} at stages {}",
                subscriber.issueNumber() == ANY_ISSUE ? "all issues" : "issue #" + subscriber.issueNumber(),
                subscriber.stages().isEmpty() ? "any" : subscriber.stages());
        return () -> subscribers.remove(subscriber);
    }

    private static Set<TriageStage> requireStages(Set<TriageStage> stages) {
        if (stages == null || stages.isEmpty()) {
            throw new IllegalArgumentException("Stage filter must name at least one stage");
        }
        return EnumSet.copyOf(stages);
    }

    private void deliverSafely(Consumer<TriageEvent> consumer, TriageEvent event) {
        try {
            consumer.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }

    /** Empty {@code stages} means any stage, including batch events without one. */
    private record Subscriber(int issueNumber, Set<TriageStage> stages, Consumer<TriageEvent> consumer) {

        boolean accepts(TriageEvent event) {
            if (issueNumber != ANY_ISSUE && issueNumber != event.issueNumber()) {
                return false;
            }
            return stages.isEmpty() || (event.stage() != null && stages.contains(event.stage()));
        }
    }
}
