package com.triagebot.core.nodes;

import com.triagebot.core.duplicates.DuplicateDetector;
import com.triagebot.core.embedding.EmbeddingVector;
import com.triagebot.core.events.EventBus;
import com.triagebot.core.events.TriageEvent;
import com.triagebot.core.logging.MdcContext;
import com.triagebot.core.memory.IssueMemoryStore;
import com.triagebot.core.metrics.TriageMetrics;
import com.triagebot.core.model.Issue;
import com.triagebot.core.model.IssueRecord;
import com.triagebot.core.model.TriageStage;
import com.triagebot.core.state.TriageState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Upserts the triaged issue into the memory store.
 * <p>
 * Nothing computed so far is rolled back when the write fails: the decision is still
 * returned, marked as not stored and carrying the failure as a warning.
 */
@Component
public class StoreIssueNode {

    private static final Logger log = LoggerFactory.getLogger(StoreIssueNode.class);

    private final IssueMemoryStore store;
    private final DuplicateDetector detector;
    private final EventBus eventBus;
    private final TriageMetrics metrics;

    public StoreIssueNode(@Autowired(required = false) IssueMemoryStore store, DuplicateDetector detector,
                          EventBus eventBus, TriageMetrics metrics) {
        this.store = store;
        this.detector = detector;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(TriageState state) {
        int number = state.issueNumber();
        MdcContext.setStage(number, TriageStage.STORED);
        long start = System.currentTimeMillis();

        IssueRecord record;
        try {
            if (store == null) {
                throw new IllegalStateException("Store stage requires a memory store");
            }
            Issue issue = state.issue().orElseThrow();
            EmbeddingVector embedding = state.embedding()
                    .orElseGet(() -> detector.embed(issue, store.dimension()));
            record = new IssueRecord(issue.number(), issue.title(), issue.body(), embedding,
                    state.classification().orElseThrow().labels(),
                    state.priority().orElse(null),
                    Instant.now());
        } catch (RuntimeException e) {
            return StageFailure.of(number, TriageStage.STORED, e, eventBus);
        }

        try {
            store.upsert(record);
            metrics.recordStageDuration(TriageStage.STORED.name(), System.currentTimeMillis() - start);
            eventBus.publish(new TriageEvent("issue.stored", number, TriageStage.STORED,
                    Map.of("stored", true), Instant.now()));
            return Map.of(
                    "stored", true,
                    "status", TriageStage.STORED.name());
        } catch (RuntimeException e) {
            log.warn("Issue #{} triaged but not stored: {}", number, e.getMessage());
            metrics.recordDegradedStage(TriageStage.STORED.name());
            eventBus.publish(new TriageEvent("issue.stored", number, TriageStage.STORED,
                    Map.of("stored", false), Instant.now()));
            return Map.of(
                    "stored", false,
                    "warnings", List.of("Store write failed: " + e.getMessage()),
                    "status", TriageStage.STORED.name());
        }
    }
}
