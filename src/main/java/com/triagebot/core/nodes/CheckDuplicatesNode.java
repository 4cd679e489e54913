package com.triagebot.core.nodes;

import com.triagebot.core.config.TriageProperties;
import com.triagebot.core.duplicates.DuplicateDetector;
import com.triagebot.core.embedding.EmbeddingVector;
import com.triagebot.core.error.StorageUnavailableException;
import com.triagebot.core.events.EventBus;
import com.triagebot.core.events.TriageEvent;
import com.triagebot.core.logging.MdcContext;
import com.triagebot.core.memory.IssueMemoryStore;
import com.triagebot.core.metrics.TriageMetrics;
import com.triagebot.core.model.Issue;
import com.triagebot.core.model.SimilarityMatch;
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
 * Embeds the issue once and queries the memory store for likely duplicates.
 * <p>
 * The embedding is kept in state for the store stage. An unavailable store degrades
 * this stage to an unchecked, empty result; a dimension mismatch fails the issue.
 */
@Component
public class CheckDuplicatesNode {

    private static final Logger log = LoggerFactory.getLogger(CheckDuplicatesNode.class);

    private final DuplicateDetector detector;
    private final IssueMemoryStore store;
    private final TriageProperties.Duplicates settings;
    private final EventBus eventBus;
    private final TriageMetrics metrics;

    public CheckDuplicatesNode(DuplicateDetector detector,
                               @Autowired(required = false) IssueMemoryStore store,
                               TriageProperties properties, EventBus eventBus, TriageMetrics metrics) {
        this.detector = detector;
        this.store = store;
        this.settings = properties.getDuplicates();
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(TriageState state) {
        int number = state.issueNumber();
        MdcContext.setStage(number, TriageStage.DUPLICATE_CHECKED);
        long start = System.currentTimeMillis();
        try {
            if (store == null) {
                throw new IllegalStateException("Duplicate check requires a memory store");
            }
            Issue issue = state.issue().orElseThrow();
            EmbeddingVector embedding = detector.embed(issue, store.dimension());

            try {
                List<SimilarityMatch> matches = detector.findDuplicates(
                        issue, embedding, store, settings.getThreshold(), settings.getMaxResults());

                metrics.recordStageDuration(TriageStage.DUPLICATE_CHECKED.name(), System.currentTimeMillis() - start);
                metrics.recordDuplicatesFound(matches.size());
                eventBus.publish(new TriageEvent("issue.duplicates_checked", number, TriageStage.DUPLICATE_CHECKED,
                        Map.of("duplicates", matches.size(), "degraded", false), Instant.now()));

                return Map.of(
                        "embedding", embedding,
                        "duplicates", matches,
                        "duplicatesChecked", true,
                        "status", TriageStage.DUPLICATE_CHECKED.name());
            } catch (StorageUnavailableException e) {
                log.warn("Duplicate check skipped for issue #{}: {}", number, e.getMessage());
                metrics.recordDegradedStage(TriageStage.DUPLICATE_CHECKED.name());
                eventBus.publish(new TriageEvent("issue.duplicates_checked", number, TriageStage.DUPLICATE_CHECKED,
                        Map.of("duplicates", 0, "degraded", true), Instant.now()));

                return Map.of(
                        "embedding", embedding,
                        "duplicates", List.of(),
                        "duplicatesChecked", false,
                        "warnings", List.of("Duplicate check skipped: " + e.getMessage()),
                        "status", TriageStage.DUPLICATE_CHECKED.name());
            }
        } catch (RuntimeException e) {
            return StageFailure.of(number, TriageStage.DUPLICATE_CHECKED, e, eventBus);
        }
    }
}
