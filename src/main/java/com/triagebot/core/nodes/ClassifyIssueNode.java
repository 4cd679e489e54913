package com.triagebot.core.nodes;

import com.triagebot.core.classifier.KeywordClassifier;
import com.triagebot.core.events.EventBus;
import com.triagebot.core.events.TriageEvent;
import com.triagebot.core.logging.MdcContext;
import com.triagebot.core.metrics.TriageMetrics;
import com.triagebot.core.model.ClassificationResult;
import com.triagebot.core.model.Issue;
import com.triagebot.core.model.TriageStage;
import com.triagebot.core.state.TriageState;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Scores the issue against the category table and selects its labels.
 */
@Component
public class ClassifyIssueNode {

    private final KeywordClassifier classifier;
    private final EventBus eventBus;
    private final TriageMetrics metrics;

    public ClassifyIssueNode(KeywordClassifier classifier, EventBus eventBus, TriageMetrics metrics) {
        this.classifier = classifier;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(TriageState state) {
        int number = state.issueNumber();
        MdcContext.setStage(number, TriageStage.CLASSIFIED);
        long start = System.currentTimeMillis();
        try {
            Issue issue = state.issue().orElseThrow();
            ClassificationResult classification = classifier.classify(issue.title(), issue.body());

            metrics.recordStageDuration(TriageStage.CLASSIFIED.name(), System.currentTimeMillis() - start);
            eventBus.publish(new TriageEvent("issue.classified", number, TriageStage.CLASSIFIED,
                    Map.of("labels", List.copyOf(classification.labels()),
                            "confidence", classification.confidence()),
                    Instant.now()));

            return Map.of(
                    "classification", classification,
                    "status", TriageStage.CLASSIFIED.name());
        } catch (RuntimeException e) {
            return StageFailure.of(number, TriageStage.CLASSIFIED, e, eventBus);
        }
    }
}
