package com.triagebot.core.nodes;

import com.triagebot.core.events.EventBus;
import com.triagebot.core.events.TriageEvent;
import com.triagebot.core.model.TriageStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;

/**
 * Builds the state update for a stage whose transition failed.
 */
final class StageFailure {

    private static final Logger log = LoggerFactory.getLogger(StageFailure.class);

    private StageFailure() {}

    static Map<String, Object> of(int issueNumber, TriageStage stage, Exception error, EventBus eventBus) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        String errorType = error.getClass().getSimpleName();
        log.warn("Issue #{} failed at {}: {} {}", issueNumber, stage, errorType, message);

        eventBus.publish(new TriageEvent("issue.failed", issueNumber, TriageStage.FAILED,
                Map.of("failedStage", stage.name(), "errorType", errorType, "message", message),
                Instant.now()));

        return Map.of(
                "status", TriageStage.FAILED.name(),
                "failedStage", stage.name(),
                "errorType", errorType,
                "errorMessage", message);
    }
}
