package com.triagebot.core.nodes;

import com.triagebot.core.events.EventBus;
import com.triagebot.core.events.TriageEvent;
import com.triagebot.core.logging.MdcContext;
import com.triagebot.core.metrics.TriageMetrics;
import com.triagebot.core.model.Issue;
import com.triagebot.core.model.PriorityAssessment;
import com.triagebot.core.model.TriageStage;
import com.triagebot.core.priority.PriorityAssessor;
import com.triagebot.core.state.TriageState;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

@Component
public class AssessPriorityNode {

    private final PriorityAssessor assessor;
    private final EventBus eventBus;
    private final TriageMetrics metrics;

    public AssessPriorityNode(PriorityAssessor assessor, EventBus eventBus, TriageMetrics metrics) {
        this.assessor = assessor;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(TriageState state) {
        int number = state.issueNumber();
        MdcContext.setStage(number, TriageStage.PRIORITY_ASSESSED);
        long start = System.currentTimeMillis();
        try {
            Issue issue = state.issue().orElseThrow();
            PriorityAssessment assessment = assessor.assess(
                    state.classification().orElseThrow(), issue.title(), issue.body(),
                    state.severityHint().orElse(null));

            metrics.recordStageDuration(TriageStage.PRIORITY_ASSESSED.name(), System.currentTimeMillis() - start);
            eventBus.publish(new TriageEvent("issue.priority_assessed", number, TriageStage.PRIORITY_ASSESSED,
                    Map.of("priority", assessment.priority().name(),
                            "complexity", assessment.complexity().name()),
                    Instant.now()));

            return Map.of(
                    "priority", assessment.priority().name(),
                    "complexity", assessment.complexity().name(),
                    "status", TriageStage.PRIORITY_ASSESSED.name());
        } catch (RuntimeException e) {
            return StageFailure.of(number, TriageStage.PRIORITY_ASSESSED, e, eventBus);
        }
    }
}
