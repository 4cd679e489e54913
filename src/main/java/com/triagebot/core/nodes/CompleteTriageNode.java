package com.triagebot.core.nodes;

import com.triagebot.core.events.EventBus;
import com.triagebot.core.events.TriageEvent;
import com.triagebot.core.logging.MdcContext;
import com.triagebot.core.model.TriageStage;
import com.triagebot.core.state.TriageState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

/**
 * Terminal success stage.
 */
@Component
public class CompleteTriageNode {

    private static final Logger log = LoggerFactory.getLogger(CompleteTriageNode.class);

    private final EventBus eventBus;

    public CompleteTriageNode(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(TriageState state) {
        int number = state.issueNumber();
        MdcContext.setStage(number, TriageStage.DONE);

        String priority = state.priority().map(Enum::name).orElse("");
        String complexity = state.complexity().map(Enum::name).orElse("");
        log.info("Issue #{} triaged: priority={}, complexity={}, duplicates={}, stored={}, warnings={}",
                number, priority, complexity, state.duplicates().size(), state.stored(), state.warnings().size());

        eventBus.publish(new TriageEvent("issue.triaged", number, TriageStage.DONE,
                Map.of("priority", priority,
                        "complexity", complexity,
                        "duplicates", state.duplicates().size(),
                        "stored", state.stored()),
                Instant.now()));

        return Map.of("status", TriageStage.DONE.name());
    }
}
