package com.triagebot.core.nodes;

import com.triagebot.core.error.SourceUnavailableException;
import com.triagebot.core.error.TriageException;
import com.triagebot.core.events.EventBus;
import com.triagebot.core.events.TriageEvent;
import com.triagebot.core.logging.MdcContext;
import com.triagebot.core.metrics.TriageMetrics;
import com.triagebot.core.model.Issue;
import com.triagebot.core.model.TriageStage;
import com.triagebot.core.state.TriageState;
import com.triagebot.source.IssueSource;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

/**
 * Entry stage. Uses the issue supplied with the run, or fetches the current version
 * from the {@link IssueSource} when the run asks for a refresh.
 */
@Component
public class FetchIssueNode {

    private final IssueSource issueSource;
    private final EventBus eventBus;
    private final TriageMetrics metrics;

    public FetchIssueNode(@Autowired(required = false) IssueSource issueSource,
                          EventBus eventBus, TriageMetrics metrics) {
        this.issueSource = issueSource;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(TriageState state) {
        int number = state.issueNumber();
        MdcContext.setStage(number, TriageStage.FETCHED);
        long start = System.currentTimeMillis();
        try {
            Issue issue = state.refresh() ? fetch(number) : state.issue()
                    .orElseThrow(() -> new TriageException("No issue supplied for #" + number));

            metrics.recordStageDuration(TriageStage.FETCHED.name(), System.currentTimeMillis() - start);
            eventBus.publish(new TriageEvent("issue.fetched", issue.number(), TriageStage.FETCHED,
                    Map.of("refreshed", state.refresh()), Instant.now()));

            return Map.of(
                    "issue", issue,
                    "issueNumber", issue.number(),
                    "status", TriageStage.FETCHED.name());
        } catch (RuntimeException e) {
            return StageFailure.of(number, TriageStage.FETCHED, e, eventBus);
        }
    }

    private Issue fetch(int number) {
        if (issueSource == null) {
            throw new SourceUnavailableException("No issue source configured to fetch issue #" + number);
        }
        Issue issue;
        try {
            issue = issueSource.fetchIssue(number);
        } catch (SourceUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SourceUnavailableException("Failed to fetch issue #" + number + ": " + e.getMessage(), e);
        }
        if (issue == null) {
            throw new SourceUnavailableException("Issue #" + number + " not found");
        }
        return issue;
    }
}
