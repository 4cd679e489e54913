package com.triagebot.core.engine;

import com.triagebot.core.config.TriageProperties;
import com.triagebot.core.error.SourceUnavailableException;
import com.triagebot.core.events.EventBus;
import com.triagebot.core.events.TriageEvent;
import com.triagebot.core.graph.TriageGraph;
import com.triagebot.core.logging.MdcContext;
import com.triagebot.core.metrics.TriageMetrics;
import com.triagebot.core.model.BatchReport;
import com.triagebot.core.model.FailureRecord;
import com.triagebot.core.model.Issue;
import com.triagebot.core.model.Priority;
import com.triagebot.core.model.TriageDecision;
import com.triagebot.core.model.TriageOutcome;
import com.triagebot.core.model.TriageStage;
import com.triagebot.core.state.TriageState;
import com.triagebot.source.IssueSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point of the triage pipeline.
 * <p>
 * Builds the initial graph state for an issue, invokes the compiled {@link TriageGraph}
 * and turns the final state into a {@link TriageOutcome}. Individual failures are always
 * returned as outcomes, never thrown.
 */
@Service
public class TriageEngine {

    private static final Logger log = LoggerFactory.getLogger(TriageEngine.class);

    private final TriageGraph triageGraph;
    private final IssueSource issueSource;
    private final EventBus eventBus;
    private final TriageMetrics metrics;
    private final int maxParallel;

    public TriageEngine(TriageGraph triageGraph,
                        @Autowired(required = false) IssueSource issueSource,
                        EventBus eventBus, TriageMetrics metrics, TriageProperties properties) {
        this.triageGraph = triageGraph;
        this.issueSource = issueSource;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.maxParallel = Math.max(1, properties.getBatch().getMaxParallel());
    }

    public TriageOutcome triage(Issue issue) {
        return triage(issue, null);
    }

    /**
     * Triages an issue as given, without consulting the issue source.
     *
     * @param severityHint caller-supplied priority that overrides the derived one, or null
     */
    public TriageOutcome triage(Issue issue, Priority severityHint) {
        var stateMap = new HashMap<String, Object>();
        stateMap.put("issueNumber", issue.number());
        stateMap.put("issue", issue);
        if (severityHint != null) {
            stateMap.put("severityHint", severityHint.name());
        }
        return run(issue.number(), stateMap);
    }

    /**
     * Fetches the issue from the issue source and triages it.
     */
    public TriageOutcome triage(int issueNumber) {
        return run(issueNumber, Map.of("issueNumber", issueNumber, "refresh", true));
    }

    /**
     * Re-triages each issue on a bounded worker pool.
     * <p>
     * Issues are refreshed through the issue source when one is configured. A failing issue
     * never aborts the batch. Outcomes follow input order. If the calling thread is
     * interrupted, issues that have not started are reported as failures while running
     * ones finish; the interrupt flag is restored before returning.
     */
    public BatchReport retriageBatch(List<Issue> issues) {
        if (issues.isEmpty()) {
            return BatchReport.of(List.of());
        }
        boolean refresh = issueSource != null;
        int poolSize = Math.min(maxParallel, issues.size());
        log.info("Retriaging {} issue(s) with {} worker(s), refresh={}", issues.size(), poolSize, refresh);

        var cancelled = new AtomicBoolean(false);
        var futures = new ArrayList<CompletableFuture<TriageOutcome>>();
        ExecutorService executor = Executors.newFixedThreadPool(poolSize, workerFactory());
        boolean interrupted = false;
        try {
            for (Issue issue : issues) {
                futures.add(CompletableFuture.supplyAsync(() -> {
                    if (cancelled.get()) {
                        return notStarted(issue.number());
                    }
                    var stateMap = new HashMap<String, Object>();
                    stateMap.put("issueNumber", issue.number());
                    stateMap.put("issue", issue);
                    stateMap.put("refresh", refresh);
                    return run(issue.number(), stateMap);
                }, executor));
            }

            var outcomes = new ArrayList<TriageOutcome>(issues.size());
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(await(futures.get(i), issues.get(i), cancelled));
                if (Thread.interrupted()) {
                    interrupted = true;
                }
            }

            var report = BatchReport.of(outcomes);
            metrics.recordBatch(issues.size(), report.failed());
            eventBus.publish(new TriageEvent("batch.completed", 0, null,
                    Map.of("issues", issues.size(), "succeeded", report.succeeded(), "failed", report.failed()),
                    Instant.now()));
            log.info("Retriage finished: {} succeeded, {} failed", report.succeeded(), report.failed());
            return report;
        } finally {
            executor.shutdown();
            if (interrupted || cancelled.get()) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Lists the open issues from the issue source and re-triages all of them.
     *
     * @throws SourceUnavailableException if no issue source is configured or listing fails
     */
    public BatchReport retriageOpenIssues() {
        if (issueSource == null) {
            throw new SourceUnavailableException("No issue source configured");
        }
        List<Issue> open;
        try {
            open = issueSource.listOpenIssues();
        } catch (SourceUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SourceUnavailableException("Failed to list open issues: " + e.getMessage(), e);
        }
        log.info("Found {} open issue(s) to retriage", open.size());
        return retriageBatch(open);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private TriageOutcome run(int issueNumber, Map<String, Object> stateMap) {
        MdcContext.setIssue(issueNumber);
        try {
            log.info("Triaging issue #{}", issueNumber);
            TriageOutcome outcome;
            try {
                outcome = triageGraph.getCompiledGraph()
                        .invoke(Map.copyOf(stateMap))
                        .map(this::toOutcome)
                        .orElseGet(() -> TriageOutcome.failure(new FailureRecord(issueNumber, TriageStage.FAILED,
                                "IllegalStateException", "Graph execution returned empty state")));
            } catch (RuntimeException e) {
                log.error("Triage graph failed for issue #{}", issueNumber, e);
                outcome = TriageOutcome.failure(new FailureRecord(issueNumber, TriageStage.FAILED,
                        e.getClass().getSimpleName(), String.valueOf(e.getMessage())));
            }
            metrics.recordTriageResult(outcome.succeeded() ? TriageStage.DONE.name() : TriageStage.FAILED.name());
            return outcome;
        } finally {
            MdcContext.clear();
        }
    }

    TriageOutcome toOutcome(TriageState state) {
        if (state.failed() || state.status() != TriageStage.DONE) {
            return TriageOutcome.failure(new FailureRecord(
                    state.issueNumber(),
                    state.failedStage().orElse(state.status()),
                    state.errorType(),
                    state.errorMessage()));
        }
        return TriageOutcome.success(new TriageDecision(
                state.issue().orElseThrow(),
                state.classification().orElseThrow(),
                state.priority().orElseThrow(),
                state.complexity().orElseThrow(),
                state.duplicates(),
                state.duplicatesChecked(),
                state.stored(),
                state.warnings()));
    }

    private TriageOutcome await(CompletableFuture<TriageOutcome> future, Issue issue, AtomicBoolean cancelled) {
        while (true) {
            try {
                return future.get();
            } catch (InterruptedException e) {
                if (cancelled.compareAndSet(false, true)) {
                    log.warn("Retriage interrupted; issues not yet started will be skipped");
                }
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Unexpected error collecting outcome for issue #{}", issue.number(), cause);
                return TriageOutcome.failure(new FailureRecord(issue.number(), TriageStage.FAILED,
                        cause.getClass().getSimpleName(), String.valueOf(cause.getMessage())));
            }
        }
    }

    private TriageOutcome notStarted(int issueNumber) {
        metrics.recordTriageResult(TriageStage.FAILED.name());
        return TriageOutcome.failure(new FailureRecord(issueNumber, TriageStage.FETCHED,
                "InterruptedException", "Retriage interrupted before issue #" + issueNumber + " started"));
    }

    private static ThreadFactory workerFactory() {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "triage-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
