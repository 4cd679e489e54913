package com.triagebot.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the triage pipeline.
 */
@Service
public class TriageMetrics {

    private final MeterRegistry registry;

    public TriageMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordStageDuration(String stage, long ms) {
        Timer.builder("triage.stage.duration")
                .tag("stage", stage)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param status "DONE" or "FAILED"
     */
    public void recordTriageResult(String status) {
        Counter.builder("triage.issues.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordDuplicatesFound(int count) {
        DistributionSummary.builder("triage.duplicates.found")
                .description("Duplicate candidates reported per triaged issue")
                .register(registry)
                .record(count);
    }

    /**
     * Records a stage that completed in degraded form (e.g. store write failed).
     */
    public void recordDegradedStage(String stage) {
        Counter.builder("triage.stage.degraded")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    public void recordBatch(int issueCount, int failedCount) {
        Counter.builder("triage.batches.total")
                .tag("result", failedCount == 0 ? "clean" : "partial")
                .register(registry)
                .increment();

        DistributionSummary.builder("triage.batch.size")
                .description("Issues per retriage batch")
                .register(registry)
                .record(issueCount);
    }
}
