package com.triagebot.core.engine;

import com.triagebot.core.error.IncompatibleDimensionException;
import com.triagebot.core.error.SourceUnavailableException;
import com.triagebot.core.error.StorageUnavailableException;
import com.triagebot.core.events.TriageEvent;
import com.triagebot.core.memory.InMemoryIssueMemoryStore;
import com.triagebot.core.memory.IssueMemoryStore;
import com.triagebot.core.model.BatchReport;
import com.triagebot.core.model.Complexity;
import com.triagebot.core.model.FailureRecord;
import com.triagebot.core.model.Issue;
import com.triagebot.core.model.Priority;
import com.triagebot.core.model.SimilarityMatch;
import com.triagebot.core.model.TriageDecision;
import com.triagebot.core.model.TriageOutcome;
import com.triagebot.core.model.TriageStage;
import com.triagebot.core.engine.PipelineFixture.MapIssueSource;
import com.triagebot.source.IssueSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

/**
 * Tests for the TriageEngine service.
 * Uses the real graph and stage nodes with an in-memory store or a mocked one.
 */
class TriageEngineTest {

    private PipelineFixture fixture;
    private InMemoryIssueMemoryStore store;

    @BeforeEach
    void setUp() {
        fixture = new PipelineFixture();
        store = new InMemoryIssueMemoryStore(384);
    }

    @Nested
    @DisplayName("single issue")
    class SingleIssue {

        @Test
        @DisplayName("runs every stage and stores the issue")
        void fullPipeline() throws Exception {
            TriageEngine engine = fixture.engine(store, null);

            TriageOutcome outcome = engine.triage(new Issue(1, "Login fails with exception", ""));

            assertTrue(outcome.succeeded());
            TriageDecision decision = outcome.decision();
            assertEquals(Set.of("bug"), decision.classification().labels());
            assertEquals(Priority.P1, decision.priority());
            assertEquals(Complexity.SIMPLE, decision.complexity());
            assertTrue(decision.duplicatesChecked());
            assertTrue(decision.stored());
            assertTrue(decision.duplicates().isEmpty());
            assertTrue(decision.warnings().isEmpty());

            var record = store.get(1).orElseThrow();
            assertEquals(Set.of("bug"), record.labels());
            assertEquals(Priority.P1, record.priority());
        }

        @Test
        @DisplayName("reports an earlier identical issue as a duplicate")
        void detectsDuplicate() throws Exception {
            TriageEngine engine = fixture.engine(store, null);
            engine.triage(new Issue(1, "Crash on save", "It crashes"));

            TriageDecision decision = engine.triage(new Issue(2, "Crash on save", "It crashes")).decision();

            assertEquals(List.of(new SimilarityMatch(1, 1.0)), decision.duplicates());
            assertTrue(decision.hasDuplicates());
        }

        @Test
        @DisplayName("re-triaging a stored issue does not match itself")
        void retriageDoesNotMatchItself() throws Exception {
            TriageEngine engine = fixture.engine(store, null);
            engine.triage(new Issue(1, "Crash on save", "It crashes"));

            TriageDecision decision = engine.triage(new Issue(1, "Crash on save", "It crashes")).decision();

            assertTrue(decision.duplicates().isEmpty());
            assertEquals(1, store.count());
        }

        @Test
        @DisplayName("severity hint overrides the derived priority")
        void severityHint() throws Exception {
            TriageEngine engine = fixture.engine(store, null);

            TriageDecision decision = engine.triage(new Issue(1, "Please add dark mode", ""), Priority.P0).decision();

            assertEquals(Priority.P0, decision.priority());
        }

        @Test
        @DisplayName("publishes an event after every transition")
        void publishesEvents() throws Exception {
            var events = new CopyOnWriteArrayList<TriageEvent>();
            fixture.eventBus.subscribe(1, events::add);
            TriageEngine engine = fixture.engine(store, null);

            engine.triage(new Issue(1, "Page is slow", ""));

            assertEquals(List.of("issue.fetched", "issue.classified", "issue.duplicates_checked",
                            "issue.priority_assessed", "issue.stored", "issue.triaged"),
                    events.stream().map(TriageEvent::eventType).toList());
        }

        @Test
        @DisplayName("records the outcome metric")
        void recordsMetrics() throws Exception {
            fixture.engine(store, null).triage(new Issue(1, "Page is slow", ""));

            var done = fixture.registry.find("triage.issues.total").tag("status", "DONE").counter();
            assertNotNull(done);
            assertEquals(1.0, done.count());
        }
    }

    @Nested
    @DisplayName("memory stages")
    class MemoryStages {

        @Test
        @DisplayName("without a store both memory stages are skipped")
        void noStore() throws Exception {
            var events = new CopyOnWriteArrayList<TriageEvent>();
            fixture.eventBus.subscribeAll(events::add);
            TriageEngine engine = fixture.engine(null, null);

            TriageOutcome outcome = engine.triage(new Issue(3, "Page is slow", ""));

            assertTrue(outcome.succeeded());
            assertFalse(outcome.decision().duplicatesChecked());
            assertFalse(outcome.decision().stored());
            assertTrue(outcome.decision().warnings().isEmpty());
            assertEquals(Priority.P2, outcome.decision().priority());
            assertTrue(events.stream().noneMatch(e -> e.eventType().equals("issue.stored")));
        }

        @Test
        @DisplayName("failed store write still returns the decision, marked not stored")
        void storeWriteFails() throws Exception {
            IssueMemoryStore failing = mock(IssueMemoryStore.class);
            when(failing.dimension()).thenReturn(384);
            when(failing.queryNearest(any(), anyDouble(), anyInt(), any())).thenReturn(List.of());
            doThrow(new StorageUnavailableException("Memory store upsert #4 timed out after PT5S"))
                    .when(failing).upsert(any());

            TriageOutcome outcome = fixture.engine(failing, null).triage(new Issue(4, "Page is slow", ""));

            assertTrue(outcome.succeeded());
            assertTrue(outcome.decision().duplicatesChecked());
            assertFalse(outcome.decision().stored());
            assertEquals(1, outcome.decision().warnings().size());
            assertTrue(outcome.decision().warnings().get(0).contains("timed out"));
            assertTrue(outcome.decision().degraded());
        }

        @Test
        @DisplayName("unavailable duplicate query degrades the stage and the issue is still stored")
        void duplicateQueryUnavailable() throws Exception {
            IssueMemoryStore flaky = mock(IssueMemoryStore.class);
            when(flaky.dimension()).thenReturn(384);
            when(flaky.queryNearest(any(), anyDouble(), anyInt(), any()))
                    .thenThrow(new StorageUnavailableException("connection reset"));

            TriageOutcome outcome = fixture.engine(flaky, null).triage(new Issue(5, "Page is slow", ""));

            assertTrue(outcome.succeeded());
            assertFalse(outcome.decision().duplicatesChecked());
            assertTrue(outcome.decision().duplicates().isEmpty());
            assertTrue(outcome.decision().stored());
            assertEquals(1, outcome.decision().warnings().size());
            verify(flaky).upsert(any());

            var degraded = fixture.registry.find("triage.stage.degraded")
                    .tag("stage", TriageStage.DUPLICATE_CHECKED.name()).counter();
            assertNotNull(degraded);
            assertEquals(1.0, degraded.count());
        }

        @Test
        @DisplayName("dimension mismatch fails the issue at the duplicate check")
        void dimensionMismatch() throws Exception {
            IssueMemoryStore mismatched = mock(IssueMemoryStore.class);
            when(mismatched.dimension()).thenReturn(384);
            when(mismatched.queryNearest(any(), anyDouble(), anyInt(), any()))
                    .thenThrow(new IncompatibleDimensionException(384, 128));

            TriageOutcome outcome = fixture.engine(mismatched, null).triage(new Issue(6, "Page is slow", ""));

            assertFalse(outcome.succeeded());
            assertEquals(TriageStage.DUPLICATE_CHECKED, outcome.failure().failedStage());
            assertEquals("IncompatibleDimensionException", outcome.failure().errorType());
            verify(mismatched, never()).upsert(any());
        }
    }

    @Nested
    @DisplayName("issue source")
    class Source {

        @Test
        @DisplayName("triage by number fetches the issue")
        void triageByNumber() throws Exception {
            var source = new MapIssueSource().add(new Issue(8, "Docs typo in readme", ""));

            TriageOutcome outcome = fixture.engine(store, source).triage(8);

            assertTrue(outcome.succeeded());
            assertEquals("Docs typo in readme", outcome.decision().issue().title());
            assertEquals(List.of(8), source.fetched);
        }

        @Test
        @DisplayName("triage by number without a source fails at FETCHED")
        void triageByNumberWithoutSource() throws Exception {
            TriageOutcome outcome = fixture.engine(store, null).triage(8);

            assertFalse(outcome.succeeded());
            FailureRecord failure = outcome.failure();
            assertEquals(8, failure.issueNumber());
            assertEquals(TriageStage.FETCHED, failure.failedStage());
            assertEquals("SourceUnavailableException", failure.errorType());
        }

        @Test
        @DisplayName("unknown issue number fails at FETCHED")
        void unknownIssue() throws Exception {
            TriageOutcome outcome = fixture.engine(store, new MapIssueSource()).triage(404);

            assertFalse(outcome.succeeded());
            assertEquals(TriageStage.FETCHED, outcome.failure().failedStage());
        }
    }

    @Nested
    @DisplayName("batch retriage")
    class Batch {

        private List<Issue> fiveIssues() {
            return List.of(
                    new Issue(1, "Crash on start", "broken"),
                    new Issue(2, "Page is slow", ""),
                    new Issue(3, "Add export", ""),
                    new Issue(4, "Security exploit", ""),
                    new Issue(5, "How do I configure it?", ""));
        }

        @Test
        @DisplayName("one source failure in five issues gives four decisions and one failure")
        void oneFailureInFive() throws Exception {
            var source = new MapIssueSource().failOn(3);
            fiveIssues().forEach(source::add);

            BatchReport report = fixture.engine(store, source).retriageBatch(fiveIssues());

            assertEquals(4, report.succeeded());
            assertEquals(1, report.failed());
            assertEquals(List.of(1, 2, 3, 4, 5),
                    report.outcomes().stream().map(TriageOutcome::issueNumber).toList());
            FailureRecord failure = report.failures().get(0);
            assertEquals(3, failure.issueNumber());
            assertEquals(TriageStage.FETCHED, failure.failedStage());
            assertEquals("SourceUnavailableException", failure.errorType());
            assertEquals(4, store.count());
        }

        @Test
        @DisplayName("without a source the given issues are triaged as they are")
        void withoutSource() throws Exception {
            BatchReport report = fixture.engine(store, null).retriageBatch(fiveIssues());

            assertEquals(5, report.succeeded());
            assertEquals(0, report.failed());
        }

        @Test
        @DisplayName("empty batch gives an empty report")
        void emptyBatch() throws Exception {
            BatchReport report = fixture.engine(store, null).retriageBatch(List.of());

            assertTrue(report.outcomes().isEmpty());
        }

        @Test
        @DisplayName("retriageOpenIssues triages every open issue")
        void retriageOpenIssues() throws Exception {
            var source = new MapIssueSource();
            fiveIssues().forEach(source::add);

            BatchReport report = fixture.engine(store, source).retriageOpenIssues();

            assertEquals(5, report.succeeded());
            var batches = fixture.registry.find("triage.batches.total").tag("result", "clean").counter();
            assertNotNull(batches);
            assertEquals(1.0, batches.count());
        }

        @Test
        @DisplayName("retriageOpenIssues surfaces a listing failure")
        void listingFails() throws Exception {
            IssueSource source = mock(IssueSource.class);
            when(source.listOpenIssues()).thenThrow(new IllegalStateException("rate limited"));

            assertThrows(SourceUnavailableException.class,
                    () -> fixture.engine(store, source).retriageOpenIssues());
            assertThrows(SourceUnavailableException.class,
                    () -> fixture.engine(store, null).retriageOpenIssues());
        }

        @Test
        @DisplayName("interrupting the batch skips issues that have not started")
        void interrupted() throws Exception {
            fixture.properties.getBatch().setMaxParallel(1);
            var batchThread = new AtomicReference<Thread>();
            var source = new MapIssueSource() {
                @Override
                public synchronized Issue fetchIssue(int issueNumber) {
                    if (issueNumber == 1) {
                        batchThread.get().interrupt();
                        try {
                            Thread.sleep(500);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                    }
                    return super.fetchIssue(issueNumber);
                }
            };
            fiveIssues().forEach(source::add);
            TriageEngine engine = fixture.engine(store, source);

            var report = new AtomicReference<BatchReport>();
            var interruptRestored = new AtomicBoolean();
            Thread runner = new Thread(() -> {
                report.set(engine.retriageBatch(fiveIssues()));
                interruptRestored.set(Thread.currentThread().isInterrupted());
            });
            batchThread.set(runner);
            runner.start();
            runner.join(10_000);

            assertTrue(report.get().outcomes().get(0).succeeded());
            assertEquals(1, report.get().succeeded());
            assertEquals(4, report.get().failed());
            report.get().failures().forEach(f -> assertEquals("InterruptedException", f.errorType()));
            assertEquals(List.of(1), source.fetched);
            assertTrue(interruptRestored.get());
        }
    }
}
