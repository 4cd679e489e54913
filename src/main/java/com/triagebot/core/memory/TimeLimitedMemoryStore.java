package com.triagebot.core.memory;

import com.triagebot.core.embedding.EmbeddingVector;
import com.triagebot.core.error.IncompatibleDimensionException;
import com.triagebot.core.error.StorageUnavailableException;
import com.triagebot.core.model.IssueRecord;
import com.triagebot.core.model.SimilarityMatch;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounds every call to a delegate store by a timeout.
 * <p>
 * A timeout, or any failure other than a dimension mismatch, is reported as
 * {@link StorageUnavailableException} so the calling stage can degrade instead of failing.
 * Timed-out calls are cancelled but may still complete in the delegate.
 */
public class TimeLimitedMemoryStore implements IssueMemoryStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TimeLimitedMemoryStore.class);

    private final IssueMemoryStore delegate;
    private final TimeLimiter timeLimiter;
    private final Duration timeout;
    private final ExecutorService executor;

    public TimeLimitedMemoryStore(IssueMemoryStore delegate, Duration timeout) {
        this.delegate = delegate;
        this.timeout = timeout;
        this.timeLimiter = TimeLimiter.of("issueMemoryStore", TimeLimiterConfig.custom()
                .timeoutDuration(timeout)
                .cancelRunningFuture(true)
                .build());
        var counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "memory-store-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void upsert(IssueRecord record) {
        call("upsert #" + record.issueNumber(), () -> {
            delegate.upsert(record);
            return null;
        });
    }

    @Override
    public Optional<IssueRecord> get(int issueNumber) {
        return call("get #" + issueNumber, () -> delegate.get(issueNumber));
    }

    @Override
    public List<SimilarityMatch> queryNearest(EmbeddingVector query, double minScore, int maxResults,
                                              Integer excludedIssueNumber) {
        // reject before dispatching so no comparison is attempted
        SimilarityRanking.requireDimension(delegate.dimension(), query);
        return call("queryNearest",
                () -> delegate.queryNearest(query, minScore, maxResults, excludedIssueNumber));
    }

    @Override
    public int dimension() {
        return delegate.dimension();
    }

    @Override
    public long count() {
        return call("count", delegate::count);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private <T> T call(String operation, Callable<T> callable) {
        try {
            return timeLimiter.executeFutureSupplier(() -> executor.submit(callable));
        } catch (TimeoutException e) {
            log.warn("Memory store {} timed out after {}", operation, timeout);
            throw new StorageUnavailableException("Memory store " + operation + " timed out after " + timeout, e);
        } catch (IncompatibleDimensionException | StorageUnavailableException e) {
            throw e;
        } catch (ExecutionException e) {
            throw unwrap(operation, e.getCause() != null ? e.getCause() : e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageUnavailableException("Memory store " + operation + " interrupted", e);
        } catch (Exception e) {
            throw unwrap(operation, e);
        }
    }

    private RuntimeException unwrap(String operation, Throwable cause) {
        if (cause instanceof IncompatibleDimensionException ide) {
            return ide;
        }
        if (cause instanceof StorageUnavailableException sue) {
            return sue;
        }
        log.warn("Memory store {} failed: {}", operation, cause.getMessage());
        return new StorageUnavailableException("Memory store " + operation + " failed: " + cause.getMessage(), cause);
    }
}
