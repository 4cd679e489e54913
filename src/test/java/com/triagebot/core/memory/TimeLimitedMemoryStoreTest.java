package com.triagebot.core.memory;

import com.triagebot.core.embedding.EmbeddingVector;
import com.triagebot.core.embedding.HashEmbedder;
import com.triagebot.core.error.IncompatibleDimensionException;
import com.triagebot.core.error.StorageUnavailableException;
import com.triagebot.core.model.IssueRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;

class TimeLimitedMemoryStoreTest {

    private final HashEmbedder embedder = new HashEmbedder();
    private TimeLimitedMemoryStore store;

    @AfterEach
    void tearDown() {
        if (store != null) {
            store.close();
        }
    }

    @Test
    @DisplayName("passes calls through to the delegate")
    void delegates() {
        store = new TimeLimitedMemoryStore(new InMemoryIssueMemoryStore(384), Duration.ofSeconds(2));
        store.upsert(new IssueRecord(1, "t", "b", embedder.embed("t", 384), Set.of(), null, Instant.now()));

        assertEquals(1, store.count());
        assertTrue(store.get(1).isPresent());
        assertEquals(1, store.queryNearest(embedder.embed("t", 384), 5).size());
    }

    @Test
    @DisplayName("a call exceeding the timeout is reported as storage unavailable")
    void timeout() {
        IssueMemoryStore slow = mock(IssueMemoryStore.class);
        when(slow.dimension()).thenReturn(384);
        when(slow.queryNearest(any(), anyDouble(), anyInt(), any())).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return List.of();
        });
        store = new TimeLimitedMemoryStore(slow, Duration.ofMillis(100));

        assertThrows(StorageUnavailableException.class,
                () -> store.queryNearest(embedder.embed("q", 384), 0.85, 5, 1));
    }

    @Test
    @DisplayName("delegate failures are reported as storage unavailable")
    void delegateFailure() {
        IssueMemoryStore broken = mock(IssueMemoryStore.class);
        doThrow(new IllegalStateException("connection refused")).when(broken).upsert(any());
        store = new TimeLimitedMemoryStore(broken, Duration.ofSeconds(1));

        var record = new IssueRecord(1, "t", "b", embedder.embed("t", 384), Set.of(), null, Instant.now());
        var ex = assertThrows(StorageUnavailableException.class, () -> store.upsert(record));
        assertTrue(ex.getMessage().contains("connection refused"));
    }

    @Test
    @DisplayName("dimension mismatches are rejected before reaching the delegate")
    void dimensionMismatchNotDispatched() {
        IssueMemoryStore delegate = mock(IssueMemoryStore.class);
        when(delegate.dimension()).thenReturn(384);
        store = new TimeLimitedMemoryStore(delegate, Duration.ofSeconds(1));

        assertThrows(IncompatibleDimensionException.class,
                () -> store.queryNearest(new EmbeddingVector(new double[128]), 0.85, 5, null));
        verify(delegate, never()).queryNearest(any(), anyDouble(), anyInt(), any());
    }
}
