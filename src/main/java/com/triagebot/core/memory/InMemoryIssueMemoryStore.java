package com.triagebot.core.memory;

import com.triagebot.core.embedding.EmbeddingVector;
import com.triagebot.core.model.IssueRecord;
import com.triagebot.core.model.SimilarityMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.AbstractMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store backed by a {@link ConcurrentHashMap}. Records are immutable, so
 * readers always see a whole record. Contents are lost on restart.
 */
public class InMemoryIssueMemoryStore implements IssueMemoryStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryIssueMemoryStore.class);

    private final ConcurrentHashMap<Integer, IssueRecord> records = new ConcurrentHashMap<>();
    private final int dimension;

    public InMemoryIssueMemoryStore(int dimension) {
        this.dimension = dimension;
    }

    @Override
    public void upsert(IssueRecord record) {
        SimilarityRanking.requireDimension(dimension, record.embedding());
        IssueRecord previous = records.put(record.issueNumber(), record);
        log.debug("{} issue #{} in memory", previous == null ? "Stored" : "Replaced", record.issueNumber());
    }

    @Override
    public Optional<IssueRecord> get(int issueNumber) {
        return Optional.ofNullable(records.get(issueNumber));
    }

    @Override
    public List<SimilarityMatch> queryNearest(EmbeddingVector query, double minScore, int maxResults,
                                              Integer excludedIssueNumber) {
        SimilarityRanking.requireDimension(dimension, query);
        var candidates = records.values().stream()
                .<Map.Entry<Integer, EmbeddingVector>>map(r ->
                        new AbstractMap.SimpleImmutableEntry<>(r.issueNumber(), r.embedding()))
                .toList();
        return SimilarityRanking.rank(query, candidates, minScore, maxResults, excludedIssueNumber);
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public long count() {
        return records.size();
    }
}
