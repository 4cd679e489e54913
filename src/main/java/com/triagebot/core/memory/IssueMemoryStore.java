package com.triagebot.core.memory;

import com.triagebot.core.embedding.EmbeddingVector;
import com.triagebot.core.model.IssueRecord;
import com.triagebot.core.model.SimilarityMatch;

import java.util.List;
import java.util.Optional;

/**
 * Durable memory of triaged issues, queried by vector similarity.
 * <p>
 * Implementations must let upserts of different issue numbers proceed independently and
 * must never expose a partially written record. Every record and query vector has to match
 * {@link #dimension()}; anything else is rejected with
 * {@link com.triagebot.core.error.IncompatibleDimensionException}.
 */
public interface IssueMemoryStore {

    /**
     * Inserts the record or replaces the one stored under the same issue number.
     */
    void upsert(IssueRecord record);

    Optional<IssueRecord> get(int issueNumber);

    /**
     * Ranks stored records against {@code query}, best first, ties by ascending issue number.
     *
     * @param query               vector of the store's dimension
     * @param minScore            matches scoring below this are dropped
     * @param maxResults          upper bound on the returned list
     * @param excludedIssueNumber issue number never returned, or null
     */
    List<SimilarityMatch> queryNearest(EmbeddingVector query, double minScore, int maxResults,
                                       Integer excludedIssueNumber);

    default List<SimilarityMatch> queryNearest(EmbeddingVector query, int maxResults) {
        return queryNearest(query, -1.0, maxResults, null);
    }

    /**
     * Vector dimension every record and query must have.
     */
    int dimension();

    long count();
}
