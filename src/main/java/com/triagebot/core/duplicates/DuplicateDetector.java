package com.triagebot.core.duplicates;

import com.triagebot.core.embedding.Embedder;
import com.triagebot.core.embedding.EmbeddingVector;
import com.triagebot.core.memory.IssueMemoryStore;
import com.triagebot.core.model.Issue;
import com.triagebot.core.model.SimilarityMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Finds previously stored issues whose embedding is close to a new issue's.
 * <p>
 * The issue's own number is always excluded, so re-triaging a stored issue never
 * reports it as a duplicate of itself.
 */
@Service
public class DuplicateDetector {

    private static final Logger log = LoggerFactory.getLogger(DuplicateDetector.class);

    public static final double DEFAULT_THRESHOLD = 0.85;
    public static final int DEFAULT_MAX_RESULTS = 5;

    private final Embedder embedder;

    public DuplicateDetector(Embedder embedder) {
        this.embedder = embedder;
    }

    public EmbeddingVector embed(Issue issue, int dimension) {
        return embedder.embed(issue.combinedText(), dimension);
    }

    /**
     * {@link #findDuplicates(Issue, IssueMemoryStore, double, int)} with a 0.85 threshold
     * and at most five matches.
     */
    public List<SimilarityMatch> findDuplicates(Issue issue, IssueMemoryStore store) {
        return findDuplicates(issue, store, DEFAULT_THRESHOLD, DEFAULT_MAX_RESULTS);
    }

    /**
     * Embeds {@code issue} at the store's dimension and ranks stored issues against it.
     *
     * @return matches scoring at least {@code threshold}, best first, ties by ascending
     *         issue number, at most {@code maxResults}
     */
    public List<SimilarityMatch> findDuplicates(Issue issue, IssueMemoryStore store,
                                                double threshold, int maxResults) {
        return findDuplicates(issue, embed(issue, store.dimension()), store, threshold, maxResults);
    }

    /**
     * Same as {@link #findDuplicates(Issue, IssueMemoryStore, double, int)} with an
     * embedding the caller already computed.
     */
    public List<SimilarityMatch> findDuplicates(Issue issue, EmbeddingVector embedding, IssueMemoryStore store,
                                                double threshold, int maxResults) {
        var matches = store.queryNearest(embedding, threshold, maxResults, issue.number());
        if (!matches.isEmpty()) {
            log.info("Issue #{} has {} likely duplicate(s), best #{} at {}",
                    issue.number(), matches.size(), matches.get(0).issueNumber(),
                    String.format("%.3f", matches.get(0).score()));
        }
        return matches;
    }
}
