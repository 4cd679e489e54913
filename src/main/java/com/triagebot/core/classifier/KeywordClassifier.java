package com.triagebot.core.classifier;

import com.triagebot.core.model.ClassificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;

/**
 * Scores issue text against a {@link CategoryTable} by keyword substring matches.
 * <p>
 * A category's score is the fraction of its keywords found in the lower-cased
 * {@code title + " " + body}. Categories reaching {@code minConfidence} become labels.
 * When none does, every category tied at the highest nonzero score is labelled instead,
 * so any text matching at least one keyword gets a label. Callers that need precise
 * labels should check {@link ClassificationResult#confidence()} first.
 */
public class KeywordClassifier {

    private static final Logger log = LoggerFactory.getLogger(KeywordClassifier.class);

    public static final double DEFAULT_MIN_CONFIDENCE = 0.6;

    private final CategoryTable categories;
    private final double minConfidence;

    public KeywordClassifier(CategoryTable categories, double minConfidence) {
        this.categories = categories;
        this.minConfidence = minConfidence;
    }

    public KeywordClassifier() {
        this(CategoryTable.defaults(), DEFAULT_MIN_CONFIDENCE);
    }

    public ClassificationResult classify(String title, String body) {
        return classify(title, body, minConfidence, categories);
    }

    public CategoryTable categories() {
        return categories;
    }

    /**
     * Pure classification over an explicit table and threshold.
     */
    public static ClassificationResult classify(String title, String body,
                                                double minConfidence, CategoryTable categories) {
        String text = ((title != null ? title : "") + " " + (body != null ? body : ""))
                .toLowerCase(Locale.ROOT);

        var rawScores = new LinkedHashMap<String, Double>();
        for (String category : categories.names()) {
            var keywords = categories.keywords(category);
            if (keywords.isEmpty()) {
                rawScores.put(category, 0.0);
                continue;
            }
            long hits = keywords.stream().filter(text::contains).count();
            rawScores.put(category, (double) hits / keywords.size());
        }

        var labels = new LinkedHashSet<String>();
        rawScores.forEach((category, score) -> {
            if (score >= minConfidence) {
                labels.add(category);
            }
        });

        double max = rawScores.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        if (labels.isEmpty() && max > 0) {
            rawScores.forEach((category, score) -> {
                if (score == max) {
                    labels.add(category);
                }
            });
            log.debug("No category reached {}; fell back to top score {} -> {}", minConfidence, max, labels);
        }

        var reported = new LinkedHashMap<String, Double>();
        rawScores.forEach((category, score) -> reported.put(category, round2(score)));
        return new ClassificationResult(reported, labels, round2(max), rawScores);
    }

    private static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }
}
