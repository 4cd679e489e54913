package com.triagebot.core.config;

import com.triagebot.core.classifier.CategoryTable;
import com.triagebot.core.classifier.KeywordClassifier;
import com.triagebot.core.embedding.Embedder;
import com.triagebot.core.embedding.HashEmbedder;
import com.triagebot.core.error.TriageConfigurationException;
import com.triagebot.core.priority.PriorityAssessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the stateless pipeline components from {@link TriageProperties}.
 * Malformed settings fail the context at startup.
 */
@Configuration
public class TriageConfig {

    private static final Logger log = LoggerFactory.getLogger(TriageConfig.class);

    @Bean
    public KeywordClassifier keywordClassifier(TriageProperties properties) {
        var classifier = properties.getClassifier();
        double minConfidence = classifier.getMinConfidence();
        if (Double.isNaN(minConfidence) || minConfidence < 0 || minConfidence > 1) {
            throw new TriageConfigurationException(
                    "triage.classifier.min-confidence must be within [0, 1], got " + minConfidence);
        }
        var table = CategoryTable.ofOrDefaults(classifier.getCategories());
        log.info("Classifier configured with categories {} (min confidence {})", table.names(), minConfidence);
        return new KeywordClassifier(table, minConfidence);
    }

    @Bean
    public Embedder embedder(TriageProperties properties) {
        int dimension = properties.getEmbedding().getDimension();
        if (dimension <= 0) {
            throw new TriageConfigurationException("triage.embedding.dimension must be positive, got " + dimension);
        }
        return new HashEmbedder(dimension);
    }

    @Bean
    public PriorityAssessor priorityAssessor(TriageProperties properties) {
        return new PriorityAssessor(properties.getPriority(), properties.getComplexity());
    }
}
