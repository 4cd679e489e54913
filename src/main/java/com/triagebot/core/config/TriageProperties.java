package com.triagebot.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "triage")
public class TriageProperties {

    private String repository = "default";
    private boolean retriageOnStartup = false;
    private Classifier classifier = new Classifier();
    private Embedding embedding = new Embedding();
    private Duplicates duplicates = new Duplicates();
    private Memory memory = new Memory();
    private PriorityPolicy priority = new PriorityPolicy();
    private ComplexityPolicy complexity = new ComplexityPolicy();
    private Batch batch = new Batch();

    public String getRepository() { return repository; }
    public void setRepository(String repository) { this.repository = repository; }
    public boolean isRetriageOnStartup() { return retriageOnStartup; }
    public void setRetriageOnStartup(boolean retriageOnStartup) { this.retriageOnStartup = retriageOnStartup; }
    public Classifier getClassifier() { return classifier; }
    public void setClassifier(Classifier classifier) { this.classifier = classifier; }
    public Embedding getEmbedding() { return embedding; }
    public void setEmbedding(Embedding embedding) { this.embedding = embedding; }
    public Duplicates getDuplicates() { return duplicates; }
    public void setDuplicates(Duplicates duplicates) { this.duplicates = duplicates; }
    public Memory getMemory() { return memory; }
    public void setMemory(Memory memory) { this.memory = memory; }
    public PriorityPolicy getPriority() { return priority; }
    public void setPriority(PriorityPolicy priority) { this.priority = priority; }
    public ComplexityPolicy getComplexity() { return complexity; }
    public void setComplexity(ComplexityPolicy complexity) { this.complexity = complexity; }
    public Batch getBatch() { return batch; }
    public void setBatch(Batch batch) { this.batch = batch; }

    public static class Classifier {
        private double minConfidence = 0.6;
        /** Category name to keywords. Empty means the built-in table. */
        private Map<String, List<String>> categories = new LinkedHashMap<>();

        public double getMinConfidence() { return minConfidence; }
        public void setMinConfidence(double minConfidence) { this.minConfidence = minConfidence; }
        public Map<String, List<String>> getCategories() { return categories; }
        public void setCategories(Map<String, List<String>> categories) { this.categories = categories; }
    }

    public static class Embedding {
        private int dimension = 384;

        public int getDimension() { return dimension; }
        public void setDimension(int dimension) { this.dimension = dimension; }
    }

    public static class Duplicates {
        private double threshold = 0.85;
        private int maxResults = 5;

        public double getThreshold() { return threshold; }
        public void setThreshold(double threshold) { this.threshold = threshold; }
        public int getMaxResults() { return maxResults; }
        public void setMaxResults(int maxResults) { this.maxResults = maxResults; }
    }

    public static class Memory {
        /** One of "jdbc", "in-memory" or "none". */
        private String store = "in-memory";
        private Duration timeout = Duration.ofSeconds(5);

        public String getStore() { return store; }
        public void setStore(String store) { this.store = store; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public static class PriorityPolicy {
        private double highConfidence = 0.6;
        private List<String> crashIndicators = new ArrayList<>(
                List.of("crash", "broken", "data loss", "outage", "panic", "segfault"));

        public double getHighConfidence() { return highConfidence; }
        public void setHighConfidence(double highConfidence) { this.highConfidence = highConfidence; }
        public List<String> getCrashIndicators() { return crashIndicators; }
        public void setCrashIndicators(List<String> crashIndicators) { this.crashIndicators = crashIndicators; }
    }

    public static class ComplexityPolicy {
        private int simpleMaxLength = 280;
        private int complexMinLength = 1500;
        private int complexStepCount = 3;
        private int complexKeywordCount = 1;
        private List<String> crossCuttingKeywords = new ArrayList<>(List.of(
                "migration", "refactor", "architecture", "concurrency", "race condition",
                "deadlock", "backward compatibility", "multiple services", "all platforms"));

        public int getSimpleMaxLength() { return simpleMaxLength; }
        public void setSimpleMaxLength(int simpleMaxLength) { this.simpleMaxLength = simpleMaxLength; }
        public int getComplexMinLength() { return complexMinLength; }
        public void setComplexMinLength(int complexMinLength) { this.complexMinLength = complexMinLength; }
        public int getComplexStepCount() { return complexStepCount; }
        public void setComplexStepCount(int complexStepCount) { this.complexStepCount = complexStepCount; }
        public int getComplexKeywordCount() { return complexKeywordCount; }
        public void setComplexKeywordCount(int complexKeywordCount) { this.complexKeywordCount = complexKeywordCount; }
        public List<String> getCrossCuttingKeywords() { return crossCuttingKeywords; }
        public void setCrossCuttingKeywords(List<String> crossCuttingKeywords) { this.crossCuttingKeywords = crossCuttingKeywords; }
    }

    public static class Batch {
        private int maxParallel = 4;

        public int getMaxParallel() { return maxParallel; }
        public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
    }
}
