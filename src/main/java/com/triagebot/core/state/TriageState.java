package com.triagebot.core.state;

import com.triagebot.core.embedding.EmbeddingVector;
import com.triagebot.core.model.ClassificationResult;
import com.triagebot.core.model.Complexity;
import com.triagebot.core.model.Issue;
import com.triagebot.core.model.Priority;
import com.triagebot.core.model.SimilarityMatch;
import com.triagebot.core.model.TriageStage;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Graph state for one issue moving through the triage pipeline.
 * <p>
 * Extends LangGraph4j's {@link AgentState} with typed accessors. Warnings use an
 * appender channel so every stage can add to them without replacing earlier ones.
 * Absent values are simply not present in the map; nodes never write nulls.
 */
public class TriageState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        // ── Input ────────────────────────────────────────────────────
        Map.entry("issueNumber",       Channels.base(() -> 0)),
        Map.entry("issue",             Channels.base((Reducer<Issue>) null)),
        Map.entry("refresh",           Channels.base(() -> false)),
        Map.entry("severityHint",      Channels.base((Reducer<String>) null)),

        // ── Progress ─────────────────────────────────────────────────
        Map.entry("status",            Channels.base(() -> TriageStage.FETCHED.name())),
        Map.entry("failedStage",       Channels.base((Reducer<String>) null)),
        Map.entry("errorType",         Channels.base((Reducer<String>) null)),
        Map.entry("errorMessage",      Channels.base((Reducer<String>) null)),

        // ── Stage results ────────────────────────────────────────────
        Map.entry("classification",    Channels.base((Reducer<ClassificationResult>) null)),
        Map.entry("embedding",         Channels.base((Reducer<EmbeddingVector>) null)),
        Map.entry("duplicates",        Channels.base((Supplier<List<SimilarityMatch>>) List::of)),
        Map.entry("duplicatesChecked", Channels.base(() -> false)),
        Map.entry("priority",          Channels.base((Reducer<String>) null)),
        Map.entry("complexity",        Channels.base((Reducer<String>) null)),
        Map.entry("stored",            Channels.base(() -> false)),

        // ── Appender channels ────────────────────────────────────────
        Map.entry("warnings",          Channels.appender(ArrayList::new))
    );

    public TriageState(Map<String, Object> initData) {
        super(initData);
    }

    public int issueNumber() {
        return this.<Integer>value("issueNumber").orElse(0);
    }

    public Optional<Issue> issue() {
        return value("issue");
    }

    public boolean refresh() {
        return this.<Boolean>value("refresh").orElse(false);
    }

    public Optional<Priority> severityHint() {
        return this.<String>value("severityHint").map(Priority::valueOf);
    }

    public TriageStage status() {
        String raw = this.<String>value("status").orElse(TriageStage.FETCHED.name());
        return TriageStage.valueOf(raw);
    }

    public boolean failed() {
        return status() == TriageStage.FAILED;
    }

    public Optional<TriageStage> failedStage() {
        return this.<String>value("failedStage").map(TriageStage::valueOf);
    }

    public String errorType() {
        return this.<String>value("errorType").orElse("");
    }

    public String errorMessage() {
        return this.<String>value("errorMessage").orElse("");
    }

    public Optional<ClassificationResult> classification() {
        return value("classification");
    }

    public Optional<EmbeddingVector> embedding() {
        return value("embedding");
    }

    public List<SimilarityMatch> duplicates() {
        return this.<List<SimilarityMatch>>value("duplicates").orElse(List.of());
    }

    public boolean duplicatesChecked() {
        return this.<Boolean>value("duplicatesChecked").orElse(false);
    }

    public Optional<Priority> priority() {
        return this.<String>value("priority").map(Priority::valueOf);
    }

    public Optional<Complexity> complexity() {
        return this.<String>value("complexity").map(Complexity::valueOf);
    }

    public boolean stored() {
        return this.<Boolean>value("stored").orElse(false);
    }

    public List<String> warnings() {
        return this.<List<String>>value("warnings").orElse(List.of());
    }
}
