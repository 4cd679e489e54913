package com.triagebot.core.priority;

import com.triagebot.core.config.TriageProperties;
import com.triagebot.core.model.ClassificationResult;
import com.triagebot.core.model.Complexity;
import com.triagebot.core.model.Priority;
import com.triagebot.core.model.PriorityAssessment;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives priority from classification labels and complexity from text heuristics.
 * <p>
 * Priority, first rule that applies:
 * <ol>
 *   <li>a caller-supplied severity hint</li>
 *   <li>confident {@code security} label: P0</li>
 *   <li>confident {@code bug} label with a crash indicator in the text: P0</li>
 *   <li>any other {@code bug} label: P1</li>
 *   <li>{@code performance} label: P2</li>
 *   <li>P3</li>
 * </ol>
 * "Confident" compares the label's unrounded score with the configured high-confidence level,
 * the same value label selection used. An unconfident {@code security} label alone falls
 * through to the later rules.
 */
public class PriorityAssessor {

    static final String SECURITY = "security";
    static final String BUG = "bug";
    static final String PERFORMANCE = "performance";

    private static final List<Pattern> STACK_TRACE_PATTERNS = List.of(
            Pattern.compile("^\\s*at [\\w.$]+\\(.*\\)", Pattern.MULTILINE),
            Pattern.compile("Traceback \\(most recent call last\\)"),
            Pattern.compile("Exception in thread \""),
            Pattern.compile("^\\s*File \".*\", line \\d+", Pattern.MULTILINE));

    private static final Pattern STEP_LINE =
            Pattern.compile("^\\s*(\\d+[.)]|[-*])\\s+\\S", Pattern.MULTILINE);

    private final TriageProperties.PriorityPolicy priorityPolicy;
    private final TriageProperties.ComplexityPolicy complexityPolicy;

    public PriorityAssessor(TriageProperties.PriorityPolicy priorityPolicy,
                            TriageProperties.ComplexityPolicy complexityPolicy) {
        this.priorityPolicy = priorityPolicy;
        this.complexityPolicy = complexityPolicy;
    }

    public PriorityAssessor() {
        this(new TriageProperties.PriorityPolicy(), new TriageProperties.ComplexityPolicy());
    }

    public PriorityAssessment assess(ClassificationResult classification, String title, String body) {
        return assess(classification, title, body, null);
    }

    public PriorityAssessment assess(ClassificationResult classification, String title, String body,
                                     Priority severityHint) {
        String text = ((title != null ? title : "") + " " + (body != null ? body : ""));
        return new PriorityAssessment(
                severityHint != null ? severityHint : priority(classification, text.toLowerCase(Locale.ROOT)),
                complexity(text));
    }

    Priority priority(ClassificationResult classification, String lowerText) {
        double high = priorityPolicy.getHighConfidence();

        if (classification.hasLabel(SECURITY) && classification.rawScore(SECURITY) >= high) {
            return Priority.P0;
        }
        if (classification.hasLabel(BUG) && classification.rawScore(BUG) >= high && mentionsCrash(lowerText)) {
            return Priority.P0;
        }
        if (classification.hasLabel(BUG)) {
            return Priority.P1;
        }
        if (classification.hasLabel(PERFORMANCE)) {
            return Priority.P2;
        }
        return Priority.P3;
    }

    Complexity complexity(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        int length = text.strip().length();
        int steps = countSteps(text);

        long crossCutting = complexityPolicy.getCrossCuttingKeywords().stream()
                .map(k -> k.toLowerCase(Locale.ROOT))
                .filter(lower::contains)
                .count();

        if (hasStackTrace(text)
                || steps >= complexityPolicy.getComplexStepCount()
                || crossCutting >= complexityPolicy.getComplexKeywordCount()
                || length > complexityPolicy.getComplexMinLength()) {
            return Complexity.COMPLEX;
        }
        if (length <= complexityPolicy.getSimpleMaxLength() && steps < 2) {
            return Complexity.SIMPLE;
        }
        return Complexity.MEDIUM;
    }

    private boolean mentionsCrash(String lowerText) {
        return priorityPolicy.getCrashIndicators().stream()
                .map(k -> k.toLowerCase(Locale.ROOT))
                .anyMatch(lowerText::contains);
    }

    private static boolean hasStackTrace(String text) {
        return STACK_TRACE_PATTERNS.stream().anyMatch(p -> p.matcher(text).find());
    }

    private static int countSteps(String text) {
        var matcher = STEP_LINE.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
