package com.triagebot.core.logging;

import com.triagebot.core.model.TriageStage;
import org.slf4j.MDC;

/**
 * MDC keys for structured triage logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setIssue(int issueNumber) {
        MDC.put("issueNumber", String.valueOf(issueNumber));
    }

    public static void setStage(int issueNumber, TriageStage stage) {
        MDC.put("issueNumber", String.valueOf(issueNumber));
        MDC.put("stage", stage.name());
    }

    public static void clear() {
        MDC.remove("issueNumber");
        MDC.remove("stage");
    }
}
