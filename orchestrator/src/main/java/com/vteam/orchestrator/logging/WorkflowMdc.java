package com.vteam.orchestrator.logging;

import org.slf4j.MDC;

/**
 * MDC keys carried on every log line of a workflow operation.
 */
public final class WorkflowMdc {

    public static final String WORKFLOW_ID = "workflowId";
    public static final String PHASE       = "phase";
    public static final String SESSION_ID  = "sessionId";

    private WorkflowMdc() {}

    public static void setWorkflow(String workflowId) {
        MDC.put(WORKFLOW_ID, workflowId);
    }

    public static void setPhase(String phase) {
        MDC.put(PHASE, phase);
    }

    public static void setSession(String sessionId) {
        MDC.put(SESSION_ID, sessionId);
    }

    public static void clear() {
        MDC.remove(WORKFLOW_ID);
        MDC.remove(PHASE);
        MDC.remove(SESSION_ID);
    }
}
