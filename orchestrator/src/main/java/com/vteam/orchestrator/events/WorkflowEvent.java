package com.vteam.orchestrator.events;

import java.time.Instant;
import java.util.Map;

/**
 * Something observable happened to a workflow.
 *
 * Published as a Spring application event, so other beans can react with
 * {@code @EventListener} without the publisher knowing about them.
 *
 * @param type       one of the constants below
 * @param workflowId the workflow concerned
 * @param payload    event-specific data (from/to phase, personas, ...)
 * @param timestamp  when the event was emitted
 */
public record WorkflowEvent(
        String type,
        String workflowId,
        Map<String, Object> payload,
        Instant timestamp
) {
    public static final String PHASE_TRANSITION_DETECTED = "phase_transition_detected";
    public static final String PHASE_REGRESSION_DETECTED = "phase_regression_detected";
    public static final String PHASE_RERUN_REQUESTED     = "phase_rerun_requested";
    public static final String SESSIONS_LAUNCHED         = "sessions_launched";
    public static final String STATUS_CHANGED            = "workflow_status_changed";
    public static final String WORKFLOW_CREATED          = "workflow_created";
    public static final String WORKFLOW_DELETED          = "workflow_deleted";

    public static WorkflowEvent of(String type, String workflowId, Map<String, Object> payload) {
        return new WorkflowEvent(type, workflowId, Map.copyOf(payload), Instant.now());
    }
}
