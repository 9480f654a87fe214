package com.vteam.orchestrator.service;

import com.vteam.orchestrator.model.WorkflowPhase;
import com.vteam.orchestrator.model.WorkflowStatus;

import java.util.List;

/**
 * Progress report for one workflow.
 *
 * displayStatus is one of "not started", "running", "in progress",
 * "completed", "attention".
 */
public record WorkflowSummary(
        String workflowId,
        WorkflowPhase phase,
        WorkflowStatus status,
        String displayStatus,
        double progress,
        boolean canAdvance,
        List<PhaseProgress> phases
) {
    public static final String NOT_STARTED = "not started";
    public static final String RUNNING     = "running";
    public static final String IN_PROGRESS = "in progress";
    public static final String COMPLETED   = "completed";
    public static final String ATTENTION   = "attention";

    /**
     * @param resolvedPath where the artifact was found; null if absent
     */
    public record PhaseProgress(
            WorkflowPhase phase,
            String label,
            String artifactPath,
            boolean present,
            String resolvedPath,
            int activeSessions
    ) {}
}
