package com.vteam.orchestrator.api.dto;

import com.vteam.orchestrator.model.WorkflowPhase;
import com.vteam.orchestrator.service.AdvanceResult;

/**
 * Response body for POST .../rfe-workflows/{id}/advance. nextPhase is the
 * phase whose sessions should be started next.
 */
public record AdvanceResponse(String workflowId, WorkflowPhase currentPhase, WorkflowPhase nextPhase,
                              boolean canAdvance) {

    public static AdvanceResponse from(AdvanceResult r) {
        return new AdvanceResponse(r.workflowId(), r.currentPhase(), r.nextPhase(), true);
    }
}
