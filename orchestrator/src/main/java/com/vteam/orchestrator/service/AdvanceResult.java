package com.vteam.orchestrator.service;

import com.vteam.orchestrator.model.WorkflowPhase;

/**
 * Answer to advance(): the workflow may move on, and this is the phase whose
 * sessions should be started next. Nothing is changed by producing it.
 */
public record AdvanceResult(String workflowId, WorkflowPhase currentPhase, WorkflowPhase nextPhase) {}
