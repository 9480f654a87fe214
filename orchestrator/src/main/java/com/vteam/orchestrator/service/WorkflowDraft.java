package com.vteam.orchestrator.service;

import java.util.List;

/**
 * Caller input for creating a workflow. Validated by WorkflowService.create().
 * repoBranch, clonePath and workspacePath are optional.
 */
public record WorkflowDraft(
        String title,
        String description,
        String repoUrl,
        String repoBranch,
        String clonePath,
        String workspacePath,
        List<String> selectedAgents
) {}
