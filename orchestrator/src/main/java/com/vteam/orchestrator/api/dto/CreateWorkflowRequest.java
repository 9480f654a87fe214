package com.vteam.orchestrator.api.dto;

import com.vteam.orchestrator.service.WorkflowDraft;

import java.util.List;

/**
 * Request body for POST /api/projects/{project}/rfe-workflows.
 *
 * Required: title, description, targetRepository.url, selectedAgents (1..8)
 * Optional: targetRepository.branch (default "main"), targetRepository.clonePath,
 *   workspacePath (default /rfe-workflows/{id}/workspace)
 */
public record CreateWorkflowRequest(String title,
                                    String description,
                                    Repository targetRepository,
                                    String workspacePath,
                                    List<String> selectedAgents) {

    public record Repository(String url, String branch, String clonePath) {}

    public WorkflowDraft toDraft() {
        Repository repo = targetRepository != null ? targetRepository : new Repository(null, null, null);
        return new WorkflowDraft(title, description, repo.url(), repo.branch(), repo.clonePath(),
                workspacePath, selectedAgents);
    }
}
