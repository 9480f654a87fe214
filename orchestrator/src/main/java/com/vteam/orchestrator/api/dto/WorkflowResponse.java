package com.vteam.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.vteam.orchestrator.model.RfeWorkflow;
import com.vteam.orchestrator.model.TargetRepository;
import com.vteam.orchestrator.model.WorkflowPhase;
import com.vteam.orchestrator.model.WorkflowStatus;

import java.time.Instant;
import java.util.List;

/**
 * Response body for workflow endpoints. agentSessions is omitted from list
 * results.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkflowResponse(
        String                 id,
        String                 project,
        String                 title,
        String                 description,
        TargetRepositoryBody   targetRepository,
        String                 workspacePath,
        List<String>           selectedAgents,
        WorkflowPhase          currentPhase,
        WorkflowStatus         status,
        String                 createdBy,
        Instant                createdAt,
        Instant                updatedAt,
        Long                   version,
        List<SessionResponse>  agentSessions
) {
    public record TargetRepositoryBody(String url, String branch, String clonePath) {
        static TargetRepositoryBody from(TargetRepository r) {
            return new TargetRepositoryBody(r.getUrl(), r.getBranch(), r.getClonePath());
        }
    }

    public static WorkflowResponse from(RfeWorkflow wf) {
        return build(wf, wf.getAgentSessions().stream().map(SessionResponse::from).toList());
    }

    /** Without sessions, for list views. */
    public static WorkflowResponse slim(RfeWorkflow wf) {
        return build(wf, null);
    }

    private static WorkflowResponse build(RfeWorkflow wf, List<SessionResponse> sessions) {
        return new WorkflowResponse(
                wf.getId(),
                wf.getProject(),
                wf.getTitle(),
                wf.getDescription(),
                TargetRepositoryBody.from(wf.getTargetRepository()),
                wf.getWorkspacePath(),
                wf.getSelectedAgents().personas(),
                wf.getCurrentPhase(),
                wf.getStatus(),
                wf.getCreatedBy(),
                wf.getCreatedAt(),
                wf.getUpdatedAt(),
                wf.getVersion(),
                sessions
        );
    }
}
