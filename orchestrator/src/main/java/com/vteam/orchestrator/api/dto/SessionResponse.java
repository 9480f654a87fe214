package com.vteam.orchestrator.api.dto;

import com.vteam.orchestrator.model.AgentSession;
import com.vteam.orchestrator.model.SessionStatus;
import com.vteam.orchestrator.model.WorkflowPhase;

import java.time.Instant;
import java.util.UUID;

public record SessionResponse(
        UUID          id,
        WorkflowPhase phase,
        String        agentPersona,
        SessionStatus status,
        String        externalName,
        String        producedArtifactPath,
        boolean       rerun,
        boolean       linked,
        String        failureReason,
        Instant       startedAt,
        Instant       completedAt
) {
    public static SessionResponse from(AgentSession s) {
        return new SessionResponse(
                s.getId(),
                s.getPhase(),
                s.getAgentPersona(),
                s.getStatus(),
                s.getExternalName(),
                s.getProducedArtifactPath(),
                s.isRerun(),
                s.isLinked(),
                s.getFailureReason(),
                s.getStartedAt(),
                s.getCompletedAt()
        );
    }
}
