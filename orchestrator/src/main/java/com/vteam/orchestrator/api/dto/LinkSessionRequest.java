package com.vteam.orchestrator.api.dto;

/** Request body for POST .../rfe-workflows/{id}/sessions/link. */
public record LinkSessionRequest(String sessionName, String phase, String agentPersona) {}
