package com.vteam.orchestrator.api.dto;

import java.util.List;

/**
 * Request body for POST .../rfe-workflows/{id}/phases/{phase}/sessions.
 *
 * personas defaults to every selected agent. regenerate must be true to run a
 * phase whose artifact already exists.
 */
public record StartPhaseSessionRequest(List<String> personas, boolean regenerate) {}
