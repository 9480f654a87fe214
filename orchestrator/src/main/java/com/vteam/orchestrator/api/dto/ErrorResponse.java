package com.vteam.orchestrator.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Body of every error response.
 *
 * @param error           machine-readable code, e.g. "advancement_blocked"
 * @param message         human-readable explanation
 * @param missingArtifact set for advancement_blocked when an artifact is missing
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, String message, String missingArtifact) {

    public static ErrorResponse of(String error, String message) {
        return new ErrorResponse(error, message, null);
    }
}
