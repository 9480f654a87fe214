package com.vteam.orchestrator.api;

import com.vteam.orchestrator.agent.AgentUnavailableException;
import com.vteam.orchestrator.api.dto.ErrorResponse;
import com.vteam.orchestrator.model.AdvancementBlockedException;
import com.vteam.orchestrator.model.WorkflowException;
import com.vteam.orchestrator.workspace.WorkspaceFileNotFoundException;
import com.vteam.orchestrator.workspace.WorkspaceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Locale;

/**
 * Maps domain exceptions to HTTP statuses and a JSON {error, message} body.
 *
 *   VALIDATION                      → 400
 *   NOT_FOUND, file not found       → 404
 *   PREREQUISITE_NOT_MET,
 *   PHASE_NOT_READY,
 *   ADVANCEMENT_BLOCKED,
 *   concurrent modification         → 409
 *   agent runner unavailable        → 502
 *   workspace unavailable           → 503
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(AdvancementBlockedException.class)
    public ResponseEntity<ErrorResponse> handleBlocked(AdvancementBlockedException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(new ErrorResponse("advancement_blocked", ex.getMessage(), ex.getMissingArtifact()));
    }

    @ExceptionHandler(WorkflowException.class)
    public ResponseEntity<ErrorResponse> handleWorkflow(WorkflowException ex) {
        HttpStatus status = switch (ex.getKind()) {
            case VALIDATION           -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND            -> HttpStatus.NOT_FOUND;
            case PREREQUISITE_NOT_MET,
                 PHASE_NOT_READY,
                 ADVANCEMENT_BLOCKED  -> HttpStatus.CONFLICT;
        };
        return ResponseEntity.status(status)
                .body(ErrorResponse.of(ex.getKind().name().toLowerCase(Locale.ROOT), ex.getMessage()));
    }

    @ExceptionHandler(WorkspaceFileNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleFileNotFound(WorkspaceFileNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ErrorResponse.of("file_not_found", ex.getMessage()));
    }

    @ExceptionHandler(WorkspaceUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleWorkspaceUnavailable(WorkspaceUnavailableException ex) {
        log.warn("Workspace unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorResponse.of("workspace_unavailable", ex.getMessage()));
    }

    @ExceptionHandler(AgentUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleAgentUnavailable(AgentUnavailableException ex) {
        log.warn("Agent runner unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ErrorResponse.of("agent_unavailable", ex.getMessage()));
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleConcurrentEdit(OptimisticLockingFailureException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ErrorResponse.of("concurrent_modification",
                        "The workflow was modified concurrently; reload and retry"));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleMalformed(Exception ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of("malformed_request", ex.getMessage()));
    }
}
