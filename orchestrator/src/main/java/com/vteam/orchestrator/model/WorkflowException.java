package com.vteam.orchestrator.model;

/**
 * Thrown when a workflow operation is rejected because of the caller's input
 * or the workflow's current state.
 *
 * Unchecked so callers only catch it when they have a specific recovery
 * strategy; the API layer maps each {@link Kind} to an HTTP status.
 * Infrastructure faults use their own types (WorkspaceUnavailableException,
 * AgentUnavailableException) because they are retryable.
 */
public class WorkflowException extends RuntimeException {

    public enum Kind {
        VALIDATION,             // bad input, caller's fault
        NOT_FOUND,              // unknown workflow / session id
        PREREQUISITE_NOT_MET,   // workflow state forbids the operation
        PHASE_NOT_READY,        // requested phase is not the one being worked on
        ADVANCEMENT_BLOCKED     // current phase's artifact is missing
    }

    private final Kind kind;

    public WorkflowException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }

    public static WorkflowException validation(String message) {
        return new WorkflowException(Kind.VALIDATION, message);
    }

    public static WorkflowException notFound(String message) {
        return new WorkflowException(Kind.NOT_FOUND, message);
    }

    public static WorkflowException prerequisiteNotMet(String message) {
        return new WorkflowException(Kind.PREREQUISITE_NOT_MET, message);
    }

    public static WorkflowException phaseNotReady(String message) {
        return new WorkflowException(Kind.PHASE_NOT_READY, message);
    }
}
