package com.vteam.orchestrator.workspace;

/**
 * The workspace store could not be reached, answered with a server error, or
 * did not answer in time. Transient: the caller may retry the request.
 */
public class WorkspaceUnavailableException extends RuntimeException {

    public WorkspaceUnavailableException(String message) {
        super(message);
    }

    public WorkspaceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
