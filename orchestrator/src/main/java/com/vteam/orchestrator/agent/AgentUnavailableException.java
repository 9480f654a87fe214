package com.vteam.orchestrator.agent;

/**
 * Thrown when the agent runner rejects a request or is unreachable.
 */
public class AgentUnavailableException extends RuntimeException {

    public AgentUnavailableException(String message) {
        super(message);
    }

    public AgentUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
