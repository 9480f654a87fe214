package com.vteam.orchestrator.agent;

import com.vteam.orchestrator.model.SessionStatus;

/**
 * External system that executes agent sessions.
 *
 * Launching only hands the work over; the session runs to completion on the
 * runner's side and its outcome is observed through {@link #pollStatus}.
 */
public interface AgentRunner {

    /**
     * Start a session.
     *
     * @return the runner's handle for the new session
     * @throws AgentUnavailableException if the runner rejects the request or
     *         cannot be reached
     */
    String launch(AgentRunRequest request);

    /**
     * Current status of a session previously returned by {@link #launch}.
     *
     * @throws AgentUnavailableException if the runner cannot be reached
     */
    SessionStatus pollStatus(String project, String externalName);
}
