package com.vteam.orchestrator.agent;

import java.util.Map;

/**
 * Everything the agent runner needs to start one session.
 *
 * @param project       project the session runs in
 * @param prompt        slash command plus phase framing
 * @param displayName   "{title} - {phase}"
 * @param workspacePath shared workspace the agent writes its artifact into
 * @param environment   environment variables for the agent process
 * @param labels        selectors used to find the workflow's sessions later
 * @param annotations   free-form metadata (expected artifact path)
 */
public record AgentRunRequest(
        String project,
        String prompt,
        String displayName,
        String workspacePath,
        Map<String, String> environment,
        Map<String, String> labels,
        Map<String, String> annotations
) {}
