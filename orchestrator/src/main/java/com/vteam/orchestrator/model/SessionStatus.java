package com.vteam.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Execution state of one agent session, as last observed in the agent runner.
 *
 * Transitions:
 *   PENDING → RUNNING → COMPLETED | FAILED | STOPPED
 *   PENDING → FAILED  (launch rejected)
 */
public enum SessionStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    STOPPED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == STOPPED;
    }

    public boolean isInFlight() {
        return this == PENDING || this == RUNNING;
    }

    /**
     * Map the runner's session phase ("Pending", "Creating", "Running",
     * "Completed", "Failed", "Error", "Stopped") onto our states.
     * Unknown or missing values are treated as PENDING.
     */
    public static SessionStatus fromRunnerPhase(String runnerPhase) {
        if (runnerPhase == null) return PENDING;
        return switch (runnerPhase.trim().toLowerCase(Locale.ROOT)) {
            case "running"           -> RUNNING;
            case "completed"         -> COMPLETED;
            case "failed", "error"   -> FAILED;
            case "stopped"           -> STOPPED;
            default                  -> PENDING;   // pending, creating, ""
        };
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
