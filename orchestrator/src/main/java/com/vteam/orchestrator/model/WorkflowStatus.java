package com.vteam.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle status of a workflow, independent of its phase
 * (a workflow can be PAUSED in the middle of PLAN).
 *
 * Transitions:
 *   ACTIVE    ⇄ PAUSED     (pause / resume)
 *   ACTIVE    → COMPLETED  (derived phase reaches COMPLETED)
 *   COMPLETED → ACTIVE     (an artifact disappeared, phase regressed)
 *   ACTIVE    → FAILED     (every session of the working phase ended without the artifact)
 *   FAILED    → ACTIVE     (a session was relaunched, or the working phase moved on)
 */
public enum WorkflowStatus {
    ACTIVE,
    PAUSED,
    COMPLETED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
