package com.vteam.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Stages of an RFE workflow, in their total order.
 *
 * Transitions (evidence driven, see PhaseReconciler):
 *   PRE → SPECIFY → PLAN → TASKS → COMPLETED
 *
 * PRE and COMPLETED carry no artifact of their own. The declaration order
 * IS the phase order; compareTo() is used for "earlier than" checks.
 */
public enum WorkflowPhase {
    PRE,
    SPECIFY,
    PLAN,
    TASKS,
    COMPLETED;

    /** Phases whose completion is proven by an artifact in the workspace. */
    public static final List<WorkflowPhase> ARTIFACT_PHASES = List.of(SPECIFY, PLAN, TASKS);

    public boolean isTerminal() {
        return this == COMPLETED;
    }

    public boolean hasArtifact() {
        return ARTIFACT_PHASES.contains(this);
    }

    /**
     * The phase whose artifact is being produced while the workflow sits in
     * this phase. A workflow in PRE works on SPECIFY; COMPLETED has none.
     */
    public WorkflowPhase workingPhase() {
        return this == PRE ? SPECIFY : this;
    }

    /** Null for COMPLETED. */
    public WorkflowPhase next() {
        int idx = ordinal();
        WorkflowPhase[] all = values();
        return idx < all.length - 1 ? all[idx + 1] : null;
    }

    public boolean isBefore(WorkflowPhase other) {
        return compareTo(other) < 0;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static WorkflowPhase fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("phase must not be null");
        }
        String v = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(p -> p.name().equals(v))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown phase: " + value));
    }
}
