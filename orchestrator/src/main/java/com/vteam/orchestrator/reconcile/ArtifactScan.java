package com.vteam.orchestrator.reconcile;

import com.vteam.orchestrator.model.WorkflowPhase;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of which phase artifacts exist in a workspace, taken at one moment.
 *
 * Maps each artifact phase to the workspace-relative path where its artifact
 * was actually found (which may be inside a feature sub-directory and may
 * differ in case from the configured name). Absent phases have no entry.
 */
public final class ArtifactScan {

    private final Map<WorkflowPhase, String> found;

    public ArtifactScan(Map<WorkflowPhase, String> found) {
        EnumMap<WorkflowPhase, String> copy = new EnumMap<>(WorkflowPhase.class);
        copy.putAll(found);
        this.found = Collections.unmodifiableMap(copy);
    }

    public static ArtifactScan empty() {
        return new ArtifactScan(Map.of());
    }

    public boolean isPresent(WorkflowPhase phase) {
        return found.containsKey(phase);
    }

    public Optional<String> resolvedPath(WorkflowPhase phase) {
        return Optional.ofNullable(found.get(phase));
    }

    public int presentCount() {
        return found.size();
    }

    public Map<WorkflowPhase, String> asMap() {
        return found;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ArtifactScan other && found.equals(other.found);
    }

    @Override
    public int hashCode() { return found.hashCode(); }

    @Override
    public String toString() { return "ArtifactScan" + found; }
}
