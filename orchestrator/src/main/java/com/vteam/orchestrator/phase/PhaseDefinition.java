package com.vteam.orchestrator.phase;

import com.vteam.orchestrator.model.WorkflowPhase;

/**
 * Static facts about one phase.
 *
 * @param phase        the phase
 * @param artifactPath workspace-relative file whose existence proves the phase
 *                     is complete; null for PRE and COMPLETED
 * @param label        human label shown in summaries
 */
public record PhaseDefinition(WorkflowPhase phase, String artifactPath, String label) {

    public boolean hasArtifact() {
        return artifactPath != null;
    }

    /** "specs/plan.md" → "specs". Empty for a top-level artifact. */
    public String artifactDirectory() {
        int slash = artifactPath.lastIndexOf('/');
        return slash < 0 ? "" : artifactPath.substring(0, slash);
    }

    /** "specs/plan.md" → "plan.md". */
    public String artifactFileName() {
        return artifactPath.substring(artifactPath.lastIndexOf('/') + 1);
    }
}
