package com.vteam.orchestrator.model;

/**
 * Raised by advance() when the workflow cannot move on. Carries the artifact
 * that must appear first so the caller can say e.g. "specs/plan.md not yet
 * produced". missingArtifact is null when the workflow is already completed.
 */
public class AdvancementBlockedException extends WorkflowException {

    private final WorkflowPhase phase;
    private final String        missingArtifact;

    public AdvancementBlockedException(WorkflowPhase phase, String missingArtifact) {
        super(Kind.ADVANCEMENT_BLOCKED, missingArtifact == null
                ? "Workflow is already " + phase.wireName() + "; nothing to advance to"
                : missingArtifact + " not yet produced (phase " + phase.wireName() + ")");
        this.phase           = phase;
        this.missingArtifact = missingArtifact;
    }

    public WorkflowPhase getPhase()        { return phase; }
    public String        getMissingArtifact() { return missingArtifact; }
}
