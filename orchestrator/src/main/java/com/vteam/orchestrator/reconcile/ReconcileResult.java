package com.vteam.orchestrator.reconcile;

import com.vteam.orchestrator.model.WorkflowPhase;

/**
 * Outcome of one reconcile pass.
 *
 * @param previous phase that was stored before the pass
 * @param current  phase derived from the workspace (now stored)
 * @param scan     the evidence it was derived from
 * @param won      true if this pass wrote the new phase and emitted the event
 */
public record ReconcileResult(WorkflowPhase previous, WorkflowPhase current, ArtifactScan scan, boolean won) {

    public boolean changed() {
        return previous != current;
    }

    public boolean isRegression() {
        return current.isBefore(previous);
    }
}
