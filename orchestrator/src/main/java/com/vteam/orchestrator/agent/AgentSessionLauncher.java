package com.vteam.orchestrator.agent;

import com.vteam.orchestrator.metrics.OrchestratorMetrics;
import com.vteam.orchestrator.model.AgentSession;
import com.vteam.orchestrator.model.RfeWorkflow;
import com.vteam.orchestrator.model.WorkflowException;
import com.vteam.orchestrator.model.WorkflowPhase;
import com.vteam.orchestrator.phase.PhaseDefinitionTable;
import com.vteam.orchestrator.reconcile.ArtifactScan;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Starts agent sessions for a phase and refreshes their status.
 *
 * Launching only waits for the runner to hand back a session name; the
 * sessions themselves run concurrently on the runner and are observed later
 * through {@link #refresh}. Nothing here decides phase completion.
 *
 * Returned sessions are not attached to the workflow; the caller owns
 * persistence.
 */
@Component
public class AgentSessionLauncher {

    private static final Logger log = LoggerFactory.getLogger(AgentSessionLauncher.class);

    private final AgentRunner          runner;
    private final PromptComposer       prompts;
    private final PhaseDefinitionTable phases;
    private final OrchestratorMetrics  metrics;

    // Caps concurrent launch requests; one task per persona.
    private final ExecutorService launchPool;

    public AgentSessionLauncher(AgentRunner runner,
                                PromptComposer prompts,
                                PhaseDefinitionTable phases,
                                OrchestratorMetrics metrics,
                                @Value("${vteam.agents.launch-pool-size:4}") int launchPoolSize) {
        this.runner     = runner;
        this.prompts    = prompts;
        this.phases     = phases;
        this.metrics    = metrics;
        this.launchPool = Executors.newFixedThreadPool(launchPoolSize);
    }

    @PreDestroy
    void shutdown() {
        launchPool.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Launch
    // ------------------------------------------------------------------

    /**
     * Start one session.
     *
     * @return a PENDING session carrying the runner's handle
     * @throws WorkflowException (PREREQUISITE_NOT_MET) if an earlier phase's
     *         artifact is missing from {@code scan}
     * @throws AgentUnavailableException if the runner rejects the launch
     */
    public AgentSession launch(RfeWorkflow workflow, WorkflowPhase phase, String persona,
                               ArtifactScan scan, boolean rerun) {
        checkPrerequisites(phase, scan);
        try {
            String name = runner.launch(buildRequest(workflow, phase, persona));
            metrics.recordLaunch(phase.wireName(), "launched");
            AgentSession session = new AgentSession(phase, persona, name, phases.artifactPath(phase));
            session.setRerun(rerun);
            return session;
        } catch (AgentUnavailableException e) {
            metrics.recordLaunch(phase.wireName(), "failed");
            throw e;
        }
    }

    /**
     * Start one session per persona in parallel.
     *
     * Personas whose launch failed come back as FAILED sessions with the
     * reason recorded, so the caller sees the partial outcome.
     *
     * @return one session per persona, in persona order
     * @throws AgentUnavailableException if every launch failed
     */
    public List<AgentSession> launchAll(RfeWorkflow workflow, WorkflowPhase phase, List<String> personas,
                                        ArtifactScan scan, boolean rerun) {
        checkPrerequisites(phase, scan);
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        Map<String, CompletableFuture<AgentSession>> futures = new LinkedHashMap<>();
        for (String persona : personas) {
            futures.put(persona, CompletableFuture.supplyAsync(() -> {
                if (mdc != null) MDC.setContextMap(mdc);
                try {
                    return launch(workflow, phase, persona, scan, rerun);
                } finally {
                    MDC.clear();
                }
            }, launchPool));
        }

        List<AgentSession> sessions = new ArrayList<>();
        String lastFailure = null;
        int failures = 0;
        for (Map.Entry<String, CompletableFuture<AgentSession>> f : futures.entrySet()) {
            try {
                sessions.add(f.getValue().join());
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (!(cause instanceof AgentUnavailableException)) {
                    if (cause instanceof RuntimeException re) throw re;
                    throw e;
                }
                failures++;
                lastFailure = cause.getMessage();
                log.warn("Launch of '{}' for phase {} failed: {}", f.getKey(), phase.wireName(), lastFailure);
                AgentSession failed = AgentSession.launchFailed(
                        phase, f.getKey(), phases.artifactPath(phase), lastFailure);
                failed.setRerun(rerun);
                sessions.add(failed);
            }
        }

        if (failures == personas.size()) {
            throw new AgentUnavailableException(
                    "All " + failures + " launches for phase " + phase.wireName() + " failed; last error: " + lastFailure);
        }
        log.info("Launched {}/{} sessions for phase {}",
                personas.size() - failures, personas.size(), phase.wireName());
        return sessions;
    }

    AgentRunRequest buildRequest(RfeWorkflow workflow, WorkflowPhase phase, String persona) {
        String artifact = phases.artifactPath(phase);
        return new AgentRunRequest(
                workflow.getProject(),
                prompts.compose(workflow, phase, persona),
                prompts.displayName(workflow, phase),
                workflow.getWorkspacePath(),
                Map.of("WORKFLOW_PHASE", phase.wireName(),
                       "PARENT_RFE",     workflow.getId(),
                       "AGENT_PERSONA",  persona),
                Map.of("project",      workflow.getProject(),
                       "rfe-workflow", workflow.getId(),
                       "rfe-phase",    phase.wireName()),
                Map.of("rfe-expected", artifact));
    }

    private void checkPrerequisites(WorkflowPhase phase, ArtifactScan scan) {
        for (WorkflowPhase earlier : WorkflowPhase.ARTIFACT_PHASES) {
            if (!earlier.isBefore(phase)) break;
            if (!scan.isPresent(earlier)) {
                throw WorkflowException.prerequisiteNotMet("Cannot start " + phase.wireName()
                        + ": " + phases.artifactPath(earlier) + " from phase " + earlier.wireName() + " is missing");
            }
        }
    }

    // ------------------------------------------------------------------
    // Status
    // ------------------------------------------------------------------

    /**
     * Poll the runner for a session's status and record it.
     * Sessions already in a terminal state, or never launched, are not polled.
     *
     * @return true if the stored status changed
     */
    public boolean refresh(RfeWorkflow workflow, AgentSession session) {
        if (session.getStatus().isTerminal() || session.getExternalName() == null) {
            return false;
        }
        boolean changed = session.observe(runner.pollStatus(workflow.getProject(), session.getExternalName()));
        if (changed) {
            log.info("Session '{}' ({}/{}) is now {}", session.getExternalName(),
                    session.getPhase().wireName(), session.getAgentPersona(), session.getStatus().wireName());
        }
        return changed;
    }
}
