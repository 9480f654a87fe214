package com.vteam.orchestrator.service;

import com.vteam.orchestrator.agent.AgentSessionLauncher;
import com.vteam.orchestrator.events.WorkflowEvent;
import com.vteam.orchestrator.events.WorkflowEventPublisher;
import com.vteam.orchestrator.logging.WorkflowMdc;
import com.vteam.orchestrator.model.*;
import com.vteam.orchestrator.phase.PhaseDefinition;
import com.vteam.orchestrator.phase.PhaseDefinitionTable;
import com.vteam.orchestrator.reconcile.ArtifactScan;
import com.vteam.orchestrator.reconcile.PhaseReconciler;
import com.vteam.orchestrator.reconcile.ReconcileResult;
import com.vteam.orchestrator.repository.WorkflowRepository;
import com.vteam.orchestrator.workspace.WorkspaceEntry;
import com.vteam.orchestrator.workspace.WorkspaceInspector;
import com.vteam.orchestrator.workspace.WorkspaceRef;
import org.hibernate.Hibernate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Workflow lifecycle operations.
 *
 * Every read that reports a phase reconciles first, so callers always see the
 * phase the workspace currently proves. Reconciling never touches sessions or
 * status; the lifecycle status is brought in line afterwards by
 * {@link #syncStatus}.
 *
 * Public methods that touch the DB are @Transactional, except
 * {@link #startPhaseSession}: runner calls can take seconds, so it checks and
 * records in two short transactions and launches between them. Concurrent
 * edits of the same workflow fail with ObjectOptimisticLockingFailureException
 * (version column) rather than being merged silently.
 */
@Service
public class WorkflowService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowService.class);

    private final WorkflowRepository     workflows;
    private final PhaseReconciler        reconciler;
    private final AgentSessionLauncher   launcher;
    private final WorkspaceInspector     inspector;
    private final PhaseDefinitionTable   phases;
    private final WorkflowEventPublisher events;
    private final TransactionTemplate    tx;

    public WorkflowService(WorkflowRepository workflows,
                           PhaseReconciler reconciler,
                           AgentSessionLauncher launcher,
                           WorkspaceInspector inspector,
                           PhaseDefinitionTable phases,
                           WorkflowEventPublisher events,
                           PlatformTransactionManager txManager) {
        this.workflows  = workflows;
        this.reconciler = reconciler;
        this.launcher   = launcher;
        this.inspector  = inspector;
        this.phases     = phases;
        this.events     = events;
        this.tx         = new TransactionTemplate(txManager);
    }

    // ------------------------------------------------------------------
    // Create / read
    // ------------------------------------------------------------------

    /**
     * Create a workflow in phase PRE, status ACTIVE.
     *
     * @throws WorkflowException (VALIDATION) on missing title or description,
     *         a malformed repository URL, or a bad agent selection
     */
    @Transactional
    public RfeWorkflow create(String project, WorkflowDraft draft, String createdBy) {
        requireText(project, "project");
        requireText(draft.title(), "title");
        requireText(draft.description(), "description");
        TargetRepository repo  = TargetRepository.of(draft.repoUrl(), draft.repoBranch(), draft.clonePath());
        SelectedAgents agents  = SelectedAgents.of(draft.selectedAgents());

        RfeWorkflow wf = new RfeWorkflow(project.trim(), draft.title().trim(), draft.description().trim(),
                repo, agents, draft.workspacePath());
        wf.setCreatedBy(createdBy);
        wf = workflows.save(wf);

        try {
            WorkflowMdc.setWorkflow(wf.getId());
            log.info("Created workflow '{}' in project {} ({} agents, repo {})",
                    wf.getTitle(), project, agents.size(), repo.getUrl());
            events.publish(WorkflowEvent.WORKFLOW_CREATED, wf.getId(),
                    Map.of("project", project, "agents", agents.personas()));
            return wf;
        } finally {
            WorkflowMdc.clear();
        }
    }

    /** Newest first. Stored phases are reported as-is; nothing is reconciled. */
    @Transactional(readOnly = true)
    public List<RfeWorkflow> list(String project) {
        return workflows.findByProjectOrderByCreatedAtDesc(project);
    }

    @Transactional
    public RfeWorkflow get(String project, String id) {
        RfeWorkflow wf = load(project, id);
        try {
            reconciler.reconcile(wf);
            syncStatus(wf);
            Hibernate.initialize(wf.getAgentSessions());
            return wf;
        } finally {
            WorkflowMdc.clear();
        }
    }

    // ------------------------------------------------------------------
    // Update / delete
    // ------------------------------------------------------------------

    /**
     * Change title, description and/or agent selection. Null arguments are
     * left unchanged.
     *
     * @param expectedVersion if non-null, the update is rejected unless the
     *                        stored version still matches
     * @throws WorkflowException (PREREQUISITE_NOT_MET) when changing agents of
     *         a completed workflow or while sessions are pending or running
     */
    @Transactional
    public RfeWorkflow update(String project, String id, String title, String description,
                              List<String> selectedAgents, Long expectedVersion) {
        RfeWorkflow wf = load(project, id);
        try {
            if (expectedVersion != null && !expectedVersion.equals(wf.getVersion())) {
                throw new ObjectOptimisticLockingFailureException(RfeWorkflow.class, id);
            }
            if (title != null) {
                requireText(title, "title");
                wf.setTitle(title.trim());
            }
            if (description != null) {
                requireText(description, "description");
                wf.setDescription(description.trim());
            }
            if (selectedAgents != null) {
                SelectedAgents agents = SelectedAgents.of(selectedAgents);
                if (wf.getStatus() == WorkflowStatus.COMPLETED || wf.getCurrentPhase().isTerminal()) {
                    throw WorkflowException.prerequisiteNotMet(
                            "Agents of a completed workflow cannot be changed");
                }
                if (wf.hasInFlightSessions()) {
                    throw WorkflowException.prerequisiteNotMet(
                            "Agents cannot be changed while sessions are pending or running");
                }
                wf.setSelectedAgents(agents);
            }
            wf = workflows.save(wf);
            log.info("Updated workflow {}", id);
            Hibernate.initialize(wf.getAgentSessions());
            return wf;
        } finally {
            WorkflowMdc.clear();
        }
    }

    /** Removes the workflow and its sessions. The workspace is left alone. */
    @Transactional
    public void delete(String project, String id) {
        RfeWorkflow wf = load(project, id);
        try {
            int sessions = wf.getAgentSessions().size();
            workflows.delete(wf);
            log.info("Deleted workflow {} with {} sessions", id, sessions);
            events.publish(WorkflowEvent.WORKFLOW_DELETED, id, Map.of("sessions", sessions));
        } finally {
            WorkflowMdc.clear();
        }
    }

    // ------------------------------------------------------------------
    // Phase progression
    // ------------------------------------------------------------------

    /**
     * Check that the workflow may move on and report where to.
     * The phase itself only ever moves by evidence, so nothing is written
     * except what reconcile and the status sync write. Those writes are
     * committed even when the advance is blocked.
     *
     * @throws AdvancementBlockedException naming the missing artifact, or
     *         with a null artifact when the workflow is already completed
     */
    @Transactional(noRollbackFor = WorkflowException.class)
    public AdvanceResult advance(String project, String id) {
        RfeWorkflow wf = load(project, id);
        try {
            ReconcileResult r = reconciler.reconcile(wf);
            syncStatus(wf);
            WorkflowPhase current = wf.getCurrentPhase();
            WorkflowMdc.setPhase(current.wireName());

            if (!reconciler.canAdvance(wf, r.scan())) {
                String missing = current.isTerminal() ? null : phases.artifactPath(current);
                log.info("Advance blocked at phase {}: {}", current.wireName(),
                        missing == null ? "already completed" : missing + " missing");
                throw new AdvancementBlockedException(current, missing);
            }
            WorkflowPhase next = current == WorkflowPhase.PRE ? current.workingPhase() : current.next();
            return new AdvanceResult(wf.getId(), current, next);
        } finally {
            WorkflowMdc.clear();
        }
    }

    /**
     * Launch one session per persona for a phase.
     *
     * The workflow is checked and reconciled in one transaction, the runner is
     * called outside any transaction, and the sessions are recorded in a
     * second one. A reconciled phase stays stored even when the request is
     * then refused.
     *
     * @param personas   subset of the selected agents; null or empty means all
     * @param regenerate required to re-run a phase whose artifact already exists
     * @return the sessions created by this call, including FAILED ones for
     *         personas whose launch was rejected
     * @throws WorkflowException VALIDATION for a non-artifact phase or an
     *         unselected persona; PREREQUISITE_NOT_MET when paused or an
     *         earlier artifact is missing; PHASE_NOT_READY when the phase is
     *         not the one being worked on
     */
    public List<AgentSession> startPhaseSession(String project, String id, WorkflowPhase phase,
                                                List<String> personas, boolean regenerate) {
        try {
            LaunchPlan plan = tx.execute(status -> planLaunch(project, id, phase, personas));
            RfeWorkflow wf = plan.workflow();
            ArtifactScan scan = plan.scan();

            boolean rerun = scan.isPresent(phase);
            if (rerun) {
                if (!regenerate) {
                    throw WorkflowException.phaseNotReady(phases.artifactPath(phase)
                            + " already exists; pass regenerate=true to run phase " + phase.wireName() + " again");
                }
                log.warn("Re-running phase {} although {} exists", phase.wireName(),
                        scan.resolvedPath(phase).orElse(phases.artifactPath(phase)));
                events.publish(WorkflowEvent.PHASE_RERUN_REQUESTED, wf.getId(),
                        Map.of("phase", phase.wireName(), "personas", plan.personas()));
            } else if (phase != wf.getCurrentPhase().workingPhase()) {
                throw WorkflowException.phaseNotReady("Workflow is working on phase "
                        + wf.getCurrentPhase().workingPhase().wireName() + ", not " + phase.wireName());
            }

            List<AgentSession> launched = launcher.launchAll(wf, phase, plan.personas(), scan, rerun);
            return recordLaunched(project, id, phase, launched, rerun);
        } finally {
            WorkflowMdc.clear();
        }
    }

    private LaunchPlan planLaunch(String project, String id, WorkflowPhase phase, List<String> personas) {
        RfeWorkflow wf = load(project, id);
        if (phase == null || !phase.hasArtifact()) {
            throw WorkflowException.validation("Sessions can only be started for phases "
                    + WorkflowPhase.ARTIFACT_PHASES.stream().map(WorkflowPhase::wireName).toList());
        }
        WorkflowMdc.setPhase(phase.wireName());
        List<String> chosen = choosePersonas(wf, personas);

        if (wf.getStatus() == WorkflowStatus.PAUSED) {
            throw WorkflowException.prerequisiteNotMet("Workflow is paused; resume it first");
        }
        return new LaunchPlan(wf, chosen, reconciler.reconcile(wf).scan());
    }

    /**
     * Attach freshly launched sessions to the stored workflow. If that fails
     * the runner sessions exist without a record; their names are logged so
     * they can be linked or stopped by hand.
     */
    private List<AgentSession> recordLaunched(String project, String id, WorkflowPhase phase,
                                              List<AgentSession> launched, boolean rerun) {
        try {
            return tx.execute(status -> {
                RfeWorkflow wf = load(project, id);
                launched.forEach(wf::addSession);
                if (wf.getStatus() == WorkflowStatus.FAILED) {
                    changeStatus(wf, WorkflowStatus.ACTIVE, "sessions relaunched");
                }
                // Flush rather than save(): the launched instances must become the managed ones.
                workflows.flush();

                long failed = launched.stream().filter(s -> s.getStatus() == SessionStatus.FAILED).count();
                events.publish(WorkflowEvent.SESSIONS_LAUNCHED, wf.getId(),
                        Map.of("phase", phase.wireName(), "launched", launched.size() - failed,
                               "failed", failed, "rerun", rerun));
                return launched;
            });
        } catch (RuntimeException e) {
            List<String> orphaned = launched.stream()
                    .map(AgentSession::getExternalName)
                    .filter(Objects::nonNull)
                    .toList();
            log.error("Workflow {}: sessions {} of phase {} were launched but could not be recorded",
                    id, orphaned, phase.wireName(), e);
            throw e;
        }
    }

    private record LaunchPlan(RfeWorkflow workflow, List<String> personas, ArtifactScan scan) { }

    private static List<String> choosePersonas(RfeWorkflow wf, List<String> requested) {
        SelectedAgents selected = wf.getSelectedAgents();
        if (requested == null || requested.isEmpty()) {
            return selected.personas();
        }
        List<String> chosen = SelectedAgents.of(requested).personas();
        for (String persona : chosen) {
            if (!selected.contains(persona)) {
                throw WorkflowException.validation("Agent '" + persona + "' is not selected for this workflow");
            }
        }
        return chosen;
    }

    // ------------------------------------------------------------------
    // Pause / resume
    // ------------------------------------------------------------------

    /** Idempotent. Running sessions keep running. */
    @Transactional
    public RfeWorkflow pause(String project, String id) {
        RfeWorkflow wf = load(project, id);
        try {
            switch (wf.getStatus()) {
                case PAUSED -> { }
                case ACTIVE -> changeStatus(wf, WorkflowStatus.PAUSED, "paused by user");
                default -> throw WorkflowException.prerequisiteNotMet(
                        "Cannot pause a " + wf.getStatus().wireName() + " workflow");
            }
            wf = workflows.save(wf);
            Hibernate.initialize(wf.getAgentSessions());
            return wf;
        } finally {
            WorkflowMdc.clear();
        }
    }

    /** Idempotent. */
    @Transactional
    public RfeWorkflow resume(String project, String id) {
        RfeWorkflow wf = load(project, id);
        try {
            switch (wf.getStatus()) {
                case ACTIVE -> { }
                case PAUSED -> changeStatus(wf, WorkflowStatus.ACTIVE, "resumed by user");
                default -> throw WorkflowException.prerequisiteNotMet(
                        "Only a paused workflow can be resumed; this one is "
                        + wf.getStatus().wireName());
            }
            wf = workflows.save(wf);
            Hibernate.initialize(wf.getAgentSessions());
            return wf;
        } finally {
            WorkflowMdc.clear();
        }
    }

    // ------------------------------------------------------------------
    // Sessions
    // ------------------------------------------------------------------

    /**
     * Sessions in start order. With {@code refresh}, non-terminal sessions
     * are polled first and the workflow is reconciled so the lifecycle status
     * reflects the new session states.
     */
    @Transactional
    public List<AgentSession> listSessions(String project, String id, boolean refresh) {
        RfeWorkflow wf = load(project, id);
        try {
            if (refresh) {
                int changed = 0;
                for (AgentSession s : wf.getAgentSessions()) {
                    if (launcher.refresh(wf, s)) changed++;
                }
                reconciler.reconcile(wf);
                syncStatus(wf);
                if (changed > 0) {
                    workflows.save(wf);
                    log.info("{} session(s) changed status", changed);
                }
            }
            return new ArrayList<>(wf.getAgentSessions());
        } finally {
            WorkflowMdc.clear();
        }
    }

    /**
     * Attach a session that was started outside this service. Its current
     * status is read from the runner, which also proves it exists.
     */
    @Transactional
    public AgentSession linkSession(String project, String id, String externalName,
                                    WorkflowPhase phase, String persona) {
        RfeWorkflow wf = load(project, id);
        try {
            requireText(externalName, "session name");
            requireText(persona, "agent persona");
            if (phase == null || !phase.hasArtifact()) {
                throw WorkflowException.validation("A linked session must belong to one of the phases "
                        + WorkflowPhase.ARTIFACT_PHASES.stream().map(WorkflowPhase::wireName).toList());
            }
            String name = externalName.trim();
            boolean duplicate = wf.getAgentSessions().stream().anyMatch(s -> name.equals(s.getExternalName()));
            if (duplicate) {
                throw WorkflowException.validation("Session '" + name + "' is already linked");
            }

            AgentSession session = new AgentSession(phase, persona.trim(), name, phases.artifactPath(phase));
            session.setLinked(true);
            launcher.refresh(wf, session);
            wf.addSession(session);
            workflows.flush();

            WorkflowMdc.setSession(name);
            log.info("Linked session '{}' to phase {}", name, phase.wireName());
            return session;
        } finally {
            WorkflowMdc.clear();
        }
    }

    /** Detach a session from the workflow. The external session keeps running. */
    @Transactional
    public void unlinkSession(String project, String id, UUID sessionId) {
        RfeWorkflow wf = load(project, id);
        try {
            if (!wf.removeSession(sessionId)) {
                throw WorkflowException.notFound("No session " + sessionId + " in workflow " + id);
            }
            workflows.save(wf);
            log.info("Unlinked session {}", sessionId);
        } finally {
            WorkflowMdc.clear();
        }
    }

    // ------------------------------------------------------------------
    // Summary
    // ------------------------------------------------------------------

    @Transactional
    public WorkflowSummary summary(String project, String id) {
        RfeWorkflow wf = load(project, id);
        try {
            ArtifactScan scan = reconciler.reconcile(wf).scan();
            syncStatus(wf);

            List<WorkflowSummary.PhaseProgress> perPhase = new ArrayList<>();
            for (PhaseDefinition def : phases.artifactPhases()) {
                int active = (int) wf.sessionsFor(def.phase()).stream()
                        .filter(s -> s.getStatus().isInFlight()).count();
                perPhase.add(new WorkflowSummary.PhaseProgress(def.phase(), def.label(), def.artifactPath(),
                        scan.isPresent(def.phase()), scan.resolvedPath(def.phase()).orElse(null), active));
            }
            double progress = scan.presentCount() * 100.0 / WorkflowPhase.ARTIFACT_PHASES.size();

            return new WorkflowSummary(wf.getId(), wf.getCurrentPhase(), wf.getStatus(),
                    displayStatus(wf, scan), progress, reconciler.canAdvance(wf, scan), perPhase);
        } finally {
            WorkflowMdc.clear();
        }
    }

    /**
     * "running" while any session is in flight; "completed" once every
     * artifact exists; "in progress" once any does; "attention" when a
     * session of the working phase failed and nothing is running.
     */
    static String displayStatus(RfeWorkflow wf, ArtifactScan scan) {
        boolean anyRunning = wf.hasInFlightSessions();
        WorkflowPhase working = wf.getCurrentPhase().workingPhase();
        boolean anyFailed = !working.isTerminal() && wf.sessionsFor(working).stream()
                .anyMatch(s -> s.getStatus() == SessionStatus.FAILED);

        String status = WorkflowSummary.NOT_STARTED;
        if (anyRunning) {
            status = WorkflowSummary.RUNNING;
        } else if (scan.presentCount() > 0) {
            status = WorkflowSummary.IN_PROGRESS;
        }
        if (scan.presentCount() == WorkflowPhase.ARTIFACT_PHASES.size() && !anyRunning) {
            status = WorkflowSummary.COMPLETED;
        }
        if (anyFailed && !anyRunning) {
            status = WorkflowSummary.ATTENTION;
        }
        return status;
    }

    // ------------------------------------------------------------------
    // Workspace browse
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public List<WorkspaceEntry> listWorkspace(String project, String id, String subpath) {
        RfeWorkflow wf = load(project, id);
        try {
            return inspector.listEntries(WorkspaceRef.of(wf), subpath);
        } finally {
            WorkflowMdc.clear();
        }
    }

    @Transactional(readOnly = true)
    public byte[] readWorkspaceFile(String project, String id, String path) {
        RfeWorkflow wf = load(project, id);
        try {
            requireText(path, "path");
            return inspector.readFile(WorkspaceRef.of(wf), path);
        } finally {
            WorkflowMdc.clear();
        }
    }

    // ------------------------------------------------------------------
    // Lifecycle status
    // ------------------------------------------------------------------

    /**
     * Bring the lifecycle status in line with the (already reconciled) phase
     * and the session outcomes. PAUSED is only ever left by resume().
     *
     *   phase COMPLETED                                  → COMPLETED
     *   status COMPLETED, phase no longer COMPLETED      → ACTIVE
     *   status ACTIVE, every working-phase session ended
     *     FAILED or STOPPED                              → FAILED
     *   status FAILED, working phase has no such failure → ACTIVE
     */
    void syncStatus(RfeWorkflow wf) {
        WorkflowStatus status = wf.getStatus();
        if (status == WorkflowStatus.PAUSED) return;

        WorkflowPhase phase = wf.getCurrentPhase();
        if (phase.isTerminal()) {
            if (status != WorkflowStatus.COMPLETED) changeStatus(wf, WorkflowStatus.COMPLETED, "all artifacts present");
            return;
        }
        if (status == WorkflowStatus.COMPLETED) {
            changeStatus(wf, WorkflowStatus.ACTIVE, "artifacts missing again");
            return;
        }
        boolean failed = workingPhaseFailed(wf);
        if (status == WorkflowStatus.ACTIVE && failed) {
            changeStatus(wf, WorkflowStatus.FAILED, "every session of phase " + phase.workingPhase().wireName() + " failed");
        } else if (status == WorkflowStatus.FAILED && !failed) {
            changeStatus(wf, WorkflowStatus.ACTIVE, "failed sessions no longer block phase " + phase.workingPhase().wireName());
        }
    }

    private static boolean workingPhaseFailed(RfeWorkflow wf) {
        List<AgentSession> sessions = wf.sessionsFor(wf.getCurrentPhase().workingPhase());
        return !sessions.isEmpty() && sessions.stream().allMatch(s ->
                s.getStatus() == SessionStatus.FAILED || s.getStatus() == SessionStatus.STOPPED);
    }

    private void changeStatus(RfeWorkflow wf, WorkflowStatus to, String reason) {
        WorkflowStatus from = wf.getStatus();
        wf.setStatus(to);
        events.publish(WorkflowEvent.STATUS_CHANGED, wf.getId(),
                Map.of("from", from.wireName(), "to", to.wireName(), "reason", reason));
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    /** Loads the workflow and puts its id on the MDC. Callers clear the MDC. */
    private RfeWorkflow load(String project, String id) {
        RfeWorkflow wf = workflows.findByIdAndProject(id, project)
                .orElseThrow(() -> WorkflowException.notFound(
                        "Workflow " + id + " not found in project " + project));
        WorkflowMdc.setWorkflow(wf.getId());
        return wf;
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw WorkflowException.validation(field + " must not be blank");
        }
    }
}
