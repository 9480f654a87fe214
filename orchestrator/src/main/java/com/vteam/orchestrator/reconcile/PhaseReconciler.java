package com.vteam.orchestrator.reconcile;

import com.vteam.orchestrator.events.WorkflowEvent;
import com.vteam.orchestrator.events.WorkflowEventPublisher;
import com.vteam.orchestrator.metrics.OrchestratorMetrics;
import com.vteam.orchestrator.model.RfeWorkflow;
import com.vteam.orchestrator.model.WorkflowPhase;
import com.vteam.orchestrator.phase.PhaseDefinition;
import com.vteam.orchestrator.phase.PhaseDefinitionTable;
import com.vteam.orchestrator.repository.WorkflowRepository;
import com.vteam.orchestrator.workspace.WorkspaceEntry;
import com.vteam.orchestrator.workspace.WorkspaceInspector;
import com.vteam.orchestrator.workspace.WorkspaceRef;
import com.vteam.orchestrator.workspace.WorkspaceUnavailableException;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Derives a workflow's phase from workspace evidence and keeps the stored
 * phase in line with it.
 *
 * The workspace is the single source of truth: the phase is
 *   PRE       when no artifact exists,
 *   the first artifact phase (in order) whose artifact is missing, otherwise,
 *   COMPLETED when every artifact exists.
 *
 * Sessions and lifecycle status are never read or written here.
 *
 * Artifact lookup: artifacts are looked up directly in their configured
 * directory. If none of the artifacts that share a directory is found there,
 * the first sub-directory (by name) is searched instead. Feature-scoped
 * tooling writes "specs/001-feature/spec.md" rather than "specs/spec.md".
 */
@Component
public class PhaseReconciler {

    private static final Logger log = LoggerFactory.getLogger(PhaseReconciler.class);

    private final WorkspaceInspector     inspector;
    private final PhaseDefinitionTable   phases;
    private final WorkflowRepository     repository;
    private final WorkflowEventPublisher events;
    private final OrchestratorMetrics    metrics;
    private final Duration               inspectionTimeout;

    // Scans run here so a hung workspace store cannot pin a request thread
    // beyond the inspection timeout.
    private final ExecutorService inspectionPool;

    public PhaseReconciler(WorkspaceInspector inspector,
                           PhaseDefinitionTable phases,
                           WorkflowRepository repository,
                           WorkflowEventPublisher events,
                           OrchestratorMetrics metrics,
                           @Value("${vteam.workspace.inspection-timeout:5s}") Duration inspectionTimeout,
                           @Value("${vteam.workspace.inspection-pool-size:8}") int inspectionPoolSize) {
        this.inspector         = inspector;
        this.phases            = phases;
        this.repository        = repository;
        this.events            = events;
        this.metrics           = metrics;
        this.inspectionTimeout = inspectionTimeout;
        this.inspectionPool    = Executors.newFixedThreadPool(inspectionPoolSize);
    }

    @PreDestroy
    void shutdown() {
        inspectionPool.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Evidence
    // ------------------------------------------------------------------

    /**
     * Look up every phase artifact in the workflow's workspace.
     *
     * @throws WorkspaceUnavailableException if the store fails or the scan
     *         exceeds the inspection timeout
     */
    public ArtifactScan scan(RfeWorkflow workflow) {
        WorkspaceRef ref = WorkspaceRef.of(workflow);
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        CompletableFuture<ArtifactScan> future = CompletableFuture.supplyAsync(() -> {
            if (mdc != null) MDC.setContextMap(mdc);
            try {
                return scanNow(ref);
            } finally {
                MDC.clear();
            }
        }, inspectionPool);

        try {
            return future.get(inspectionTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new WorkspaceUnavailableException(
                    "Workspace scan of " + ref.workspacePath() + " timed out after " + inspectionTimeout, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WorkspaceUnavailableException("Workspace scan interrupted", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw new WorkspaceUnavailableException("Workspace scan failed", e.getCause());
        }
    }

    ArtifactScan scanNow(WorkspaceRef ref) {
        // Group artifacts by directory so each directory is listed once.
        Map<String, List<PhaseDefinition>> byDir = new LinkedHashMap<>();
        for (PhaseDefinition def : phases.artifactPhases()) {
            byDir.computeIfAbsent(def.artifactDirectory(), d -> new ArrayList<>()).add(def);
        }

        Map<WorkflowPhase, String> found = new EnumMap<>(WorkflowPhase.class);
        for (Map.Entry<String, List<PhaseDefinition>> group : byDir.entrySet()) {
            String dir = group.getKey();
            List<WorkspaceEntry> entries = inspector.listEntries(ref, dir);

            Map<WorkflowPhase, String> direct = match(dir, entries, group.getValue());
            if (direct.isEmpty() && !dir.isEmpty()) {
                Optional<String> featureDir = entries.stream()
                        .filter(WorkspaceEntry::isDirectory)
                        .map(WorkspaceEntry::name)
                        .min(Comparator.naturalOrder());
                if (featureDir.isPresent()) {
                    String sub = dir + "/" + featureDir.get();
                    log.debug("No artifacts directly in '{}', checking '{}'", dir, sub);
                    direct = match(sub, inspector.listEntries(ref, sub), group.getValue());
                }
            }
            found.putAll(direct);
        }
        return new ArtifactScan(found);
    }

    private static Map<WorkflowPhase, String> match(String dir, List<WorkspaceEntry> entries,
                                                   List<PhaseDefinition> defs) {
        Map<WorkflowPhase, String> out = new EnumMap<>(WorkflowPhase.class);
        for (PhaseDefinition def : defs) {
            entries.stream()
                    .filter(e -> !e.isDirectory() && e.name().equalsIgnoreCase(def.artifactFileName()))
                    .findFirst()
                    .ifPresent(e -> out.put(def.phase(), dir.isEmpty() ? e.name() : dir + "/" + e.name()));
        }
        return out;
    }

    // ------------------------------------------------------------------
    // Derivation (pure)
    // ------------------------------------------------------------------

    public WorkflowPhase deriveCurrentPhase(ArtifactScan scan) {
        if (scan.presentCount() == 0) return WorkflowPhase.PRE;
        for (WorkflowPhase p : WorkflowPhase.ARTIFACT_PHASES) {
            if (!scan.isPresent(p)) return p;
        }
        return WorkflowPhase.COMPLETED;
    }

    /**
     * Whether the workflow may move on from its stored phase.
     * Running sessions play no part in the answer.
     */
    public boolean canAdvance(RfeWorkflow workflow, ArtifactScan scan) {
        WorkflowPhase current = workflow.getCurrentPhase();
        if (current == WorkflowPhase.PRE) return true;
        return !current.isTerminal() && scan.isPresent(current);
    }

    // ------------------------------------------------------------------
    // Reconcile
    // ------------------------------------------------------------------

    /**
     * Re-derive the phase and, if it differs from the stored one, swap it in.
     *
     * When two callers race, both derive the same phase from the same
     * evidence; only the one whose compare-and-swap succeeds emits the
     * transition event. On WorkspaceUnavailableException the stored phase is
     * left as it was.
     */
    @Transactional
    public ReconcileResult reconcile(RfeWorkflow workflow) {
        long start = System.nanoTime();
        WorkflowPhase stored = workflow.getCurrentPhase();

        ArtifactScan scan;
        try {
            scan = scan(workflow);
        } catch (WorkspaceUnavailableException e) {
            metrics.recordReconcile("unavailable", Duration.ofNanos(System.nanoTime() - start));
            log.warn("Cannot reconcile workflow {}: {}", workflow.getId(), e.getMessage());
            throw e;
        }

        WorkflowPhase derived = deriveCurrentPhase(scan);
        if (derived == stored) {
            metrics.recordReconcile("unchanged", Duration.ofNanos(System.nanoTime() - start));
            return new ReconcileResult(stored, derived, scan, false);
        }

        boolean won = repository.compareAndSetPhase(workflow.getId(), stored, derived, Instant.now()) == 1;
        workflow.syncCurrentPhase(derived);

        if (won) {
            boolean regression = derived.isBefore(stored);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("from", stored.wireName());
            payload.put("to", derived.wireName());
            payload.put("artifacts", scan.presentCount());
            events.publish(regression
                            ? WorkflowEvent.PHASE_REGRESSION_DETECTED
                            : WorkflowEvent.PHASE_TRANSITION_DETECTED,
                    workflow.getId(), payload);
            metrics.recordReconcile("changed", Duration.ofNanos(System.nanoTime() - start));
        } else {
            log.debug("Workflow {} phase already moved by a concurrent reconcile", workflow.getId());
            metrics.recordReconcile("lost_race", Duration.ofNanos(System.nanoTime() - start));
        }
        return new ReconcileResult(stored, derived, scan, won);
    }
}
