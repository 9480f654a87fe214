package com.vteam.orchestrator.service;

import com.vteam.orchestrator.agent.AgentSessionLauncher;
import com.vteam.orchestrator.events.WorkflowEvent;
import com.vteam.orchestrator.events.WorkflowEventPublisher;
import com.vteam.orchestrator.model.*;
import com.vteam.orchestrator.phase.PhaseDefinitionTable;
import com.vteam.orchestrator.phase.PhaseProperties;
import com.vteam.orchestrator.reconcile.ArtifactScan;
import com.vteam.orchestrator.reconcile.PhaseReconciler;
import com.vteam.orchestrator.reconcile.ReconcileResult;
import com.vteam.orchestrator.repository.WorkflowRepository;
import com.vteam.orchestrator.workspace.WorkspaceInspector;
import com.vteam.orchestrator.workspace.WorkspaceUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.transaction.PlatformTransactionManager;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.AdditionalAnswers.returnsFirstArg;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for WorkflowService.
 * The reconciler is mocked; each test pins the phase it would derive.
 */
@ExtendWith(MockitoExtension.class)
class WorkflowServiceTest {

    @Mock WorkflowRepository     workflows;
    @Mock PhaseReconciler        reconciler;
    @Mock AgentSessionLauncher   launcher;
    @Mock WorkspaceInspector     inspector;
    @Mock WorkflowEventPublisher events;
    @Mock PlatformTransactionManager txManager;

    WorkflowService service;
    RfeWorkflow     wf;

    @BeforeEach
    void setUp() {
        service = new WorkflowService(workflows, reconciler, launcher, inspector,
                new PhaseDefinitionTable(new PhaseProperties()), events, txManager);
        wf = new RfeWorkflow("team-a", "SSO", "Add SSO login",
                TargetRepository.of("https://github.com/org/app.git", null, null),
                SelectedAgents.of(List.of("pm", "architect")), null);
    }

    // ------------------------------------------------------------------
    // create / get
    // ------------------------------------------------------------------

    @Test
    void create_validDraft_startsInPreAndActive() {
        when(workflows.save(any(RfeWorkflow.class))).then(returnsFirstArg());

        RfeWorkflow created = service.create("team-a", draft("SSO", List.of("pm")), "alice");

        assertThat(created.getCurrentPhase()).isEqualTo(WorkflowPhase.PRE);
        assertThat(created.getStatus()).isEqualTo(WorkflowStatus.ACTIVE);
        assertThat(created.getCreatedBy()).isEqualTo("alice");
        assertThat(created.getTargetRepository().getBranch()).isEqualTo("main");
        verify(events).publish(eq(WorkflowEvent.WORKFLOW_CREATED), eq(created.getId()), anyMap());
    }

    @Test
    void create_blankTitle_rejectedWithoutSaving() {
        assertKind(() -> service.create("team-a", draft(" ", List.of("pm")), null),
                WorkflowException.Kind.VALIDATION);
        verify(workflows, never()).save(any());
    }

    @Test
    void create_nineAgents_rejected() {
        List<String> nine = List.of("a", "b", "c", "d", "e", "f", "g", "h", "i");
        assertKind(() -> service.create("team-a", draft("SSO", nine), null),
                WorkflowException.Kind.VALIDATION);
        verify(workflows, never()).save(any());
    }

    @Test
    void create_malformedRepositoryUrl_rejected() {
        WorkflowDraft bad = new WorkflowDraft("SSO", "desc", "not a url", null, null, null, List.of("pm"));
        assertKind(() -> service.create("team-a", bad, null), WorkflowException.Kind.VALIDATION);
    }

    @Test
    void get_otherProject_notFound() {
        when(workflows.findByIdAndProject(wf.getId(), "team-b")).thenReturn(Optional.empty());

        assertKind(() -> service.get("team-b", wf.getId()), WorkflowException.Kind.NOT_FOUND);
        verifyNoInteractions(reconciler);
    }

    @Test
    void get_allArtifactsPresent_marksCompleted() {
        stored();
        reconciledTo(WorkflowPhase.COMPLETED,
                scanOf(WorkflowPhase.SPECIFY, WorkflowPhase.PLAN, WorkflowPhase.TASKS));

        RfeWorkflow got = service.get("team-a", wf.getId());

        assertThat(got.getStatus()).isEqualTo(WorkflowStatus.COMPLETED);
        verify(events).publish(eq(WorkflowEvent.STATUS_CHANGED), eq(wf.getId()), anyMap());
    }

    @Test
    void get_pausedWorkflow_keepsPausedEvenWhenComplete() {
        wf.setStatus(WorkflowStatus.PAUSED);
        stored();
        reconciledTo(WorkflowPhase.COMPLETED,
                scanOf(WorkflowPhase.SPECIFY, WorkflowPhase.PLAN, WorkflowPhase.TASKS));

        assertThat(service.get("team-a", wf.getId()).getStatus()).isEqualTo(WorkflowStatus.PAUSED);
        verifyNoInteractions(events);
    }

    @Test
    void get_everyWorkingPhaseSessionFailed_marksFailed() {
        wf.addSession(AgentSession.launchFailed(WorkflowPhase.SPECIFY, "pm", "specs/spec.md", "quota"));
        AgentSession stopped = new AgentSession(WorkflowPhase.SPECIFY, "architect", "s-2", "specs/spec.md");
        stopped.observe(SessionStatus.STOPPED);
        wf.addSession(stopped);
        stored();
        reconciledTo(WorkflowPhase.PRE, ArtifactScan.empty());

        assertThat(service.get("team-a", wf.getId()).getStatus()).isEqualTo(WorkflowStatus.FAILED);
    }

    @Test
    void get_failedWorkflowWhoseArtifactAppeared_becomesActiveAgain() {
        wf.addSession(AgentSession.launchFailed(WorkflowPhase.SPECIFY, "pm", "specs/spec.md", "quota"));
        wf.setStatus(WorkflowStatus.FAILED);
        stored();
        // spec.md written by hand: the working phase is now PLAN, which has no failed sessions
        reconciledTo(WorkflowPhase.PLAN, scanOf(WorkflowPhase.SPECIFY));

        assertThat(service.get("team-a", wf.getId()).getStatus()).isEqualTo(WorkflowStatus.ACTIVE);
    }

    @Test
    void get_workspaceUnreachable_propagatesAndLeavesStatus() {
        stored();
        when(reconciler.reconcile(wf)).thenThrow(new WorkspaceUnavailableException("connection refused"));

        assertThatThrownBy(() -> service.get("team-a", wf.getId()))
                .isInstanceOf(WorkspaceUnavailableException.class);
        assertThat(wf.getCurrentPhase()).isEqualTo(WorkflowPhase.PRE);
        assertThat(wf.getStatus()).isEqualTo(WorkflowStatus.ACTIVE);
    }

    // ------------------------------------------------------------------
    // advance
    // ------------------------------------------------------------------

    @Test
    void advance_fromPre_reportsSpecifyAsNext() {
        stored();
        ArtifactScan scan = reconciledTo(WorkflowPhase.PRE, ArtifactScan.empty());
        when(reconciler.canAdvance(wf, scan)).thenReturn(true);

        AdvanceResult r = service.advance("team-a", wf.getId());

        assertThat(r.currentPhase()).isEqualTo(WorkflowPhase.PRE);
        assertThat(r.nextPhase()).isEqualTo(WorkflowPhase.SPECIFY);
        verify(workflows, never()).save(any());
    }

    @Test
    void advance_currentArtifactMissing_blockedNamingTheArtifact() {
        stored();
        ArtifactScan scan = reconciledTo(WorkflowPhase.PLAN, scanOf(WorkflowPhase.SPECIFY));
        when(reconciler.canAdvance(wf, scan)).thenReturn(false);

        assertThatThrownBy(() -> service.advance("team-a", wf.getId()))
                .isInstanceOfSatisfying(AdvancementBlockedException.class, e -> {
                    assertThat(e.getPhase()).isEqualTo(WorkflowPhase.PLAN);
                    assertThat(e.getMissingArtifact()).isEqualTo("specs/plan.md");
                });
    }

    @Test
    void advance_completedWorkflow_blockedWithoutArtifact() {
        stored();
        ArtifactScan scan = reconciledTo(WorkflowPhase.COMPLETED,
                scanOf(WorkflowPhase.SPECIFY, WorkflowPhase.PLAN, WorkflowPhase.TASKS));
        when(reconciler.canAdvance(wf, scan)).thenReturn(false);

        assertThatThrownBy(() -> service.advance("team-a", wf.getId()))
                .isInstanceOfSatisfying(AdvancementBlockedException.class,
                        e -> assertThat(e.getMissingArtifact()).isNull());
    }

    // ------------------------------------------------------------------
    // startPhaseSession
    // ------------------------------------------------------------------

    @Test
    void startPhaseSession_phaseNotBeingWorkedOn_phaseNotReady() {
        stored();
        reconciledTo(WorkflowPhase.PRE, ArtifactScan.empty());

        assertKind(() -> service.startPhaseSession("team-a", wf.getId(), WorkflowPhase.PLAN, null, false),
                WorkflowException.Kind.PHASE_NOT_READY);
        verifyNoInteractions(launcher);
    }

    @Test
    void startPhaseSession_artifactExistsWithoutRegenerate_phaseNotReady() {
        stored();
        reconciledTo(WorkflowPhase.PLAN, scanOf(WorkflowPhase.SPECIFY));

        assertThatThrownBy(() -> service.startPhaseSession("team-a", wf.getId(), WorkflowPhase.SPECIFY, null, false))
                .isInstanceOf(WorkflowException.class)
                .hasMessageContaining("regenerate");
        verifyNoInteractions(launcher);
    }

    @Test
    void startPhaseSession_workingPhase_launchesAllSelectedAndAttaches() {
        stored();
        ArtifactScan scan = reconciledTo(WorkflowPhase.PRE, ArtifactScan.empty());
        List<AgentSession> launched = List.of(
                new AgentSession(WorkflowPhase.SPECIFY, "pm", "s-1", "specs/spec.md"),
                new AgentSession(WorkflowPhase.SPECIFY, "architect", "s-2", "specs/spec.md"));
        when(launcher.launchAll(wf, WorkflowPhase.SPECIFY, List.of("pm", "architect"), scan, false))
                .thenReturn(launched);

        List<AgentSession> result = service.startPhaseSession("team-a", wf.getId(), WorkflowPhase.SPECIFY, null, false);

        assertThat(result).hasSize(2);
        assertThat(wf.getAgentSessions()).containsExactlyElementsOf(launched);
        assertThat(launched).allMatch(s -> s.getWorkflow() == wf);
        verify(workflows).flush();
        verify(events).publish(eq(WorkflowEvent.SESSIONS_LAUNCHED), eq(wf.getId()), anyMap());
        verify(events, never()).publish(eq(WorkflowEvent.PHASE_RERUN_REQUESTED), anyString(), anyMap());
    }

    @Test
    void startPhaseSession_regenerate_launchesAsRerun() {
        stored();
        ArtifactScan scan = reconciledTo(WorkflowPhase.PLAN, scanOf(WorkflowPhase.SPECIFY));
        AgentSession again = new AgentSession(WorkflowPhase.SPECIFY, "pm", "s-3", "specs/spec.md");
        again.setRerun(true);
        when(launcher.launchAll(wf, WorkflowPhase.SPECIFY, List.of("pm"), scan, true)).thenReturn(List.of(again));

        service.startPhaseSession("team-a", wf.getId(), WorkflowPhase.SPECIFY, List.of("pm"), true);

        verify(events).publish(eq(WorkflowEvent.PHASE_RERUN_REQUESTED), eq(wf.getId()), anyMap());
        assertThat(wf.getAgentSessions()).containsExactly(again);
    }

    @Test
    void startPhaseSession_paused_prerequisiteNotMet() {
        wf.setStatus(WorkflowStatus.PAUSED);
        stored();

        assertKind(() -> service.startPhaseSession("team-a", wf.getId(), WorkflowPhase.SPECIFY, null, false),
                WorkflowException.Kind.PREREQUISITE_NOT_MET);
        verifyNoInteractions(reconciler, launcher);
    }

    @Test
    void startPhaseSession_unselectedPersona_validation() {
        stored();

        assertKind(() -> service.startPhaseSession("team-a", wf.getId(), WorkflowPhase.SPECIFY,
                List.of("pm", "qa"), false), WorkflowException.Kind.VALIDATION);
        verifyNoInteractions(launcher);
    }

    @Test
    void startPhaseSession_phaseWithoutArtifact_validation() {
        stored();

        assertKind(() -> service.startPhaseSession("team-a", wf.getId(), WorkflowPhase.COMPLETED, null, false),
                WorkflowException.Kind.VALIDATION);
    }

    @Test
    void startPhaseSession_failedWorkflow_becomesActive() {
        wf.setStatus(WorkflowStatus.FAILED);
        stored();
        ArtifactScan scan = reconciledTo(WorkflowPhase.PRE, ArtifactScan.empty());
        when(launcher.launchAll(eq(wf), eq(WorkflowPhase.SPECIFY), anyList(), eq(scan), eq(false)))
                .thenReturn(List.of(new AgentSession(WorkflowPhase.SPECIFY, "pm", "s-1", "specs/spec.md")));

        service.startPhaseSession("team-a", wf.getId(), WorkflowPhase.SPECIFY, List.of("pm"), false);

        assertThat(wf.getStatus()).isEqualTo(WorkflowStatus.ACTIVE);
        verify(events).publish(eq(WorkflowEvent.STATUS_CHANGED), eq(wf.getId()), anyMap());
    }

    @Test
    void startPhaseSession_refusedAfterReconcile_reconcileStillCommitted() {
        stored();
        reconciledTo(WorkflowPhase.PLAN, scanOf(WorkflowPhase.SPECIFY));

        assertKind(() -> service.startPhaseSession("team-a", wf.getId(), WorkflowPhase.SPECIFY, null, false),
                WorkflowException.Kind.PHASE_NOT_READY);
        verify(txManager).commit(any());
        verify(txManager, never()).rollback(any());
    }

    @Test
    void startPhaseSession_runnerCalledBetweenCheckAndRecordTransactions() {
        stored();
        ArtifactScan scan = reconciledTo(WorkflowPhase.PRE, ArtifactScan.empty());
        when(launcher.launchAll(wf, WorkflowPhase.SPECIFY, List.of("pm"), scan, false))
                .thenReturn(List.of(new AgentSession(WorkflowPhase.SPECIFY, "pm", "s-1", "specs/spec.md")));

        service.startPhaseSession("team-a", wf.getId(), WorkflowPhase.SPECIFY, List.of("pm"), false);

        InOrder order = inOrder(txManager, launcher, workflows);
        order.verify(txManager).commit(any());
        order.verify(launcher).launchAll(wf, WorkflowPhase.SPECIFY, List.of("pm"), scan, false);
        order.verify(workflows).flush();
        order.verify(txManager).commit(any());
    }

    @Test
    void startPhaseSession_recordingFails_propagatesWithoutLaunchEvent() {
        stored();
        ArtifactScan scan = reconciledTo(WorkflowPhase.PRE, ArtifactScan.empty());
        when(launcher.launchAll(wf, WorkflowPhase.SPECIFY, List.of("pm", "architect"), scan, false))
                .thenReturn(List.of(
                        new AgentSession(WorkflowPhase.SPECIFY, "pm", "s-1", "specs/spec.md"),
                        new AgentSession(WorkflowPhase.SPECIFY, "architect", "s-2", "specs/spec.md")));
        doThrow(new ObjectOptimisticLockingFailureException(RfeWorkflow.class, wf.getId()))
                .when(workflows).flush();

        assertThatThrownBy(() -> service.startPhaseSession("team-a", wf.getId(), WorkflowPhase.SPECIFY, null, false))
                .isInstanceOf(ObjectOptimisticLockingFailureException.class);

        // the check transaction committed, the recording one rolled back
        verify(txManager, times(1)).commit(any());
        verify(txManager, times(1)).rollback(any());
        verify(events, never()).publish(eq(WorkflowEvent.SESSIONS_LAUNCHED), anyString(), anyMap());
    }

    // ------------------------------------------------------------------
    // update / pause / resume
    // ------------------------------------------------------------------

    @Test
    void update_titleOnly_keepsAgents() {
        stored();
        when(workflows.save(wf)).thenReturn(wf);

        RfeWorkflow updated = service.update("team-a", wf.getId(), "SSO v2", null, null, null);

        assertThat(updated.getTitle()).isEqualTo("SSO v2");
        assertThat(updated.getSelectedAgents().personas()).containsExactly("pm", "architect");
    }

    @Test
    void update_agentsWhileSessionPending_refused() {
        wf.addSession(new AgentSession(WorkflowPhase.SPECIFY, "pm", "s-1", "specs/spec.md"));
        stored();

        assertKind(() -> service.update("team-a", wf.getId(), null, null, List.of("qa"), null),
                WorkflowException.Kind.PREREQUISITE_NOT_MET);
        verify(workflows, never()).save(any());
    }

    @Test
    void update_staleVersion_concurrentModification() {
        stored();

        assertThatThrownBy(() -> service.update("team-a", wf.getId(), "x", null, null, 7L))
                .isInstanceOf(ObjectOptimisticLockingFailureException.class);
        assertThat(wf.getTitle()).isEqualTo("SSO");
    }

    @Test
    void pauseAndResume_areIdempotent() {
        stored();
        when(workflows.save(wf)).thenReturn(wf);

        service.pause("team-a", wf.getId());
        service.pause("team-a", wf.getId());
        assertThat(wf.getStatus()).isEqualTo(WorkflowStatus.PAUSED);

        service.resume("team-a", wf.getId());
        service.resume("team-a", wf.getId());
        assertThat(wf.getStatus()).isEqualTo(WorkflowStatus.ACTIVE);

        verify(events, times(2)).publish(eq(WorkflowEvent.STATUS_CHANGED), eq(wf.getId()), anyMap());
    }

    @Test
    void pause_completedWorkflow_refused() {
        wf.setStatus(WorkflowStatus.COMPLETED);
        stored();

        assertKind(() -> service.pause("team-a", wf.getId()), WorkflowException.Kind.PREREQUISITE_NOT_MET);
    }

    // ------------------------------------------------------------------
    // sessions
    // ------------------------------------------------------------------

    @Test
    void listSessions_refresh_pollsAndSavesChanges() {
        AgentSession s = new AgentSession(WorkflowPhase.SPECIFY, "pm", "s-1", "specs/spec.md");
        wf.addSession(s);
        stored();
        reconciledTo(WorkflowPhase.PRE, ArtifactScan.empty());
        when(launcher.refresh(wf, s)).thenReturn(true);

        assertThat(service.listSessions("team-a", wf.getId(), true)).containsExactly(s);
        verify(workflows).save(wf);
    }

    @Test
    void listSessions_withoutRefresh_neitherPollsNorReconciles() {
        stored();

        assertThat(service.listSessions("team-a", wf.getId(), false)).isEmpty();
        verifyNoInteractions(launcher, reconciler);
    }

    @Test
    void linkSession_attachesAndReadsStatus() {
        stored();

        AgentSession linked = service.linkSession("team-a", wf.getId(), " external-1 ", WorkflowPhase.PLAN, "qa");

        assertThat(linked.isLinked()).isTrue();
        assertThat(linked.getExternalName()).isEqualTo("external-1");
        assertThat(linked.getProducedArtifactPath()).isEqualTo("specs/plan.md");
        assertThat(wf.getAgentSessions()).containsExactly(linked);
        verify(launcher).refresh(wf, linked);
        verify(workflows).flush();
    }

    @Test
    void linkSession_alreadyLinkedName_validation() {
        wf.addSession(new AgentSession(WorkflowPhase.SPECIFY, "pm", "s-1", "specs/spec.md"));
        stored();

        assertKind(() -> service.linkSession("team-a", wf.getId(), "s-1", WorkflowPhase.SPECIFY, "pm"),
                WorkflowException.Kind.VALIDATION);
    }

    @Test
    void unlinkSession_unknownId_notFound() {
        stored();

        assertKind(() -> service.unlinkSession("team-a", wf.getId(), UUID.randomUUID()),
                WorkflowException.Kind.NOT_FOUND);
    }

    // ------------------------------------------------------------------
    // summary
    // ------------------------------------------------------------------

    @Test
    void summary_specDonePlanRunning() {
        wf.addSession(new AgentSession(WorkflowPhase.PLAN, "architect", "s-1", "specs/plan.md"));
        stored();
        reconciledTo(WorkflowPhase.PLAN, scanOf(WorkflowPhase.SPECIFY));

        WorkflowSummary s = service.summary("team-a", wf.getId());

        assertThat(s.phase()).isEqualTo(WorkflowPhase.PLAN);
        assertThat(s.displayStatus()).isEqualTo(WorkflowSummary.RUNNING);
        assertThat(s.progress()).isCloseTo(33.33, within(0.01));
        assertThat(s.canAdvance()).isFalse();
        assertThat(s.phases()).extracting(WorkflowSummary.PhaseProgress::present).containsExactly(true, false, false);
        assertThat(s.phases()).extracting(WorkflowSummary.PhaseProgress::activeSessions).containsExactly(0, 1, 0);
    }

    @Test
    void displayStatus_coversEachCase() {
        assertThat(WorkflowService.displayStatus(wf, ArtifactScan.empty())).isEqualTo(WorkflowSummary.NOT_STARTED);

        wf.syncCurrentPhase(WorkflowPhase.PLAN);
        assertThat(WorkflowService.displayStatus(wf, scanOf(WorkflowPhase.SPECIFY)))
                .isEqualTo(WorkflowSummary.IN_PROGRESS);

        wf.addSession(AgentSession.launchFailed(WorkflowPhase.PLAN, "pm", "specs/plan.md", "quota"));
        assertThat(WorkflowService.displayStatus(wf, scanOf(WorkflowPhase.SPECIFY)))
                .isEqualTo(WorkflowSummary.ATTENTION);

        wf.syncCurrentPhase(WorkflowPhase.COMPLETED);
        assertThat(WorkflowService.displayStatus(wf,
                scanOf(WorkflowPhase.SPECIFY, WorkflowPhase.PLAN, WorkflowPhase.TASKS)))
                .isEqualTo(WorkflowSummary.COMPLETED);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void stored() {
        when(workflows.findByIdAndProject(wf.getId(), "team-a")).thenReturn(Optional.of(wf));
    }

    /** Stubs a reconcile that lands on {@code phase}, as the real reconciler would. */
    private ArtifactScan reconciledTo(WorkflowPhase phase, ArtifactScan scan) {
        WorkflowPhase before = wf.getCurrentPhase();
        wf.syncCurrentPhase(phase);
        when(reconciler.reconcile(wf)).thenReturn(new ReconcileResult(before, phase, scan, before != phase));
        return scan;
    }

    private static ArtifactScan scanOf(WorkflowPhase... present) {
        Map<WorkflowPhase, String> found = new EnumMap<>(WorkflowPhase.class);
        for (WorkflowPhase p : present) {
            found.put(p, "specs/" + p.wireName() + ".md");
        }
        return new ArtifactScan(found);
    }

    private static WorkflowDraft draft(String title, List<String> agents) {
        return new WorkflowDraft(title, "Add SSO login", "https://github.com/org/app.git",
                null, null, null, agents);
    }

    private static void assertKind(org.assertj.core.api.ThrowableAssert.ThrowingCallable call,
                                   WorkflowException.Kind kind) {
        assertThatThrownBy(call).isInstanceOfSatisfying(WorkflowException.class,
                e -> assertThat(e.getKind()).isEqualTo(kind));
    }
}
