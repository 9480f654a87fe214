package com.vteam.orchestrator.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowPhaseTest {

    @Test
    void order_isPreSpecifyPlanTasksCompleted() {
        assertThat(WorkflowPhase.values()).containsExactly(
                WorkflowPhase.PRE, WorkflowPhase.SPECIFY, WorkflowPhase.PLAN,
                WorkflowPhase.TASKS, WorkflowPhase.COMPLETED);
        assertThat(WorkflowPhase.PLAN.isBefore(WorkflowPhase.TASKS)).isTrue();
        assertThat(WorkflowPhase.TASKS.isBefore(WorkflowPhase.PLAN)).isFalse();
    }

    @Test
    void workingPhase_preWorksOnSpecify() {
        assertThat(WorkflowPhase.PRE.workingPhase()).isEqualTo(WorkflowPhase.SPECIFY);
        assertThat(WorkflowPhase.PLAN.workingPhase()).isEqualTo(WorkflowPhase.PLAN);
    }

    @Test
    void next_completedHasNone() {
        assertThat(WorkflowPhase.TASKS.next()).isEqualTo(WorkflowPhase.COMPLETED);
        assertThat(WorkflowPhase.COMPLETED.next()).isNull();
    }

    @Test
    void onlyMiddlePhasesHaveArtifacts() {
        assertThat(WorkflowPhase.PRE.hasArtifact()).isFalse();
        assertThat(WorkflowPhase.SPECIFY.hasArtifact()).isTrue();
        assertThat(WorkflowPhase.COMPLETED.hasArtifact()).isFalse();
        assertThat(WorkflowPhase.COMPLETED.isTerminal()).isTrue();
    }

    @Test
    void fromWire_isCaseInsensitive_andRejectsUnknown() {
        assertThat(WorkflowPhase.fromWire("Plan")).isEqualTo(WorkflowPhase.PLAN);
        assertThat(WorkflowPhase.PLAN.wireName()).isEqualTo("plan");
        assertThatThrownBy(() -> WorkflowPhase.fromWire("ideate"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sessionStatus_mapsRunnerPhases() {
        assertThat(SessionStatus.fromRunnerPhase("Creating")).isEqualTo(SessionStatus.PENDING);
        assertThat(SessionStatus.fromRunnerPhase("Running")).isEqualTo(SessionStatus.RUNNING);
        assertThat(SessionStatus.fromRunnerPhase("Error")).isEqualTo(SessionStatus.FAILED);
        assertThat(SessionStatus.fromRunnerPhase("Stopped")).isEqualTo(SessionStatus.STOPPED);
        assertThat(SessionStatus.fromRunnerPhase(null)).isEqualTo(SessionStatus.PENDING);
    }
}
