package com.vteam.orchestrator.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TargetRepositoryTest {

    @Test
    void of_httpsUrl_defaultsBranchAndClonePath() {
        TargetRepository repo = TargetRepository.of("https://github.com/org/app.git", null, null);

        assertThat(repo.getBranch()).isEqualTo("main");
        assertThat(repo.getClonePath()).isEqualTo("repos/app");
    }

    @Test
    void of_scpLikeUrl_isAccepted() {
        TargetRepository repo = TargetRepository.of("git@github.com:org/app.git", "develop", null);

        assertThat(repo.getBranch()).isEqualTo("develop");
        assertThat(repo.getClonePath()).isEqualTo("repos/app");
    }

    @Test
    void of_malformedUrls_areRejected() {
        assertThatThrownBy(() -> TargetRepository.of("not a url", null, null))
                .isInstanceOf(WorkflowException.class);
        assertThatThrownBy(() -> TargetRepository.of("ftp://host/org/app", null, null))
                .isInstanceOf(WorkflowException.class);
        assertThatThrownBy(() -> TargetRepository.of("https://github.com/", null, null))
                .isInstanceOf(WorkflowException.class);
        assertThatThrownBy(() -> TargetRepository.of("  ", null, null))
                .isInstanceOf(WorkflowException.class);
    }

    @Test
    void of_clonePathOutsideWorkspace_isRejected() {
        assertThatThrownBy(() -> TargetRepository.of("https://github.com/org/app", null, "../elsewhere"))
                .isInstanceOf(WorkflowException.class);
        assertThatThrownBy(() -> TargetRepository.of("https://github.com/org/app", null, "/abs"))
                .isInstanceOf(WorkflowException.class);
    }
}
