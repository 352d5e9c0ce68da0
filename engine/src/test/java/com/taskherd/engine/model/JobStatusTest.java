package com.taskherd.engine.model;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;

class JobStatusTest {

    @Test
    void terminalStates_haveNoSuccessors() {
        for (JobStatus s : EnumSet.of(JobStatus.SUCCEEDED, JobStatus.ABANDONED, JobStatus.CANCELLED)) {
            assertThat(s.isTerminal()).isTrue();
            assertThat(s.successors()).isEmpty();
        }
    }

    @Test
    void failed_canOnlyMoveToRetrying() {
        assertThat(JobStatus.FAILED.successors()).containsExactly(JobStatus.RETRYING);
        assertThat(JobStatus.FAILED.isTerminal()).isFalse();
    }

    @Test
    void edges_matchTheLifecycle() {
        assertThat(JobStatus.PENDING.canTransitionTo(JobStatus.RUNNING)).isTrue();
        assertThat(JobStatus.PENDING.canTransitionTo(JobStatus.CANCELLED)).isTrue();
        assertThat(JobStatus.PENDING.canTransitionTo(JobStatus.FAILED)).isTrue();
        assertThat(JobStatus.RUNNING.canTransitionTo(JobStatus.SUCCEEDED)).isTrue();
        assertThat(JobStatus.RUNNING.canTransitionTo(JobStatus.FAILED)).isTrue();
        assertThat(JobStatus.RETRYING.canTransitionTo(JobStatus.RUNNING)).isTrue();
        assertThat(JobStatus.RETRYING.canTransitionTo(JobStatus.ABANDONED)).isTrue();

        // No shortcuts around FAILED, and no way back from RUNNING to PENDING
        assertThat(JobStatus.RUNNING.canTransitionTo(JobStatus.CANCELLED)).isFalse();
        assertThat(JobStatus.RUNNING.canTransitionTo(JobStatus.PENDING)).isFalse();
        assertThat(JobStatus.RUNNING.canTransitionTo(JobStatus.ABANDONED)).isFalse();
        assertThat(JobStatus.PENDING.canTransitionTo(JobStatus.SUCCEEDED)).isFalse();
        assertThat(JobStatus.SUCCEEDED.canTransitionTo(JobStatus.RUNNING)).isFalse();
    }
}
