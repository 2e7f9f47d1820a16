package io.agentcron.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionStatsTest {

    @Test
    void averageShouldCoverTerminalRecordsWithDuration() {
        // SUCCEEDED 10, 20, 30 and one FAILED record that carries no duration
        ExecutionStats stats = ExecutionStats.aggregate(1L, List.of(
                new ExecutionStats.StatusBucket(ExecutionStatus.SUCCEEDED, 3, 60, 3),
                new ExecutionStats.StatusBucket(ExecutionStatus.FAILED, 1, 0, 0)
        ), null);

        assertThat(stats.total()).isEqualTo(4);
        assertThat(stats.succeeded()).isEqualTo(3);
        assertThat(stats.failed()).isEqualTo(1);
        assertThat(stats.running()).isZero();
        assertThat(stats.avgDurationSeconds()).isEqualTo(20.0);
    }

    @Test
    void failedDurationShouldCountAndRunningShouldNot() {
        ExecutionStats stats = ExecutionStats.aggregate(1L, List.of(
                new ExecutionStats.StatusBucket(ExecutionStatus.SUCCEEDED, 3, 60, 3),
                new ExecutionStats.StatusBucket(ExecutionStatus.FAILED, 1, 5, 1),
                new ExecutionStats.StatusBucket(ExecutionStatus.RUNNING, 2, 1000, 1)
        ), null);

        assertThat(stats.total()).isEqualTo(6);
        assertThat(stats.running()).isEqualTo(2);
        assertThat(stats.avgDurationSeconds()).isEqualTo(16.25);
    }

    @Test
    void averageShouldRoundToTwoDecimals() {
        ExecutionStats stats = ExecutionStats.aggregate(1L, List.of(
                new ExecutionStats.StatusBucket(ExecutionStatus.SUCCEEDED, 3, 10, 3)
        ), null);

        assertThat(stats.avgDurationSeconds()).isEqualTo(3.33);
        assertThat(ExecutionStats.average(20, 3)).isEqualTo(6.67);
    }

    @Test
    void averageShouldBeNullWithoutCompletedRuns() {
        ExecutionStats stats = ExecutionStats.aggregate(9L, List.of(
                new ExecutionStats.StatusBucket(ExecutionStatus.RUNNING, 1, 0, 0)
        ), null);

        assertThat(stats.avgDurationSeconds()).isNull();
        assertThat(stats.total()).isEqualTo(1);
        assertThat(ExecutionStats.aggregate(9L, List.of(), null).total()).isZero();
    }
}
