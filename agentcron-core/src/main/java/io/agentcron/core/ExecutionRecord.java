package io.agentcron.core;

import java.time.Instant;
import java.util.Objects;

/**
 * One run of a job.
 *
 * <p>Job name and prompt are copied at start time so later edits to the job definition do
 * not rewrite history. {@code endTime} and {@code durationSeconds} stay null while the
 * record is {@link ExecutionStatus#RUNNING}.
 */
public record ExecutionRecord(
        Long id,
        long jobId,
        String jobName,
        String jobPrompt,
        ExecutionStatus status,
        Instant startTime,
        Instant endTime,
        Long durationSeconds,
        String resultSummary,
        String resultDetail,
        String errorMessage,
        String errorDetail,
        Instant createdAt,
        Instant updatedAt
) {

    public ExecutionRecord {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(startTime, "startTime must not be null");
    }

    /**
     * New record for a run that starts now. The id is assigned by the store.
     */
    public static ExecutionRecord running(JobDefinition job, Instant startTime) {
        Objects.requireNonNull(job, "job must not be null");
        Objects.requireNonNull(job.id(), "job id must not be null");
        return new ExecutionRecord(
                null,
                job.id(),
                job.name(),
                job.prompt(),
                ExecutionStatus.RUNNING,
                startTime,
                null,
                null,
                null,
                null,
                null,
                null,
                startTime,
                startTime
        );
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
