package io.agentcron.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Fields written by the single terminal update of an {@link ExecutionRecord}.
 */
public record ExecutionCompletion(
        ExecutionStatus status,
        Instant endTime,
        long durationSeconds,
        String resultSummary,
        String resultDetail,
        String errorMessage,
        String errorDetail
) {

    public ExecutionCompletion {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(endTime, "endTime must not be null");
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("completion status must be terminal: " + status);
        }
        if (durationSeconds < 0) {
            throw new IllegalArgumentException("durationSeconds must not be negative");
        }
    }

    /**
     * Maps an engine outcome onto the terminal record fields.
     *
     * @param summaryLength number of report characters kept in the summary
     */
    public static ExecutionCompletion of(ExecutionOutcome outcome, Instant startTime, Instant endTime, int summaryLength) {
        Objects.requireNonNull(outcome, "outcome must not be null");
        long duration = Math.max(0, Duration.between(startTime, endTime).getSeconds());

        if (outcome instanceof ExecutionOutcome.Succeeded s) {
            return new ExecutionCompletion(
                    ExecutionStatus.SUCCEEDED,
                    endTime,
                    duration,
                    summarize(s.report(), summaryLength),
                    s.report(),
                    null,
                    null
            );
        }
        ExecutionOutcome.Failed f = (ExecutionOutcome.Failed) outcome;
        return new ExecutionCompletion(
                ExecutionStatus.FAILED,
                endTime,
                duration,
                null,
                null,
                f.message(),
                f.detail()
        );
    }

    static String summarize(String report, int summaryLength) {
        if (report == null) {
            return null;
        }
        if (report.length() <= summaryLength) {
            return report;
        }
        return report.substring(0, summaryLength) + "...";
    }
}
