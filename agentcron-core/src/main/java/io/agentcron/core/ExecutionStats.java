package io.agentcron.core;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Aggregate run-history statistics for one job.
 *
 * avgDurationSeconds : mean duration of SUCCEEDED and FAILED runs that carry a duration,
 *                      rounded to 2 decimals; null when there are none
 * latest             : most recently started execution, or null
 */
public record ExecutionStats(
        long jobId,
        long total,
        long succeeded,
        long failed,
        long running,
        Double avgDurationSeconds,
        ExecutionRecord latest
) {

    /**
     * Per-status counts as produced by a store-side group-by.
     *
     * @param durationSum   sum of durations over records of this status carrying one
     * @param durationCount number of records of this status carrying a duration
     */
    public record StatusBucket(ExecutionStatus status, long count, long durationSum, long durationCount) {
    }

    public static ExecutionStats aggregate(long jobId, List<StatusBucket> buckets, ExecutionRecord latest) {
        long succeeded = 0;
        long failed = 0;
        long running = 0;
        long durationSum = 0;
        long durationCount = 0;

        for (StatusBucket b : buckets) {
            switch (b.status()) {
                case RUNNING -> running += b.count();
                case SUCCEEDED -> succeeded += b.count();
                case FAILED -> failed += b.count();
            }
            if (b.status().isTerminal()) {
                durationSum += b.durationSum();
                durationCount += b.durationCount();
            }
        }

        return new ExecutionStats(
                jobId,
                succeeded + failed + running,
                succeeded,
                failed,
                running,
                average(durationSum, durationCount),
                latest
        );
    }

    static Double average(long sum, long count) {
        if (count == 0) {
            return null;
        }
        return BigDecimal.valueOf(sum)
                .divide(BigDecimal.valueOf(count), 2, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
