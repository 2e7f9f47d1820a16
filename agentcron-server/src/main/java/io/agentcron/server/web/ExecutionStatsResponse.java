package io.agentcron.server.web;

import io.agentcron.core.ExecutionStats;

public record ExecutionStatsResponse(
        long jobId,
        long total,
        long succeeded,
        long failed,
        long running,
        Double avgDurationSeconds,
        ExecutionResponse latest
) {

    static ExecutionStatsResponse from(ExecutionStats stats) {
        return new ExecutionStatsResponse(
                stats.jobId(),
                stats.total(),
                stats.succeeded(),
                stats.failed(),
                stats.running(),
                stats.avgDurationSeconds(),
                stats.latest() == null ? null : ExecutionResponse.from(stats.latest())
        );
    }
}
