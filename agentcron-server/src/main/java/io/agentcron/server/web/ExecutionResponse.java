package io.agentcron.server.web;

import io.agentcron.core.ExecutionRecord;
import io.agentcron.core.ExecutionStatus;

import java.time.Instant;

public record ExecutionResponse(
        Long id,
        long jobId,
        String jobName,
        String jobPrompt,
        ExecutionStatus status,
        int statusCode,
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

    static ExecutionResponse from(ExecutionRecord r) {
        return new ExecutionResponse(
                r.id(),
                r.jobId(),
                r.jobName(),
                r.jobPrompt(),
                r.status(),
                r.status().code(),
                r.startTime(),
                r.endTime(),
                r.durationSeconds(),
                r.resultSummary(),
                r.resultDetail(),
                r.errorMessage(),
                r.errorDetail(),
                r.createdAt(),
                r.updatedAt()
        );
    }
}
