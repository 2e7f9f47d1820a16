package io.agentcron.server.web;

import io.agentcron.core.JobDefinition;

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * A job definition plus the next hour it would fire, in the scheduler zone.
 */
public record AgentTaskResponse(
        Long id,
        String name,
        String info,
        String timeSpec,
        String prompt,
        boolean enabled,
        Instant createdAt,
        Instant updatedAt,
        LocalDateTime nextRunAt
) {

    static AgentTaskResponse from(JobDefinition job, LocalDateTime nextRunAt) {
        return new AgentTaskResponse(
                job.id(),
                job.name(),
                job.info(),
                job.timeSpec(),
                job.prompt(),
                job.enabled(),
                job.createdAt(),
                job.updatedAt(),
                nextRunAt
        );
    }
}
