package io.agentcron.core;

import java.time.Instant;

/**
 * Persisted definition of a recurring research job.
 *
 * <p>{@code id} is null until the job store assigns one.
 */
public record JobDefinition(
        Long id,
        String name,
        String info,
        String timeSpec,
        String prompt,
        boolean enabled,
        Instant createdAt,
        Instant updatedAt
) {

    public static JobDefinition draft(String name, String info, String timeSpec, String prompt, boolean enabled) {
        return new JobDefinition(null, name, info, timeSpec, prompt, enabled, null, null);
    }

    public boolean hasTimeSpec() {
        return timeSpec != null && !timeSpec.isBlank();
    }
}
