package io.agentcron.server.web;

import io.agentcron.core.JobPatch;
import jakarta.validation.constraints.Size;

/**
 * Partial update; absent fields keep their stored value.
 */
public record UpdateAgentTaskRequest(
        @Size(min = 1, max = 100) String name,
        @Size(max = 500) String info,
        String timeSpec,
        String prompt,
        Boolean enabled
) {

    JobPatch toPatch() {
        return new JobPatch(name, info, timeSpec, prompt, enabled);
    }
}
