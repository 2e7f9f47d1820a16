package io.agentcron.server.web;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateAgentTaskRequest(
        @NotBlank @Size(max = 100) String name,
        @Size(max = 500) String info,
        @NotBlank String timeSpec,
        String prompt,
        Boolean enabled
) {
}
