package io.agentcron.core;

import io.agentcron.config.ResearchEngineProperties;

import java.util.Objects;

/**
 * Input of a single research engine call: the prompt plus the engine configuration.
 */
public record ResearchRequest(
        String query,
        String model,
        String apiBase,
        String retriever,
        String language,
        String reportFormat,
        String reportType
) {

    public static ResearchRequest of(String prompt, ResearchEngineProperties props) {
        Objects.requireNonNull(props, "props must not be null");
        return new ResearchRequest(
                prompt == null ? "" : prompt,
                props.getModel(),
                props.getApiBase(),
                props.getRetriever(),
                props.getLanguage(),
                props.getReportFormat(),
                props.getReportType()
        );
    }
}
