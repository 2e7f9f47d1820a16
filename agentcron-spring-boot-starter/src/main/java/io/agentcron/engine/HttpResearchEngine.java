package io.agentcron.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentcron.ResearchEngine;
import io.agentcron.config.ResearchEngineProperties;
import io.agentcron.core.ResearchEngineException;
import io.agentcron.core.ResearchRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Research engine reached over HTTP.
 *
 * <p>Posts the request as JSON to {@code {baseUrl}/report} and returns the {@code report} field
 * of the JSON answer. A non-2xx status, an unreachable engine or an answer without a textual
 * report all raise {@link ResearchEngineException}.
 */
public class HttpResearchEngine implements ResearchEngine {
    private static final Logger log = LoggerFactory.getLogger(HttpResearchEngine.class);

    static final String REPORT_PATH = "/report";

    private final RestClient restClient;

    public HttpResearchEngine(RestClient.Builder builder, ResearchEngineProperties props) {
        Objects.requireNonNull(builder, "builder must not be null");
        Objects.requireNonNull(props, "props must not be null");
        if (props.getBaseUrl() == null || props.getBaseUrl().isBlank()) {
            throw new IllegalArgumentException("agentcron.engine.baseUrl must not be blank");
        }

        builder.baseUrl(props.getBaseUrl());
        if (props.getApiKey() != null && !props.getApiKey().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.getApiKey());
        }
        this.restClient = builder.build();
    }

    @Override
    public String research(ResearchRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        log.debug("agentcron research request model={} retriever={} reportType={}",
                request.model(), request.retriever(), request.reportType());

        JsonNode body;
        try {
            body = restClient.post()
                    .uri(REPORT_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(payload(request))
                    .retrieve()
                    .onStatus(status -> !status.is2xxSuccessful(), (req, res) -> {
                        throw new ResearchEngineException("research engine answered HTTP " + res.getStatusCode().value());
                    })
                    .body(JsonNode.class);
        } catch (ResourceAccessException e) {
            throw new ResearchEngineException("research engine unreachable: " + e.getMessage(), e);
        }

        JsonNode report = body == null ? null : body.get("report");
        if (report == null || !report.isTextual()) {
            throw new ResearchEngineException("research engine answer carries no report");
        }
        return report.asText();
    }

    static Map<String, Object> payload(ResearchRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", request.query());
        payload.put("report_type", request.reportType());
        payload.put("report_format", request.reportFormat());
        payload.put("language", request.language());
        payload.put("model", request.model());
        payload.put("api_base", request.apiBase());
        payload.put("retriever", request.retriever());
        return payload;
    }
}
