package io.agentcron.server.web;

import io.agentcron.AgentScheduler;
import io.agentcron.core.JobDefinition;
import io.agentcron.store.ExecutionRepository;
import io.agentcron.store.JobRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = AgentTaskController.class)
@Import(WebTestConfig.class)
@TestPropertySource(properties = {
        "agentcron.api.rate-limit.create-per-minute=1",
        "agentcron.api.rate-limit.read-per-minute=2"
})
class AgentTaskRateLimitTest {

    private static final Instant CREATED = Instant.parse("2024-01-01T00:00:00Z");
    private static final String BODY = "{\"name\":\"brief\",\"timeSpec\":\"8 * * *\"}";

    @Autowired
    MockMvc mvc;

    @MockBean
    JobRepository jobRepository;

    @MockBean
    ExecutionRepository executionRepository;

    @MockBean
    AgentScheduler scheduler;

    @Test
    void createOverLimitShouldAnswer429WithoutReachingStore() throws Exception {
        when(jobRepository.create(any())).thenReturn(
                new JobDefinition(1L, "brief", null, "8 * * *", null, true, CREATED, CREATED));

        mvc.perform(post("/api/agent-tasks").contentType(MediaType.APPLICATION_JSON).content(BODY)
                        .with(request -> {
                            request.setRemoteAddr("192.0.2.10");
                            return request;
                        }))
                .andExpect(status().isOk());

        mvc.perform(post("/api/agent-tasks").contentType(MediaType.APPLICATION_JSON).content(BODY)
                        .with(request -> {
                            request.setRemoteAddr("192.0.2.10");
                            return request;
                        }))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().exists("Retry-After"))
                .andExpect(jsonPath("$.code").value(429));

        verify(jobRepository, times(1)).create(any());
    }

    @Test
    void readsShouldHaveTheirOwnBudget() throws Exception {
        when(jobRepository.findAll()).thenReturn(List.of());

        for (int i = 0; i < 2; i++) {
            mvc.perform(get("/api/agent-tasks").with(request -> {
                        request.setRemoteAddr("192.0.2.20");
                        return request;
                    }))
                    .andExpect(status().isOk());
        }
        mvc.perform(get("/api/agent-tasks").with(request -> {
                    request.setRemoteAddr("192.0.2.20");
                    return request;
                }))
                .andExpect(status().isTooManyRequests());

        mvc.perform(get("/api/agent-tasks").with(request -> {
                    request.setRemoteAddr("192.0.2.21");
                    return request;
                }))
                .andExpect(status().isOk());
    }
}
