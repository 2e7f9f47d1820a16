package io.agentcron.server.web;

import io.agentcron.AgentScheduler;
import io.agentcron.config.SchedulerProperties;
import io.agentcron.core.ExecutionStats;
import io.agentcron.core.JobDefinition;
import io.agentcron.core.JobPatch;
import io.agentcron.store.ExecutionRepository;
import io.agentcron.store.JobRepository;
import io.agentcron.utils.TimeSpecMatcher;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@RestController
@RequestMapping("/api/agent-tasks")
public class AgentTaskController {
    private static final Logger log = LoggerFactory.getLogger(AgentTaskController.class);

    // A year plus a day, so yearly specs on a fixed date still get a preview.
    static final int NEXT_RUN_HORIZON_HOURS = 24 * 367;

    private final JobRepository jobRepository;
    private final ExecutionRepository executionRepository;
    private final AgentScheduler scheduler;
    private final SchedulerProperties schedulerProperties;
    private final Clock clock;

    public AgentTaskController(JobRepository jobRepository,
                               ExecutionRepository executionRepository,
                               AgentScheduler scheduler,
                               SchedulerProperties schedulerProperties,
                               Clock clock) {
        this.jobRepository = jobRepository;
        this.executionRepository = executionRepository;
        this.scheduler = scheduler;
        this.schedulerProperties = schedulerProperties;
        this.clock = clock;
    }

    @PostMapping
    public ResponseEntity<ApiResponse<AgentTaskResponse>> create(@Valid @RequestBody CreateAgentTaskRequest req) {
        requireValidTimeSpec(req.timeSpec());
        JobDefinition created = jobRepository.create(JobDefinition.draft(
                req.name(),
                req.info(),
                req.timeSpec(),
                req.prompt(),
                req.enabled() == null || req.enabled()
        ));
        log.info("agentcron task created name={} id={} timeSpec={}", created.name(), created.id(), created.timeSpec());
        return ResponseEntity.ok(ApiResponse.ok(toResponse(created), "task created"));
    }

    @GetMapping
    public ApiResponse<ListResponse<AgentTaskResponse>> list() {
        List<AgentTaskResponse> tasks = jobRepository.findAll().stream()
                .map(this::toResponse)
                .toList();
        return ApiResponse.ok(ListResponse.of(tasks, jobRepository.count()), "ok");
    }

    @GetMapping("/{id}")
    public ApiResponse<AgentTaskResponse> get(@PathVariable long id) {
        return ApiResponse.ok(toResponse(requireJob(id)), "ok");
    }

    @PutMapping("/{id}")
    public ApiResponse<AgentTaskResponse> update(@PathVariable long id, @Valid @RequestBody UpdateAgentTaskRequest req) {
        JobPatch patch = req.toPatch();
        if (patch.isEmpty()) {
            throw new IllegalArgumentException("no field to update");
        }
        if (patch.timeSpec() != null) {
            requireValidTimeSpec(patch.timeSpec());
        }
        JobDefinition updated = jobRepository.update(id, patch)
                .orElseThrow(() -> taskNotFound(id));
        log.info("agentcron task updated name={} id={}", updated.name(), updated.id());
        return ApiResponse.ok(toResponse(updated), "task updated");
    }

    @DeleteMapping("/{id}")
    public ApiResponse<Void> delete(@PathVariable long id) {
        if (!jobRepository.deleteById(id)) {
            throw taskNotFound(id);
        }
        log.info("agentcron task deleted id={}", id);
        return ApiResponse.ok("task deleted");
    }

    /**
     * Run the task now, outside its schedule. Refused while a run of the same task is in progress.
     */
    @PostMapping("/{id}/run")
    public ResponseEntity<ApiResponse<Void>> run(@PathVariable long id) {
        requireJob(id);
        if (!scheduler.trigger(id)) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(ApiResponse.error(HttpStatus.CONFLICT.value(), "task is already running"));
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(ApiResponse.ok("task triggered"));
    }

    @GetMapping("/{id}/executions/latest")
    public ApiResponse<ExecutionResponse> latestExecution(@PathVariable long id) {
        requireJob(id);
        return executionRepository.findLatestByJobId(id)
                .map(r -> ApiResponse.ok(ExecutionResponse.from(r), "ok"))
                .orElseThrow(() -> new ResourceNotFoundException("task " + id + " has no execution yet"));
    }

    @GetMapping("/{id}/stats")
    public ApiResponse<ExecutionStatsResponse> stats(@PathVariable long id) {
        requireJob(id);
        ExecutionStats stats = executionRepository.statsForJob(id);
        return ApiResponse.ok(ExecutionStatsResponse.from(stats), "ok");
    }

    private JobDefinition requireJob(long id) {
        return jobRepository.findById(id).orElseThrow(() -> taskNotFound(id));
    }

    private AgentTaskResponse toResponse(JobDefinition job) {
        LocalDateTime nextRunAt = null;
        if (job.enabled() && job.hasTimeSpec()) {
            LocalDateTime now = LocalDateTime.now(clock.withZone(schedulerProperties.zone()));
            nextRunAt = TimeSpecMatcher.nextMatch(job.timeSpec(), now, NEXT_RUN_HORIZON_HOURS).orElse(null);
        }
        return AgentTaskResponse.from(job, nextRunAt);
    }

    private static void requireValidTimeSpec(String timeSpec) {
        if (!TimeSpecMatcher.isValid(timeSpec)) {
            throw new IllegalArgumentException("invalid timeSpec: " + timeSpec);
        }
    }

    private static ResourceNotFoundException taskNotFound(long id) {
        return new ResourceNotFoundException("task " + id + " not found");
    }
}
