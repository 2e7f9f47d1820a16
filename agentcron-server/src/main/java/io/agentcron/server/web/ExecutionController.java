package io.agentcron.server.web;

import io.agentcron.core.ExecutionPage;
import io.agentcron.core.ExecutionQuery;
import io.agentcron.core.ExecutionStatus;
import io.agentcron.store.ExecutionRepository;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/api/executions")
public class ExecutionController {

    private final ExecutionRepository executionRepository;

    public ExecutionController(ExecutionRepository executionRepository) {
        this.executionRepository = executionRepository;
    }

    /**
     * History, newest first. {@code status} accepts a name ({@code FAILED}) or a numeric code ({@code 2}).
     */
    @GetMapping
    public ApiResponse<ListResponse<ExecutionResponse>> list(
            @RequestParam(required = false) Long jobId,
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "" + ExecutionQuery.DEFAULT_SIZE) int size) {
        ExecutionQuery query = ExecutionQuery.builder()
                .jobId(jobId)
                .status(parseStatus(status))
                .offset(offset)
                .size(size)
                .build();

        ExecutionPage page = executionRepository.find(query);
        List<ExecutionResponse> items = page.items().stream().map(ExecutionResponse::from).toList();
        return ApiResponse.ok(new ListResponse<>(items, page.total(), page.offset(), page.size()), "ok");
    }

    @GetMapping("/{id}")
    public ApiResponse<ExecutionResponse> get(@PathVariable long id) {
        return executionRepository.findById(id)
                .map(r -> ApiResponse.ok(ExecutionResponse.from(r), "ok"))
                .orElseThrow(() -> new ResourceNotFoundException("execution " + id + " not found"));
    }

    static ExecutionStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        String s = status.trim();
        if (s.chars().allMatch(Character::isDigit)) {
            return ExecutionStatus.fromCode(Integer.parseInt(s));
        }
        try {
            return ExecutionStatus.valueOf(s.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown status: " + status, e);
        }
    }
}
