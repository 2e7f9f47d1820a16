package io.agentcron.internal;

import io.agentcron.ResearchEngine;
import io.agentcron.config.ResearchEngineProperties;
import io.agentcron.config.SchedulerProperties;
import io.agentcron.core.ExecutionCompletion;
import io.agentcron.core.ExecutionOutcome;
import io.agentcron.core.ExecutionRecord;
import io.agentcron.core.JobDefinition;
import io.agentcron.core.ResearchRequest;
import io.agentcron.store.ExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * Runs one job end to end: record start, call the research engine, record the terminal outcome.
 *
 * <p>The job's tracker reservation is always released when {@link #run} returns.
 */
public class JobExecutor {
    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private final ExecutionRepository executionRepository;
    private final ResearchEngine engine;
    private final ExecutionTracker tracker;
    private final ResearchEngineProperties engineProps;
    private final int summaryLength;
    private final Clock clock;

    public JobExecutor(ExecutionRepository executionRepository,
                       ResearchEngine engine,
                       ExecutionTracker tracker,
                       ResearchEngineProperties engineProps,
                       SchedulerProperties props,
                       Clock clock) {
        this.executionRepository = Objects.requireNonNull(executionRepository, "executionRepository must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.tracker = Objects.requireNonNull(tracker, "tracker must not be null");
        this.engineProps = Objects.requireNonNull(engineProps, "engineProps must not be null");
        Objects.requireNonNull(props, "props must not be null");
        if (props.getSummaryLength() <= 0) {
            throw new IllegalArgumentException("agentcron.scheduler.summaryLength must be positive");
        }
        this.summaryLength = props.getSummaryLength();
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public void run(JobDefinition job) {
        Objects.requireNonNull(job, "job must not be null");
        long jobId = job.id();
        try {
            execute(job);
        } finally {
            tracker.release(jobId);
        }
    }

    private void execute(JobDefinition job) {
        Instant startTime = clock.instant();

        long executionId;
        try {
            executionId = executionRepository.createExecution(ExecutionRecord.running(job, startTime));
        } catch (Exception e) {
            log.error("agentcron could not record execution start, run abandoned jobName={} jobId={} msg={}",
                    job.name(), job.id(), e.getMessage(), e);
            return;
        }

        log.info("agentcron execution started executionId={} jobName={} jobId={}", executionId, job.name(), job.id());
        log.info("agentcron executionId={} model={} apiBase={} retriever={}",
                executionId, engineProps.getModel(), engineProps.getApiBase(), engineProps.getRetriever());

        ExecutionOutcome outcome = invoke(job, executionId);
        ExecutionCompletion completion = ExecutionCompletion.of(outcome, startTime, clock.instant(), summaryLength);

        try {
            if (!executionRepository.completeExecution(executionId, completion)) {
                log.warn("agentcron execution was not RUNNING at completion executionId={} jobId={}", executionId, job.id());
            }
        } catch (Exception e) {
            log.error("agentcron could not record execution outcome executionId={} jobId={} status={} msg={}",
                    executionId, job.id(), completion.status(), e.getMessage(), e);
            return;
        }

        switch (completion.status()) {
            case SUCCEEDED -> log.info("agentcron execution succeeded executionId={} jobName={} duration={}s",
                    executionId, job.name(), completion.durationSeconds());
            case FAILED -> {
                log.error("agentcron execution failed executionId={} jobName={} duration={}s msg={}",
                        executionId, job.name(), completion.durationSeconds(), completion.errorMessage());
                log.debug("agentcron execution failure detail executionId={} detail={}", executionId, completion.errorDetail());
            }
            default -> throw new IllegalStateException("non-terminal completion: " + completion.status());
        }
    }

    private ExecutionOutcome invoke(JobDefinition job, long executionId) {
        ResearchRequest request = ResearchRequest.of(job.prompt(), engineProps);
        try {
            log.debug("agentcron research started executionId={}", executionId);
            return ExecutionOutcome.succeeded(engine.research(request));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExecutionOutcome.failed(e);
        } catch (Exception e) {
            return ExecutionOutcome.failed(e);
        }
    }
}
