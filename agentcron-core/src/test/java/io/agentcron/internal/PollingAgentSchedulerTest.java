package io.agentcron.internal;

import io.agentcron.ResearchEngine;
import io.agentcron.config.ResearchEngineProperties;
import io.agentcron.config.SchedulerProperties;
import io.agentcron.core.ExecutionRecord;
import io.agentcron.core.ExecutionStatus;
import io.agentcron.core.JobDefinition;
import io.agentcron.core.ScanResult;
import io.agentcron.store.JobRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class PollingAgentSchedulerTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-10T06:10:00Z"));
    private InMemoryJobRepository jobs;
    private InMemoryExecutionRepository executions;
    private ExecutionTracker tracker;
    private SchedulerProperties props;
    private PollingAgentScheduler scheduler;

    private volatile ResearchEngine engine = request -> "report for " + request.query();

    @BeforeEach
    void setUp() {
        jobs = new InMemoryJobRepository();
        executions = new InMemoryExecutionRepository();
        tracker = new ExecutionTracker();
        props = new SchedulerProperties();
        props.setTimezone("UTC");
        scheduler = newScheduler(jobs);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown(WAIT);
    }

    @Test
    void dueJobShouldRunOncePerHourWindow() {
        CountDownLatch release = new CountDownLatch(1);
        engine = request -> {
            release.await(5, TimeUnit.SECONDS);
            return "done";
        };
        JobDefinition job = jobs.create(JobDefinition.draft("every-hour", null, "* * * *", "prompt", true));

        ScanResult first = scheduler.scan();
        assertThat(first).isEqualTo(new ScanResult(1, 1, 0));
        assertThat(tracker.isExecuting(job.id())).isTrue();

        ScanResult concurrent = scheduler.scan();
        assertThat(concurrent).isEqualTo(new ScanResult(1, 0, 1));

        release.countDown();
        assertThat(scheduler.awaitInFlight(WAIT)).isTrue();

        ScanResult sameHour = scheduler.scan();
        assertThat(sameHour).isEqualTo(new ScanResult(1, 0, 1));

        List<ExecutionRecord> history = executions.forJob(job.id());
        assertThat(history).hasSize(1);
        ExecutionRecord record = history.get(0);
        assertThat(record.status()).isEqualTo(ExecutionStatus.SUCCEEDED);
        assertThat(record.endTime()).isNotNull();
        assertThat(record.durationSeconds()).isGreaterThanOrEqualTo(0L);
        assertThat(record.resultDetail()).isEqualTo("done");
    }

    @Test
    void jobShouldFireAgainInNextHour() {
        JobDefinition job = jobs.create(JobDefinition.draft("every-hour", null, "* * * *", "prompt", true));

        assertThat(scheduler.scan().launched()).isEqualTo(1);
        assertThat(scheduler.awaitInFlight(WAIT)).isTrue();

        clock.set(Instant.parse("2024-01-10T06:59:00Z"));
        assertThat(scheduler.scan().launched()).isZero();

        clock.set(Instant.parse("2024-01-10T07:00:30Z"));
        assertThat(scheduler.scan().launched()).isEqualTo(1);
        assertThat(scheduler.awaitInFlight(WAIT)).isTrue();

        assertThat(executions.forJob(job.id())).hasSize(2);
    }

    @Test
    void jobWithoutTimeSpecShouldNeverRun() {
        JobDefinition blank = jobs.create(JobDefinition.draft("no-spec", null, "", "prompt", true));
        JobDefinition missing = jobs.create(JobDefinition.draft("null-spec", null, null, "prompt", true));

        for (int i = 0; i < 3; i++) {
            assertThat(scheduler.scan()).isEqualTo(new ScanResult(2, 0, 2));
        }

        assertThat(executions.forJob(blank.id())).isEmpty();
        assertThat(executions.forJob(missing.id())).isEmpty();
    }

    @Test
    void onlyMatchingEnabledJobsShouldBeLaunched() {
        jobs.create(JobDefinition.draft("at-six", null, "6 * * *", "p", true));
        jobs.create(JobDefinition.draft("at-twenty-three", null, "23 * * *", "p", true));
        jobs.create(JobDefinition.draft("malformed", null, "6 * *", "p", true));
        jobs.create(JobDefinition.draft("disabled", null, "* * * *", "p", false));

        ScanResult result = scheduler.scan();

        assertThat(result).isEqualTo(new ScanResult(3, 1, 2));
    }

    @Test
    void failingEngineShouldProduceFailedRecord() {
        engine = request -> {
            throw new IllegalStateException("search provider unavailable");
        };
        JobDefinition job = jobs.create(JobDefinition.draft("flaky", null, "* * * *", "p", true));

        scheduler.scan();
        assertThat(scheduler.awaitInFlight(WAIT)).isTrue();

        ExecutionRecord record = executions.forJob(job.id()).get(0);
        assertThat(record.status()).isEqualTo(ExecutionStatus.FAILED);
        assertThat(record.errorMessage()).isEqualTo("search provider unavailable");
        assertThat(record.errorDetail()).contains("IllegalStateException");
        assertThat(record.endTime()).isNotNull();
        assertThat(tracker.isExecuting(job.id())).isFalse();
    }

    @Test
    void brokenJobShouldNotAbortScan() {
        JobRepository repo = mock(JobRepository.class);
        JobDefinition broken = new JobDefinition(null, "broken", null, "* * * *", "p", true, null, null);
        JobDefinition healthy = new JobDefinition(2L, "healthy", null, "* * * *", "p", true, null, null);
        when(repo.listEnabledJobs()).thenReturn(List.of(broken, healthy));
        scheduler = newScheduler(repo);

        ScanResult result = scheduler.scan();

        assertThat(result).isEqualTo(new ScanResult(2, 1, 1));
    }

    @Test
    void loadFailureShouldYieldEmptyScan() {
        JobRepository repo = mock(JobRepository.class);
        when(repo.listEnabledJobs()).thenThrow(new IllegalStateException("connection refused"));
        scheduler = newScheduler(repo);

        assertThat(scheduler.scan()).isEqualTo(ScanResult.empty());
    }

    @Test
    void triggerShouldIgnoreScheduleButNotOverlap() {
        CountDownLatch release = new CountDownLatch(1);
        engine = request -> {
            release.await(5, TimeUnit.SECONDS);
            return "manual";
        };
        JobDefinition job = jobs.create(JobDefinition.draft("manual", null, "23 * * *", "p", false));

        assertThat(scheduler.trigger(job.id())).isTrue();
        assertThat(scheduler.trigger(job.id())).isFalse();
        assertThat(scheduler.inFlightCount()).isEqualTo(1);

        release.countDown();
        assertThat(scheduler.awaitInFlight(WAIT)).isTrue();

        assertThat(executions.forJob(job.id())).singleElement()
                .extracting(ExecutionRecord::status).isEqualTo(ExecutionStatus.SUCCEEDED);
        assertThat(tracker.lastWindow(job.id())).isNull();
        assertThat(scheduler.trigger(999L)).isFalse();
    }

    @Test
    void startedSchedulerShouldScanUntilStopped() throws Exception {
        props.setInitialDelay(Duration.ZERO);
        props.setScanInterval(Duration.ofMillis(50));
        JobDefinition job = jobs.create(JobDefinition.draft("loop", null, "* * * *", "p", true));

        scheduler.start();
        scheduler.start();
        assertThat(scheduler.isRunning()).isTrue();

        assertThat(waitUntil(() -> executions.forJob(job.id()).stream().anyMatch(ExecutionRecord::isTerminal))).isTrue();

        scheduler.stop();
        assertThat(scheduler.isRunning()).isFalse();
        assertThat(executions.forJob(job.id())).hasSize(1);
    }

    @Test
    void stopDuringScanShouldLetStoreReadFinishUninterrupted() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch proceed = new CountDownLatch(1);
        CountDownLatch returned = new CountDownLatch(1);
        AtomicBoolean interrupted = new AtomicBoolean();
        InMemoryJobRepository slowStore = new InMemoryJobRepository() {
            @Override
            public List<JobDefinition> listEnabledJobs() {
                entered.countDown();
                try {
                    proceed.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                interrupted.set(Thread.currentThread().isInterrupted());
                returned.countDown();
                return super.listEnabledJobs();
            }
        };
        props.setInitialDelay(Duration.ZERO);
        props.setScanInterval(Duration.ofHours(1));
        scheduler = newScheduler(slowStore);

        scheduler.start();
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        scheduler.stop();
        proceed.countDown();

        assertThat(returned.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(interrupted.get()).isFalse();
        assertThat(scheduler.isRunning()).isFalse();
    }

    @Test
    void restartedSchedulerShouldScanAgain() throws Exception {
        props.setInitialDelay(Duration.ofHours(1));
        JobDefinition job = jobs.create(JobDefinition.draft("restart", null, "* * * *", "p", true));

        scheduler.start();
        scheduler.stop();

        props.setInitialDelay(Duration.ZERO);
        scheduler.start();

        assertThat(waitUntil(() -> executions.forJob(job.id()).stream().anyMatch(ExecutionRecord::isTerminal))).isTrue();
    }

    @Test
    void startShouldRejectNonPositiveInterval() {
        props.setScanInterval(Duration.ZERO);

        assertThatThrownBy(() -> scheduler.start())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("scanInterval");
        assertThat(scheduler.isRunning()).isFalse();
    }

    private PollingAgentScheduler newScheduler(JobRepository repo) {
        JobExecutor executor = new JobExecutor(
                executions,
                request -> engine.research(request),
                tracker,
                new ResearchEngineProperties(),
                props,
                clock
        );
        return new PollingAgentScheduler(props, repo, tracker, executor, clock);
    }

    private static boolean waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + WAIT.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(20);
        }
        return false;
    }

    static final class MutableClock extends Clock {
        private volatile Instant now;
        private final ZoneId zone;

        MutableClock(Instant now) {
            this(now, ZoneOffset.UTC);
        }

        private MutableClock(Instant now, ZoneId zone) {
            this.now = now;
            this.zone = zone;
        }

        void set(Instant now) {
            this.now = now;
        }

        @Override
        public ZoneId getZone() {
            return zone;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            MutableClock parent = this;
            return new Clock() {
                @Override
                public ZoneId getZone() {
                    return zone;
                }

                @Override
                public Clock withZone(ZoneId z) {
                    return parent.withZone(z);
                }

                @Override
                public Instant instant() {
                    return parent.instant();
                }
            };
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
