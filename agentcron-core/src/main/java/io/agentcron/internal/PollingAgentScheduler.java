package io.agentcron.internal;

import io.agentcron.AgentScheduler;
import io.agentcron.config.SchedulerProperties;
import io.agentcron.core.JobDefinition;
import io.agentcron.core.ScanResult;
import io.agentcron.store.JobRepository;
import io.agentcron.utils.TimeSpecMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scheduler that scans the job store on a fixed cadence.
 *
 * <p>Core behavior:
 * <ul>
 *   <li>A single scanner thread waits {@code initialDelay}, then scans every {@code scanInterval}</li>
 *   <li>Each due job is handed to an unbounded worker pool; the scan never waits for it</li>
 *   <li>{@link ExecutionTracker} keeps one run per job at a time and one scheduled run per hour</li>
 * </ul>
 *
 * <p>{@link #stop()} lets a scan in progress finish; only the wait between scans is cut short.
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.start();
 * ...
 * scheduler.stop();
 * scheduler.awaitInFlight(Duration.ofSeconds(30));
 * }</pre>
 */
public class PollingAgentScheduler implements AgentScheduler {
    private static final Logger log = LoggerFactory.getLogger(PollingAgentScheduler.class);

    private final SchedulerProperties props;
    private final JobRepository jobRepository;
    private final ExecutionTracker tracker;
    private final JobExecutor jobExecutor;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final ConcurrentHashMap<Long, CompletableFuture<Void>> inFlight = new ConcurrentHashMap<>();
    private final AtomicInteger workerSeq = new AtomicInteger();

    // stop() wakes the scanner through this monitor and never interrupts it
    private final Object sleepMonitor = new Object();

    private volatile ExecutorService workerPool;
    private volatile Thread scannerThread;

    public PollingAgentScheduler(SchedulerProperties props,
                                 JobRepository jobRepository,
                                 ExecutionTracker tracker,
                                 JobExecutor jobExecutor,
                                 Clock clock) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.jobRepository = Objects.requireNonNull(jobRepository, "jobRepository must not be null");
        this.tracker = Objects.requireNonNull(tracker, "tracker must not be null");
        this.jobExecutor = Objects.requireNonNull(jobExecutor, "jobExecutor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Start scanning. Idempotent.
     */
    @Override
    public synchronized void start() {
        Duration interval = Objects.requireNonNull(props.getScanInterval(), "agentcron.scheduler.scanInterval must not be null");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("agentcron.scheduler.scanInterval must be a positive duration");
        }
        Duration initialDelay = Objects.requireNonNull(props.getInitialDelay(), "agentcron.scheduler.initialDelay must not be null");
        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("agentcron.scheduler.initialDelay must not be negative");
        }

        if (!started.compareAndSet(false, true)) {
            return;
        }

        log.info("agentcron scheduler starting with initialDelay={}, scanInterval={}, zone={}",
                initialDelay, interval, props.zone());

        ensureWorkerPool();

        Thread scanner = new Thread(this::scanLoop);
        scanner.setName("agentcron.scanner");
        scanner.setDaemon(true);
        scannerThread = scanner;
        scanner.start();

        log.info("agentcron scheduler started.");
    }

    /**
     * Stop scanning. Idempotent. Executions already dispatched keep running.
     */
    @Override
    public synchronized void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("agentcron scheduler stopping, inFlight={}", inFlight.size());

        scannerThread = null;
        synchronized (sleepMonitor) {
            sleepMonitor.notifyAll();
        }
        log.info("agentcron scheduler stopped.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public int inFlightCount() {
        return inFlight.size();
    }

    @Override
    public boolean awaitInFlight(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout must not be null");
        List<CompletableFuture<Void>> pending = new ArrayList<>(inFlight.values());
        if (pending.isEmpty()) {
            return true;
        }

        log.info("agentcron waiting up to {} for {} in-flight executions", timeout, pending.size());
        try {
            CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]))
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (TimeoutException e) {
            log.warn("agentcron executions still running after {}; their records stay RUNNING if the process exits, inFlight={}",
                    timeout, inFlight.keySet());
            return false;
        } catch (ExecutionException e) {
            // allOf completes only after every handle completed, some of them exceptionally
            return true;
        }
    }

    /**
     * Shut the worker pool down after draining. Used when the owning container closes.
     */
    @Override
    public void shutdown(Duration grace) {
        stop();
        awaitInFlight(grace);
        synchronized (this) {
            if (workerPool != null) {
                workerPool.shutdown();
                workerPool = null;
            }
        }
    }

    @Override
    public ScanResult scan() {
        List<JobDefinition> jobs;
        try {
            jobs = jobRepository.listEnabledJobs();
        } catch (Exception e) {
            log.error("agentcron could not load enabled jobs msg={}", e.getMessage(), e);
            return ScanResult.empty();
        }

        if (jobs.isEmpty()) {
            log.debug("agentcron scan finished: no enabled jobs");
            return ScanResult.empty();
        }

        LocalDateTime now = LocalDateTime.now(clock.withZone(zone()));
        String windowKey = ExecutionTracker.windowKey(now);

        log.info("agentcron scan started at={} window={} enabledJobs={}", now, windowKey, jobs.size());

        int launched = 0;
        int skipped = 0;
        for (JobDefinition job : jobs) {
            try {
                if (evaluate(job, now, windowKey)) {
                    launched++;
                } else {
                    skipped++;
                }
            } catch (RuntimeException e) {
                skipped++;
                log.error("agentcron failed to evaluate job name={} id={} msg={}", job.name(), job.id(), e.getMessage(), e);
            }
        }

        ScanResult result = new ScanResult(jobs.size(), launched, skipped);
        log.info("agentcron scan finished examined={} launched={} skipped={} executing={}",
                result.examined(), result.launched(), result.skipped(), tracker.executingCount());
        return result;
    }

    @Override
    public boolean trigger(long jobId) {
        Optional<JobDefinition> job = jobRepository.findById(jobId);
        if (job.isEmpty()) {
            log.info("agentcron trigger ignored, no such job id={}", jobId);
            return false;
        }
        if (!tracker.tryReserveUnscheduled(jobId)) {
            log.info("agentcron trigger ignored, job is executing name={} id={}", job.get().name(), jobId);
            return false;
        }
        log.info("agentcron triggered job name={} id={}", job.get().name(), jobId);
        return dispatch(job.get());
    }

    private boolean evaluate(JobDefinition job, LocalDateTime now, String windowKey) {
        if (!job.hasTimeSpec()) {
            log.warn("agentcron skipping job without time-spec name={} id={}", job.name(), job.id());
            return false;
        }

        if (!TimeSpecMatcher.matches(job.timeSpec(), now)) {
            log.debug("agentcron skipping job name={} id={}: time-spec {} does not match", job.name(), job.id(), job.timeSpec());
            return false;
        }

        if (!tracker.tryReserve(job.id(), windowKey)) {
            if (tracker.isExecuting(job.id())) {
                log.info("agentcron skipping job name={} id={}: still executing", job.name(), job.id());
            } else {
                log.info("agentcron skipping job name={} id={}: already fired in window {}", job.name(), job.id(), windowKey);
            }
            return false;
        }

        log.info("agentcron launching job name={} id={} timeSpec={}", job.name(), job.id(), job.timeSpec());
        return dispatch(job);
    }

    private boolean dispatch(JobDefinition job) {
        long jobId = job.id();
        CompletableFuture<Void> handle;
        try {
            handle = CompletableFuture.runAsync(() -> jobExecutor.run(job), ensureWorkerPool());
        } catch (RejectedExecutionException e) {
            tracker.release(jobId);
            log.error("agentcron worker pool rejected job name={} id={} msg={}", job.name(), jobId, e.getMessage());
            return false;
        }

        inFlight.put(jobId, handle);
        handle.whenComplete((v, err) -> {
            inFlight.remove(jobId, handle);
            if (err != null) {
                log.error("agentcron execution terminated abnormally name={} id={} msg={}", job.name(), jobId, err.getMessage(), err);
            }
        });
        return true;
    }

    private synchronized ExecutorService ensureWorkerPool() {
        if (workerPool == null) {
            workerPool = Executors.newCachedThreadPool(r -> {
                Thread t = new Thread(r);
                t.setName("agentcron.worker-" + workerSeq.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        }
        return workerPool;
    }

    private ZoneId zone() {
        return props.zone();
    }

    private void scanLoop() {
        if (!sleep(props.getInitialDelay())) {
            return;
        }

        while (isActiveScanner()) {
            try {
                scan();
            } catch (Exception e) {
                log.error("agentcron scan failed msg={}", e.getMessage(), e);
            }

            if (!sleep(props.getScanInterval())) {
                break;
            }
        }
        log.debug("agentcron scanner exited");
    }

    /**
     * A scanner left over from before a stop/start cycle is no longer active.
     */
    private boolean isActiveScanner() {
        return started.get() && scannerThread == Thread.currentThread();
    }

    /**
     * Waits for {@code duration} or until stopped.
     *
     * @return false when the scanner should exit
     */
    private boolean sleep(Duration duration) {
        long deadline = System.nanoTime() + duration.toNanos();
        synchronized (sleepMonitor) {
            while (isActiveScanner()) {
                long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMillis <= 0) {
                    return true;
                }
                try {
                    sleepMonitor.wait(remainingMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            }
            return false;
        }
    }
}
