package io.agentcron;

import io.agentcron.core.ScanResult;

import java.time.Duration;

/**
 * Main scheduler API.
 *
 * <p>A scheduler periodically scans the enabled job definitions, matches each job's time-spec
 * against the current hour and launches due jobs in the background. Each job fires at most
 * once per hour window and never overlaps with its own previous run.
 */
public interface AgentScheduler {
    void start();

    void stop();

    boolean isRunning();

    /**
     * Run a single scan-and-dispatch pass on the calling thread.
     */
    ScanResult scan();

    /**
     * Launch a job immediately, ignoring its time-spec and enabled flag.
     *
     * @return false when the job does not exist or is already executing
     */
    boolean trigger(long jobId);

    int inFlightCount();

    /**
     * Wait for dispatched executions to finish.
     *
     * @return true when nothing is left running
     */
    boolean awaitInFlight(Duration timeout);

    /**
     * Stop scanning, wait up to {@code grace} for in-flight executions, then release worker threads.
     */
    default void shutdown(Duration grace) {
        stop();
        awaitInFlight(grace);
    }
}
