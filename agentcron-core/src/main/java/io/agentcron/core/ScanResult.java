package io.agentcron.core;

/**
 * Counters of one scheduler scan.
 *
 * examined : enabled jobs loaded
 * launched : jobs dispatched to the worker pool
 * skipped  : jobs not launched (no spec, no match, already running or fired, errors)
 */
public record ScanResult(
        int examined,
        int launched,
        int skipped
) {

    public static ScanResult empty() {
        return new ScanResult(0, 0, 0);
    }
}
