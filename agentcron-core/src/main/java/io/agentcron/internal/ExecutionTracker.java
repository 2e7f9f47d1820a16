package io.agentcron.internal;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Process-local run state of the scheduler.
 *
 * <p>Tracks which jobs are executing and the hour window each job last fired in. A job may be
 * reserved only when it is not executing and has not fired in the requested window. Both maps
 * are guarded by the tracker's monitor so check-and-set is atomic.
 *
 * <p>State is lost on restart, which allows at most one extra run within the current hour.
 */
public class ExecutionTracker {

    private static final DateTimeFormatter WINDOW_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd-HH");

    private final Set<Long> executing = new HashSet<>();
    private final Map<Long, String> lastWindow = new HashMap<>();

    /**
     * Hour-granularity window key, e.g. {@code "2024-01-01-06"}.
     */
    public static String windowKey(LocalDateTime at) {
        return WINDOW_FORMAT.format(at);
    }

    /**
     * Reserve a scheduled run of {@code jobId} in {@code windowKey}.
     *
     * @return false, without side effects, when the job is executing or already fired in this window
     */
    public synchronized boolean tryReserve(long jobId, String windowKey) {
        if (executing.contains(jobId)) {
            return false;
        }
        if (windowKey.equals(lastWindow.get(jobId))) {
            return false;
        }
        executing.add(jobId);
        lastWindow.put(jobId, windowKey);
        return true;
    }

    /**
     * Reserve a manually triggered run. Only the no-overlap rule applies and the fired window
     * is left untouched.
     */
    public synchronized boolean tryReserveUnscheduled(long jobId) {
        return executing.add(jobId);
    }

    public synchronized void release(long jobId) {
        executing.remove(jobId);
    }

    public synchronized boolean isExecuting(long jobId) {
        return executing.contains(jobId);
    }

    public synchronized int executingCount() {
        return executing.size();
    }

    /**
     * Window key the job last fired in, or null.
     */
    public synchronized String lastWindow(long jobId) {
        return lastWindow.get(jobId);
    }
}
