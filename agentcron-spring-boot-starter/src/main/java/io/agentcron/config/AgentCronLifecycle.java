package io.agentcron.config;

import io.agentcron.AgentScheduler;
import org.springframework.context.SmartLifecycle;

import java.time.Duration;
import java.util.Objects;

/**
 * Bridges scheduler start/shutdown with the Spring container lifecycle.
 */
public class AgentCronLifecycle implements SmartLifecycle {
    private final AgentScheduler scheduler;
    private final Duration shutdownGrace;
    private volatile boolean running = false;

    public AgentCronLifecycle(AgentScheduler scheduler, Duration shutdownGrace) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.shutdownGrace = shutdownGrace == null ? Duration.ZERO : shutdownGrace;
    }

    @Override
    public void start() {
        scheduler.start();
        running = true;
    }

    @Override
    public void stop() {
        scheduler.shutdown(shutdownGrace);
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
