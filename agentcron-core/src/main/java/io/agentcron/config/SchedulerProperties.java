package io.agentcron.config;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Runtime configuration for scheduler behavior.
 */
public class SchedulerProperties {
    private Duration initialDelay = Duration.ofSeconds(10);
    private Duration scanInterval = Duration.ofSeconds(60);
    private String timezone; // IANA id, null means system default
    private int summaryLength = 500;
    private Duration shutdownGrace = Duration.ofSeconds(30);

    public Duration getInitialDelay() {
        return initialDelay;
    }

    public void setInitialDelay(Duration initialDelay) {
        this.initialDelay = initialDelay;
    }

    public Duration getScanInterval() {
        return scanInterval;
    }

    public void setScanInterval(Duration scanInterval) {
        this.scanInterval = scanInterval;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public int getSummaryLength() {
        return summaryLength;
    }

    public void setSummaryLength(int summaryLength) {
        this.summaryLength = summaryLength;
    }

    public Duration getShutdownGrace() {
        return shutdownGrace;
    }

    public void setShutdownGrace(Duration shutdownGrace) {
        this.shutdownGrace = shutdownGrace;
    }

    /**
     * Zone used to evaluate time-specs. Falls back to the system default when unset or invalid.
     */
    public ZoneId zone() {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timezone);
        } catch (Exception e) {
            return ZoneId.systemDefault();
        }
    }
}
