package io.agentcron.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * REST layer settings under {@code agentcron.api}.
 */
@ConfigurationProperties(prefix = "agentcron.api")
public class ApiProperties {
    private boolean debug = false;
    private final RateLimit rateLimit = new RateLimit();

    public boolean isDebug() {
        return debug;
    }

    public void setDebug(boolean debug) {
        this.debug = debug;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    /**
     * Requests allowed per client address and minute. A value of 0 or less disables the limit
     * for that kind of route.
     */
    public static class RateLimit {
        private boolean enabled = true;
        private int readPerMinute = 60;
        private int createPerMinute = 20;
        private int updatePerMinute = 30;
        private int deletePerMinute = 20;
        private int defaultPerMinute = 100;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getReadPerMinute() {
            return readPerMinute;
        }

        public void setReadPerMinute(int readPerMinute) {
            this.readPerMinute = readPerMinute;
        }

        public int getCreatePerMinute() {
            return createPerMinute;
        }

        public void setCreatePerMinute(int createPerMinute) {
            this.createPerMinute = createPerMinute;
        }

        public int getUpdatePerMinute() {
            return updatePerMinute;
        }

        public void setUpdatePerMinute(int updatePerMinute) {
            this.updatePerMinute = updatePerMinute;
        }

        public int getDeletePerMinute() {
            return deletePerMinute;
        }

        public void setDeletePerMinute(int deletePerMinute) {
            this.deletePerMinute = deletePerMinute;
        }

        public int getDefaultPerMinute() {
            return defaultPerMinute;
        }

        public void setDefaultPerMinute(int defaultPerMinute) {
            this.defaultPerMinute = defaultPerMinute;
        }
    }
}
