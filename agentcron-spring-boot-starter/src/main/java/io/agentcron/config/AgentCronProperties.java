package io.agentcron.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Top-level switches of the auto-configuration. Scheduler and engine settings live under
 * {@code agentcron.scheduler} and {@code agentcron.engine}.
 */
@ConfigurationProperties(prefix = "agentcron")
public class AgentCronProperties {
    private boolean enabled = true;
    private final Mongo mongo = new Mongo();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Mongo getMongo() {
        return mongo;
    }

    public static class Mongo {
        private boolean ensureIndexesOnStartup = false;

        public boolean isEnsureIndexesOnStartup() {
            return ensureIndexesOnStartup;
        }

        public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
            this.ensureIndexesOnStartup = ensureIndexesOnStartup;
        }
    }
}
