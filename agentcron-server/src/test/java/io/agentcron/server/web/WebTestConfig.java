package io.agentcron.server.web;

import io.agentcron.config.SchedulerProperties;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

@TestConfiguration
class WebTestConfig {

    // Wednesday
    static final Instant NOW = Instant.parse("2024-01-10T05:30:00Z");

    @Bean
    SchedulerProperties schedulerProperties() {
        SchedulerProperties props = new SchedulerProperties();
        props.setTimezone("UTC");
        return props;
    }

    @Bean
    Clock clock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }
}
