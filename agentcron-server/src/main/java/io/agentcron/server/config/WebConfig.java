package io.agentcron.server.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.agentcron.server.web.RateLimitInterceptor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(ApiProperties.class)
public class WebConfig implements WebMvcConfigurer {

    private final ApiProperties apiProperties;
    private final ObjectMapper objectMapper;
    private final ObjectProvider<Clock> clockProvider;

    public WebConfig(ApiProperties apiProperties, ObjectMapper objectMapper, ObjectProvider<Clock> clockProvider) {
        this.apiProperties = apiProperties;
        this.objectMapper = objectMapper;
        this.clockProvider = clockProvider;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        if (!apiProperties.getRateLimit().isEnabled()) {
            return;
        }
        Clock clock = clockProvider.getIfAvailable(Clock::systemUTC);
        registry.addInterceptor(new RateLimitInterceptor(apiProperties.getRateLimit(), objectMapper, clock))
                .addPathPatterns("/api/**");
    }
}
