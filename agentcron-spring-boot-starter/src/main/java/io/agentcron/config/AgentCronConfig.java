package io.agentcron.config;

import io.agentcron.AgentScheduler;
import io.agentcron.ResearchEngine;
import io.agentcron.engine.HttpResearchEngine;
import io.agentcron.internal.ExecutionTracker;
import io.agentcron.internal.JobExecutor;
import io.agentcron.internal.PollingAgentScheduler;
import io.agentcron.internal.mongo.MongoExecutionStore;
import io.agentcron.internal.mongo.MongoJobStore;
import io.agentcron.internal.mongo.MongoSequenceGenerator;
import io.agentcron.store.ExecutionRepository;
import io.agentcron.store.JobRepository;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.time.Duration;

/**
 * Spring Boot auto-configuration entrypoint for the agentcron scheduler.
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration")
@ConditionalOnClass({AgentScheduler.class, MongoTemplate.class})
@EnableConfigurationProperties(AgentCronProperties.class)
@ConditionalOnProperty(prefix = "agentcron", name = "enabled", havingValue = "true", matchIfMissing = true)
public class AgentCronConfig {

    @Bean
    @ConditionalOnMissingBean
    @ConfigurationProperties(prefix = "agentcron.scheduler")
    public SchedulerProperties schedulerProperties() {
        return new SchedulerProperties();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConfigurationProperties(prefix = "agentcron.engine")
    public ResearchEngineProperties researchEngineProperties() {
        return new ResearchEngineProperties();
    }

    @Bean
    @ConditionalOnMissingBean
    protected MongoSequenceGenerator mongoSequenceGenerator(MongoTemplate mongoTemplate) {
        return new MongoSequenceGenerator(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean(JobRepository.class)
    public MongoJobStore mongoJobStore(MongoTemplate mongoTemplate, MongoSequenceGenerator sequences) {
        return new MongoJobStore(mongoTemplate, sequences);
    }

    @Bean
    @ConditionalOnMissingBean(ExecutionRepository.class)
    public MongoExecutionStore mongoExecutionStore(MongoTemplate mongoTemplate, MongoSequenceGenerator sequences) {
        return new MongoExecutionStore(mongoTemplate, sequences);
    }

    @Bean
    @ConditionalOnMissingBean
    protected AgentCronMongoIndexConfig agentCronMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new AgentCronMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public ResearchEngine researchEngine(ResearchEngineProperties props,
                                         ObjectProvider<RestClient.Builder> builderProvider) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(Duration.ofSeconds(10));
        if (props.getTimeout() != null) {
            requestFactory.setReadTimeout(props.getTimeout());
        }
        RestClient.Builder builder = builderProvider.getIfAvailable(RestClient::builder)
                .requestFactory(requestFactory);
        return new HttpResearchEngine(builder, props);
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionTracker executionTracker() {
        return new ExecutionTracker();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock agentCronClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public JobExecutor jobExecutor(ExecutionRepository executionRepository,
                                   ResearchEngine researchEngine,
                                   ExecutionTracker tracker,
                                   ResearchEngineProperties engineProps,
                                   SchedulerProperties schedulerProps,
                                   Clock clock) {
        return new JobExecutor(executionRepository, researchEngine, tracker, engineProps, schedulerProps, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public AgentScheduler agentScheduler(SchedulerProperties props,
                                         JobRepository jobRepository,
                                         ExecutionTracker tracker,
                                         JobExecutor jobExecutor,
                                         Clock clock) {
        return new PollingAgentScheduler(props, jobRepository, tracker, jobExecutor, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public AgentCronLifecycle agentCronLifecycle(AgentScheduler scheduler, SchedulerProperties props) {
        return new AgentCronLifecycle(scheduler, props.getShutdownGrace());
    }

    @Bean
    @ConditionalOnProperty(prefix = "agentcron.mongo", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton agentCronIndexesInitializer(AgentCronMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
