package io.lift.indexer.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.lift.indexer.event.EventPayloadCodec;
import io.lift.indexer.poller.PollerRegistry;
import java.time.Clock;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class SchedulerConfig {

    @Bean(name = "pollerScheduler")
    public ThreadPoolTaskScheduler pollerScheduler(IndexerProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("indexer-poller-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public PollerRegistry pollerRegistry(
        @Qualifier("pollerScheduler") ThreadPoolTaskScheduler pollerScheduler,
        IndexerProperties properties
    ) {
        return new PollerRegistry(pollerScheduler, Duration.ofMillis(properties.getPollIntervalMs()));
    }

    @Bean(name = "handlerExecutor")
    public ThreadPoolTaskExecutor handlerExecutor(IndexerProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getHandlerPoolSize());
        executor.setMaxPoolSize(properties.getHandlerPoolSize());
        executor.setQueueCapacity(properties.getHandlerPoolSize() * 16);
        executor.setThreadNamePrefix("indexer-handler-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EventPayloadCodec eventPayloadCodec(ObjectMapper objectMapper) {
        return new EventPayloadCodec(objectMapper);
    }
}
