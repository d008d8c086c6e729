package com.biocbot.content.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(SyncProperties.class)
public class SyncConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Bounded pool for indexing notifications. A full queue rejects the task
     * instead of blocking the request thread.
     */
    @Bean(name = "indexingExecutor")
    public TaskExecutor indexingExecutor(SyncProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.indexing().poolSize());
        executor.setMaxPoolSize(properties.indexing().poolSize());
        executor.setQueueCapacity(properties.indexing().queueCapacity());
        executor.setThreadNamePrefix("indexing-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
}
