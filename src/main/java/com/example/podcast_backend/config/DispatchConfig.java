package com.example.podcast_backend.config;

import com.google.cloud.tasks.v2.CloudTasksClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.io.IOException;

/**
 * Executor for in-process assembly runs and the managed queue client.
 */
@Configuration
@EnableConfigurationProperties(DispatchProperties.class)
public class DispatchConfig {

    /** Bounded FIFO pool; jobs beyond the queue capacity are rejected rather than piling up. */
    @Bean(name = "assemblyTaskExecutor")
    public ThreadPoolTaskExecutor assemblyTaskExecutor(DispatchProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        int threads = Math.max(1, properties.getInline().getThreads());
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(properties.getInline().getQueueCapacity());
        executor.setThreadNamePrefix("assembly-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "dispatch.queue", name = "enabled", havingValue = "true")
    public CloudTasksClient cloudTasksClient() throws IOException {
        return CloudTasksClient.create();
    }
}
