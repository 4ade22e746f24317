package com.meshnet.linkwatch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools for topology reconciliation.
 * Updates of different sources run in parallel on {@code topologyUpdateExecutor};
 * document fetches run on {@code topologyFetchExecutor} so they can be timed out.
 */
@Configuration
@EnableScheduling
public class AsyncConfig {

    @Bean(name = "topologyUpdateExecutor")
    public ThreadPoolTaskExecutor topologyUpdateExecutor(LinkwatchProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getTopology().getUpdatePoolSize());
        executor.setMaxPoolSize(properties.getTopology().getUpdatePoolSize());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("topology-update-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "topologyFetchExecutor")
    public ThreadPoolTaskExecutor topologyFetchExecutor(LinkwatchProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getTopology().getUpdatePoolSize());
        executor.setMaxPoolSize(properties.getTopology().getUpdatePoolSize());
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("topology-fetch-");
        executor.initialize();
        return executor;
    }
}
