package com.rebootearth.burnrisk.infrastructure.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Thread pool for upstream calls and the clock used for cache TTL decisions.
 *
 * Each computation fans out to five sources, so the pool bounds how many distinct
 * grid cells are computed concurrently. A queued call is already timing out, so the pool
 * runs every thread as a core thread and only queues once all of them are busy.
 */
@Configuration
public class ExecutorConfig {

    @Bean(name = "upstreamExecutor")
    public ThreadPoolTaskExecutor upstreamExecutor(BurnRiskProperties properties) {
        BurnRiskProperties.Orchestrator config = properties.getOrchestrator();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getMaxPoolSize());
        executor.setMaxPoolSize(config.getMaxPoolSize());
        executor.setAllowCoreThreadTimeOut(true);
        executor.setKeepAliveSeconds((int) config.getIdleThreadKeepAlive().getSeconds());
        executor.setQueueCapacity(config.getQueueCapacity());
        executor.setThreadNamePrefix("upstream-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
