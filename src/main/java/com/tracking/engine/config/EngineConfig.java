package com.tracking.engine.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Time sources and thread pools of the engine.
 */
@Configuration
@EnableConfigurationProperties(TrackingProperties.class)
public class EngineConfig {

    @Bean
    public Clock clock(TrackingProperties properties) {
        return Clock.system(ZoneId.of(properties.getEngine().getZoneId()));
    }

    /**
     * Backs the engine's one-shot timers (stop timeout, dwell, backoff, schedule boundaries).
     */
    @Bean
    public ThreadPoolTaskScheduler trackingTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("tracking-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    /**
     * Retention pruning. One worker and a queue of one: a prune requested while
     * another is queued is redundant and gets dropped.
     */
    @Bean
    public ThreadPoolTaskExecutor pruneExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix("tracking-prune-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.DiscardPolicy());
        executor.initialize();
        return executor;
    }
}
