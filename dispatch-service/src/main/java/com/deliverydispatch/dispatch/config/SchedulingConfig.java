package com.deliverydispatch.dispatch.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduler for the liveness sweep, presence grace timers and queue purge.
 * Declared explicitly because the WebSocket support registers a scheduler of its own,
 * which would otherwise stop Boot from creating one.
 */
@Configuration
public class SchedulingConfig {

    @Bean
    @Primary
    public ThreadPoolTaskScheduler taskScheduler(@Value("${spring.task.scheduling.pool.size:4}") int poolSize) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("dispatch-sched-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }
}
