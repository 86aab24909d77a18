package com.example.incidentengine.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduler pool for the background loops. Correlation, escalation and the
 * approval sweep each get their own thread so a slow escalation tick never
 * delays a correlation pass.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(3);
        scheduler.setThreadNamePrefix("engine-tick-");
        scheduler.initialize();
        return scheduler;
    }
}
