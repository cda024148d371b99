package com.example.hostwatch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Scheduler for the monitoring loop.
 * A single thread: metric ticks and service-health ticks never run concurrently,
 * so per-kind alert state is only ever touched from this thread.
 */
@Configuration
public class SchedulingConfig {

    @Bean(name = "monitorTaskScheduler")
    public ThreadPoolTaskScheduler monitorTaskScheduler(MonitorProperties properties, Clock clock) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("monitor-");
        scheduler.setClock(clock);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(properties.getScheduler().getShutdownTimeoutSeconds());
        scheduler.initialize();
        return scheduler;
    }
}
