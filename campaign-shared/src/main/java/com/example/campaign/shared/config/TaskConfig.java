package com.example.campaign.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class TaskConfig {

    /**
     * Thread pool for @Scheduled methods. Sized so the scheduler, retry, poll and
     * cleanup sweeps never wait on each other.
     */
    @Bean
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("scheduler-");
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Blocking JDBC work issued from WebFlux handlers is shifted onto this pool.
     */
    @Bean
    public Scheduler jdbcScheduler() {
        return Schedulers.newParallel("jdbc-io-", 10);
    }
}
