package com.example.taskboard.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class TaskConfig {

    /**
     * Customizes the thread pool for @Scheduled methods.
     */
    @Bean
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("scheduler-");
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Identity verification and membership lookups may block on I/O, so they are
     * kept off the Netty event loop.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler collaboratorScheduler() {
        int threadCap = 50;
        int queuedTaskCap = 10000;
        return Schedulers.newBoundedElastic(threadCap, queuedTaskCap, "collaborator-io-");
    }
}
