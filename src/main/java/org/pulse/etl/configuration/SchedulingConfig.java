package org.pulse.etl.configuration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class SchedulingConfig {

    public static final String EXTRACTION_EXECUTOR = "extractionExecutor";
    public static final String EVENT_EXECUTOR = "jobEventExecutor";

    @Bean
    public ThreadPoolTaskScheduler etlTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("etl-scheduler-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    // one thread: extractions never overlap inside this process
    @Bean(name = EXTRACTION_EXECUTOR)
    public ThreadPoolTaskExecutor extractionExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(4);
        executor.setThreadNamePrefix("etl-extract-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Bean(name = EVENT_EXECUTOR)
    public ThreadPoolTaskExecutor jobEventExecutor(EtlProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(properties.getEvents().getQueueCapacity());
        executor.setThreadNamePrefix("etl-events-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.DiscardOldestPolicy());
        return executor;
    }
}
