package com.tradesim.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools for session workers and feed reconnects.
 *
 * <p>Each active session holds one worker thread for its lifetime, so the session pool has
 * no queue: a create that finds the pool exhausted fails fast instead of silently waiting.
 */
@Configuration
public class SessionExecutorConfig {

    @Value("${tradesim.executor.max-sessions:256}")
    private int maxSessions;

    @Value("${tradesim.executor.feed-scheduler-threads:2}")
    private int feedSchedulerThreads;

    @Bean("sessionExecutor")
    public ThreadPoolTaskExecutor sessionExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(0);
        executor.setMaxPoolSize(maxSessions);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("session-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }

    @Bean("feedScheduler")
    public ThreadPoolTaskScheduler feedScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(feedSchedulerThreads);
        scheduler.setThreadNamePrefix("feed-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }
}
