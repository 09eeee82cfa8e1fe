package com.aigreentick.services.otprelay.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pool for chat command handling.
 *
 * commandTaskExecutor — used by TelegramUpdatePoller
 * ──────────────────────────────────────────────────
 * A /range call blocks on the allocation API for up to 20s, so commands
 * run off the polling thread. corePoolSize=4 / maxPoolSize=10 covers
 * a handful of users allocating at once; CallerRunsPolicy slows polling
 * down instead of dropping commands when the queue is full.
 */
@Configuration
@EnableScheduling
public class AsyncConfig {

    @Bean(name = "commandTaskExecutor")
    public ThreadPoolTaskExecutor commandTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(10);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("otp-command-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
