package com.example.strategicpawns.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Timer infrastructure. Session cleanup, the expiry sweep and the matchmaking
 * tick share {@code gameTaskScheduler}; computer opponents think on their own
 * pool so a slow move never delays a cleanup.
 */
@Configuration
public class SchedulingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean("gameTaskScheduler")
    public ThreadPoolTaskScheduler gameTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("game-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean(name = "aiScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService aiScheduler() {
        int poolSize = Math.max(2, Runtime.getRuntime().availableProcessors() / 2);
        ScheduledThreadPoolExecutor exec = new ScheduledThreadPoolExecutor(poolSize, new ThreadFactory() {
            private final AtomicInteger idx = new AtomicInteger(1);

            @Override
            public Thread newThread(Runnable r) {
                Thread t = new Thread(r, "ai-move-" + idx.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        });
        exec.setRemoveOnCancelPolicy(true);
        return exec;
    }
}
