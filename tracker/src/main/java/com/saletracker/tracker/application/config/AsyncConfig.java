package com.saletracker.tracker.application.config;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for forced poll rounds and the startup catalog sync.
 *
 * <p>Rounds are long and mostly waiting on the store API, so the pool stays small; the queue
 * absorbs bursts of subscribe-triggered rounds. Running tasks are allowed to finish on shutdown.
 */
@Slf4j
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    @Override
    public Executor getAsyncExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(50);
        executor.setThreadNamePrefix("tracker-async-");
        executor.setRejectedExecutionHandler(discardOldestWithWarning());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /** Drops the oldest queued round to make room, logging what was dropped. */
    static RejectedExecutionHandler discardOldestWithWarning() {
        var discardOldest = new ThreadPoolExecutor.DiscardOldestPolicy();
        return (task, pool) -> {
            if (!pool.isShutdown()) {
                log.warn("Async queue full ({} queued, {} active), discarding the oldest queued round",
                        pool.getQueue().size(), pool.getActiveCount());
            }
            discardOldest.rejectedExecution(task, pool);
        };
    }
}
