package com.strategyvault.config;

import com.strategyvault.util.CurrentUserContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for asynchronous event persistence.
 *
 * 1. Dedicated thread pool, isolated from request threads holding the vault guard
 * 2. Drops tasks on overflow rather than blocking the caller
 * 3. TaskDecorator propagates the caller's user id to the executor thread
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncPersistenceConfig {

    private static final int QUEUE_CAPACITY = 1000;

    @Bean(name = "persistenceExecutor")
    public Executor persistenceExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(QUEUE_CAPACITY);
        executor.setThreadNamePrefix("persist-");
        executor.setTaskDecorator(new UserContextPropagatingTaskDecorator());
        executor.setRejectedExecutionHandler(new DropOnOverflowHandler());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Persistence executor initialized: core={}, max={}, queue={} (drops on overflow)",
                executor.getCorePoolSize(), executor.getMaxPoolSize(), QUEUE_CAPACITY);
        return executor;
    }

    /**
     * Captures the user id at submission time and restores it in the executor thread.
     * Clears it afterwards so pooled threads do not leak context.
     */
    private static class UserContextPropagatingTaskDecorator implements TaskDecorator {
        @Override
        public Runnable decorate(Runnable runnable) {
            String capturedUserId = CurrentUserContext.getUserId();

            return () -> {
                String previousUserId = CurrentUserContext.getUserId();
                try {
                    if (capturedUserId != null && !capturedUserId.isBlank()) {
                        CurrentUserContext.setUserId(capturedUserId);
                    }
                    runnable.run();
                } finally {
                    if (previousUserId != null && !previousUserId.isBlank()) {
                        CurrentUserContext.setUserId(previousUserId);
                    } else {
                        CurrentUserContext.clear();
                    }
                }
            };
        }
    }

    private static class DropOnOverflowHandler implements RejectedExecutionHandler {
        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            log.warn("Event persistence task dropped - queue full ({}/{})", executor.getQueue().size(), QUEUE_CAPACITY);
        }
    }
}
