package com.example.inventorytasks.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pool for offloaded tasks, and a small separate pool for @Async
 * alert delivery so a slow webhook never holds up task execution.
 */
@Slf4j
@EnableAsync
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    @Bean(name = "taskWorkerExecutor", destroyMethod = "shutdown")
    public ExecutorService taskWorkerExecutor(InventoryTaskProperties properties) {
        var threads = properties.getExecutorPoolSize();
        log.info("Task worker pool: {} thread(s)", threads);
        return Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("task-worker-"));
    }

    @Bean(name = "alertExecutor")
    public ThreadPoolTaskExecutor alertExecutor() {
        var pool = new ThreadPoolTaskExecutor();
        pool.setThreadNamePrefix("alert-");
        pool.setCorePoolSize(1);
        pool.setMaxPoolSize(2);
        pool.setQueueCapacity(100);
        // a full queue slows the caller down rather than dropping the alert
        pool.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        pool.setWaitForTasksToCompleteOnShutdown(true);
        pool.setAwaitTerminationSeconds(15);
        return pool;
    }

    @Override
    public ThreadPoolTaskExecutor getAsyncExecutor() {
        return alertExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (error, method, params) ->
                log.error("Async call {}.{} failed: {}", method.getDeclaringClass().getSimpleName(), method.getName(), error.getMessage(), error);
    }
}
