package com.kolsignal.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class AsyncConfig {

    @Bean(name = "evaluationExecutor")
    public Executor evaluationExecutor(PipelineProperties pipelineProperties) {
        return threadPool(pipelineProperties.getEvaluationExecutor(), "evaluation-");
    }

    @Bean(name = "fetchExecutor")
    public Executor fetchExecutor(PipelineProperties pipelineProperties) {
        return threadPool(pipelineProperties.getFetchExecutor(), "fetch-");
    }

    @Bean(name = "fetchTimeoutScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService fetchTimeoutScheduler() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newScheduledThreadPool(2, runnable -> {
            Thread thread = new Thread(runnable, "fetch-timeout-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    private static ThreadPoolTaskExecutor threadPool(PipelineProperties.ExecutorPool pool, String threadNamePrefix) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(pool.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(pool.getCorePoolSize(), pool.getMaxPoolSize()));
        executor.setQueueCapacity(pool.getQueueCapacity());
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.setWaitForTasksToCompleteOnShutdown(pool.getAwaitTerminationSeconds() > 0);
        executor.setAwaitTerminationSeconds(pool.getAwaitTerminationSeconds());
        executor.initialize();
        return executor;
    }
}
