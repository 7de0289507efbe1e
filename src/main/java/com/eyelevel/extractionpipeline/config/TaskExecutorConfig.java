package com.eyelevel.extractionpipeline.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configures the managed thread pools for background work: one runs the job queue workers, the other
 * runs export jobs requested in asynchronous mode.
 */
@Configuration
public class TaskExecutorConfig {

    /**
     * Creates the thread pool that hosts the queue worker loops. Each worker holds one thread for its
     * whole life, so the pool has no queue and is sized for the largest allowed worker count.
     *
     * @param pipelineConfig Worker limits and the stop timeout.
     * @return A configured AsyncTaskExecutor bean.
     */
    @Bean("workerTaskExecutor")
    public AsyncTaskExecutor workerTaskExecutor(final PipelineConfig pipelineConfig) {
        PipelineConfig.Worker worker = pipelineConfig.getWorker();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(worker.getMaxConcurrency());
        executor.setMaxPoolSize(worker.getMaxConcurrency());
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("queue-worker-task-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) worker.getStopTimeoutSeconds());
        executor.initialize();
        return executor;
    }

    /**
     * Creates the thread pool for background export generation.
     *
     * @param poolSize Number of exports that may be generated concurrently.
     * @return A configured AsyncTaskExecutor bean.
     */
    @Bean("exportTaskExecutor")
    public AsyncTaskExecutor exportTaskExecutor(@Value("${app.pipeline.export.pool-size:4}") final int poolSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setThreadNamePrefix("export-task-");
        // Let in-flight exports finish writing before the context closes.
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
