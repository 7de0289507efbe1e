package com.eyelevel.extractionpipeline.service.worker;

import com.eyelevel.extractionpipeline.config.PipelineConfig;
import com.eyelevel.extractionpipeline.dto.worker.PoolStatus;
import com.eyelevel.extractionpipeline.exception.apiclient.BadRequestException;
import com.eyelevel.extractionpipeline.exception.apiclient.ConflictException;
import com.eyelevel.extractionpipeline.service.queue.JobQueueService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Owns the set of {@link QueueWorker}s and resizes it on demand. Worker loops run on the
 * {@code workerTaskExecutor}; surplus workers are stopped gracefully and finish the job they hold.
 */
@Slf4j
@Component
public class WorkerPool {

    private final JobQueueService jobQueueService;
    private final JobProcessor jobProcessor;
    private final PipelineConfig pipelineConfig;
    private final AsyncTaskExecutor workerTaskExecutor;
    private final List<QueueWorker> workers = new ArrayList<>();

    private int desiredWorkers;
    private boolean running;
    private int sequence;

    public WorkerPool(JobQueueService jobQueueService, JobProcessor jobProcessor, PipelineConfig pipelineConfig,
                      @Qualifier("workerTaskExecutor") AsyncTaskExecutor workerTaskExecutor) {
        this.jobQueueService = jobQueueService;
        this.jobProcessor = jobProcessor;
        this.pipelineConfig = pipelineConfig;
        this.workerTaskExecutor = workerTaskExecutor;
        this.desiredWorkers = pipelineConfig.getWorker().getConcurrency();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (pipelineConfig.getWorker().isAutoStart()) {
            start();
        } else {
            log.info("Worker auto-start is disabled. Start the pool through the API.");
        }
    }

    public synchronized void start() {
        if (running) {
            log.warn("Worker pool is already running with {} worker(s).", workers.size());
            return;
        }
        running = true;
        addWorkers(desiredWorkers);
        log.info("Worker pool started with {} worker(s).", workers.size());
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        stopWorkers(new ArrayList<>(workers));
        workers.clear();
        log.info("Worker pool stopped.");
    }

    /**
     * Sets the pool size. When running, workers are added or the newest ones are stopped.
     */
    public synchronized void scaleTo(int size) {
        if (size < 0) {
            throw new BadRequestException("Worker count must not be negative.");
        }
        int limit = pipelineConfig.getWorker().getMaxConcurrency();
        if (size > limit) {
            throw new BadRequestException("Worker count must not exceed " + limit + ".");
        }
        int previous = desiredWorkers;
        desiredWorkers = size;
        if (!running) {
            log.info("Worker pool is stopped; desired size changed from {} to {}.", previous, size);
            return;
        }
        if (size > workers.size()) {
            addWorkers(size - workers.size());
        } else if (size < workers.size()) {
            List<QueueWorker> surplus = new ArrayList<>(workers.subList(size, workers.size()));
            workers.removeAll(surplus);
            stopWorkers(surplus);
        }
        log.info("Worker pool scaled from {} to {} worker(s).", previous, workers.size());
    }

    public synchronized PoolStatus poolStatus() {
        return new PoolStatus(desiredWorkers, running, workers.stream().map(QueueWorker::status).toList());
    }

    private void addWorkers(int count) {
        PipelineConfig.Worker config = pipelineConfig.getWorker();
        Duration timeout = Duration.ofSeconds(pipelineConfig.getQueue().getDequeueTimeoutSeconds());
        for (int i = 0; i < count; i++) {
            QueueWorker worker = new QueueWorker("queue-worker-" + (++sequence), jobQueueService, jobProcessor,
                                                 timeout, config.getErrorBackoffMs());
            try {
                worker.start(workerTaskExecutor);
            } catch (TaskRejectedException e) {
                log.error("No thread available for worker {}; {} worker(s) running.", worker.getWorkerId(),
                          workers.size(), e);
                throw new ConflictException("No worker thread is free; wait for stopping workers to finish.");
            }
            workers.add(worker);
        }
    }

    private void stopWorkers(List<QueueWorker> toStop) {
        toStop.forEach(QueueWorker::requestStop);
        Duration timeout = Duration.ofSeconds(pipelineConfig.getWorker().getStopTimeoutSeconds());
        for (QueueWorker worker : toStop) {
            worker.stop(timeout);
        }
    }
}
