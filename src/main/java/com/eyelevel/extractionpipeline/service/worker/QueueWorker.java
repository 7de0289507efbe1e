package com.eyelevel.extractionpipeline.service.worker;

import com.eyelevel.extractionpipeline.dto.worker.WorkerStatus;
import com.eyelevel.extractionpipeline.model.Job;
import com.eyelevel.extractionpipeline.model.JobStatus;
import com.eyelevel.extractionpipeline.service.queue.JobQueueService;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.task.AsyncTaskExecutor;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A single execution unit that pulls jobs from the queue and runs them through a {@link JobProcessor}.
 *
 * <p>Shutdown is cooperative: {@link #requestStop()} clears a flag that is checked at the top of every
 * iteration, before blocking on the queue. A job that has already been dequeued is always finished.
 * The loop runs as a task on the executor handed to {@link #start(AsyncTaskExecutor)}.
 */
@Slf4j
public class QueueWorker implements Runnable {

    static final String FAILURE_PREFIX = "Processing failed: ";

    @Getter
    private final String workerId;
    private final JobQueueService jobQueueService;
    private final JobProcessor jobProcessor;
    private final Duration dequeueTimeout;
    private final long errorBackoffMs;

    private final AtomicLong processedCount = new AtomicLong();
    private final AtomicLong failedCount = new AtomicLong();
    private volatile boolean running;
    private volatile String currentJobId;
    private Future<?> task;

    public QueueWorker(String workerId, JobQueueService jobQueueService, JobProcessor jobProcessor,
                       Duration dequeueTimeout, long errorBackoffMs) {
        this.workerId = workerId;
        this.jobQueueService = jobQueueService;
        this.jobProcessor = jobProcessor;
        this.dequeueTimeout = dequeueTimeout;
        this.errorBackoffMs = errorBackoffMs;
    }

    /**
     * Submits the worker loop to {@code executor}.
     *
     * @throws org.springframework.core.task.TaskRejectedException if the executor has no free thread.
     */
    public synchronized void start(AsyncTaskExecutor executor) {
        if (running) {
            return;
        }
        running = true;
        try {
            task = executor.submit(this);
        } catch (RuntimeException e) {
            running = false;
            throw e;
        }
        log.info("Worker {} started.", workerId);
    }

    /**
     * Asks the worker to exit after its current iteration.
     */
    public void requestStop() {
        running = false;
    }

    /**
     * Requests a stop and waits up to {@code timeout} for the worker loop to exit.
     *
     * @return {@code true} if the loop has finished.
     */
    public boolean stop(Duration timeout) {
        requestStop();
        Future<?> pending;
        synchronized (this) {
            pending = task;
        }
        if (pending == null) {
            return true;
        }
        try {
            pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return pending.isDone();
        } catch (ExecutionException e) {
            log.error("Worker {} terminated abnormally.", workerId, e.getCause());
        } catch (TimeoutException e) {
            log.warn("Worker {} did not stop within {}s; current job: {}.", workerId, timeout.toSeconds(),
                     currentJobId);
            return false;
        }
        log.info("Worker {} stopped.", workerId);
        return true;
    }

    @Override
    public void run() {
        try {
            while (running) {
                try {
                    runOnce();
                } catch (Exception e) {
                    log.error("Worker {} hit an unexpected error. Pausing for {} ms.", workerId, errorBackoffMs, e);
                    if (!pause()) {
                        break;
                    }
                }
            }
        } finally {
            running = false;
            currentJobId = null;
        }
    }

    /**
     * Runs one iteration: waits for a job and, if one arrives, claims and processes it.
     *
     * @return {@code true} if a job was dequeued.
     */
    boolean runOnce() {
        Optional<Job> next = jobQueueService.dequeue(dequeueTimeout);
        if (next.isEmpty()) {
            return false;
        }
        handle(next.get());
        return true;
    }

    private void handle(Job job) {
        String jobId = job.getId();
        if (!jobQueueService.updateStatus(jobId, JobStatus.PROCESSING, null)) {
            log.info("Worker {} skipped job {}: it was cancelled or claimed elsewhere.", workerId, jobId);
            return;
        }
        currentJobId = jobId;
        log.info("Worker {} processing job {} (file '{}').", workerId, jobId, job.getFileReference());
        try {
            Map<String, Object> result = jobProcessor.process(job,
                    (percent, message) -> jobQueueService.updateProgress(jobId, percent, message));
            jobQueueService.setResult(jobId, result);
            jobQueueService.updateStatus(jobId, JobStatus.COMPLETED, null);
            processedCount.incrementAndGet();
            log.info("Worker {} completed job {}.", workerId, jobId);
        } catch (VirtualMachineError e) {
            fail(jobId, e);
            throw e;
        } catch (Throwable e) {
            fail(jobId, e);
        } finally {
            currentJobId = null;
        }
    }

    private void fail(String jobId, Throwable cause) {
        log.error("Worker {} failed job {}.", workerId, jobId, cause);
        failedCount.incrementAndGet();
        String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        jobQueueService.updateStatus(jobId, JobStatus.FAILED, FAILURE_PREFIX + reason);
    }

    private boolean pause() {
        try {
            TimeUnit.MILLISECONDS.sleep(errorBackoffMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public boolean isRunning() {
        return running;
    }

    public synchronized boolean isAlive() {
        return task != null && !task.isDone();
    }

    public WorkerStatus status() {
        return new WorkerStatus(workerId, running, currentJobId, isAlive(), processedCount.get(),
                                failedCount.get());
    }
}
