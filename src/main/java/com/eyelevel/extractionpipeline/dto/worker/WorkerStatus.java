package com.eyelevel.extractionpipeline.dto.worker;

/**
 * @param workerId       Stable identifier of the worker within the pool.
 * @param running        Whether the worker has been started and not asked to stop.
 * @param currentJobId   The job being processed, or {@code null} when idle.
 * @param alive          Whether the worker thread is still alive.
 * @param processedCount Jobs completed successfully.
 * @param failedCount    Jobs that ended in FAILED.
 */
public record WorkerStatus(String workerId, boolean running, String currentJobId, boolean alive,
                           long processedCount, long failedCount) {
}
