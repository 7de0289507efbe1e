package com.eyelevel.extractionpipeline.dto.worker;

import java.util.List;

/**
 * @param desiredWorkers Target pool size.
 * @param running        Whether the pool has been started.
 * @param workers        Status of every worker currently owned by the pool.
 */
public record PoolStatus(int desiredWorkers, boolean running, List<WorkerStatus> workers) {
}
