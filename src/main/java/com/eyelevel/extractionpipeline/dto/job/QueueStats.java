package com.eyelevel.extractionpipeline.dto.job;

import com.eyelevel.extractionpipeline.model.JobStatus;

import java.util.Map;

/**
 * A snapshot of the job queue.
 *
 * @param queueLength    Number of ids waiting in the pending list.
 * @param totalJobs      Number of live job records.
 * @param countsByStatus Live job records per status; every status is present.
 */
public record QueueStats(long queueLength, long totalJobs, Map<JobStatus, Long> countsByStatus) {
}
