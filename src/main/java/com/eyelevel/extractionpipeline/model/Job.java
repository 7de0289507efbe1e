package com.eyelevel.extractionpipeline.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * An immutable snapshot of a queued job as read from the job store. Status changes go through
 * {@link com.eyelevel.extractionpipeline.service.queue.JobQueueService}, never through this object.
 */
@Value
@Builder(toBuilder = true)
public class Job {
    String id;
    String fileReference;
    String sessionId;
    Map<String, Object> config;
    JobStatus status;
    LocalDateTime createdAt;
    LocalDateTime startedAt;
    LocalDateTime completedAt;
    int progress;
    String progressMessage;
    String errorMessage;
    Map<String, Object> result;
}
