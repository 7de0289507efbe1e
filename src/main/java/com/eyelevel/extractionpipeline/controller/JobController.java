package com.eyelevel.extractionpipeline.controller;

import com.eyelevel.extractionpipeline.dto.common.ApiResponse;
import com.eyelevel.extractionpipeline.dto.job.EnqueueJobRequest;
import com.eyelevel.extractionpipeline.dto.job.EnqueueJobResponse;
import com.eyelevel.extractionpipeline.dto.job.QueueStats;
import com.eyelevel.extractionpipeline.dto.worker.PoolStatus;
import com.eyelevel.extractionpipeline.exception.apiclient.ConflictException;
import com.eyelevel.extractionpipeline.exception.apiclient.NotFoundException;
import com.eyelevel.extractionpipeline.model.Job;
import com.eyelevel.extractionpipeline.service.queue.JobQueueService;
import com.eyelevel.extractionpipeline.service.worker.WorkerPool;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for the job queue and the worker pool.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/jobs")
@RequiredArgsConstructor
@Validated
public class JobController implements JobApi {

    private final JobQueueService jobQueueService;
    private final WorkerPool workerPool;

    @Override
    @PostMapping
    public ResponseEntity<ApiResponse<EnqueueJobResponse>> enqueue(@Valid @RequestBody final EnqueueJobRequest request) {
        log.info("Enqueue request for file '{}' in session {}", request.getFileReference(), request.getSessionId());
        String jobId = jobQueueService.enqueue(request.getFileReference(), request.getSessionId(), request.getConfig());
        return ResponseEntity.ok(ApiResponse.ok(new EnqueueJobResponse(jobId), "Job queued successfully."));
    }

    @Override
    @GetMapping("/{jobId}")
    public ResponseEntity<ApiResponse<Job>> getJob(@PathVariable("jobId") final String jobId) {
        Job job = jobQueueService.get(jobId).orElseThrow(() -> new NotFoundException("Job not found: " + jobId));
        return ResponseEntity.ok(ApiResponse.ok(job, "Job retrieved successfully."));
    }

    @Override
    @DeleteMapping("/{jobId}")
    public ResponseEntity<ApiResponse<Void>> cancel(@PathVariable("jobId") final String jobId) {
        log.info("Cancel request for job {}", jobId);
        if (jobQueueService.cancel(jobId)) {
            return ResponseEntity.ok(ApiResponse.ok(null, "Job cancelled."));
        }
        Job job = jobQueueService.get(jobId).orElseThrow(() -> new NotFoundException("Job not found: " + jobId));
        throw new ConflictException("Job " + jobId + " cannot be cancelled in state '" + job.getStatus().value() + "'.");
    }

    @Override
    @GetMapping
    public ResponseEntity<ApiResponse<List<Job>>> listBySession(
            @RequestParam("sessionId") @NotBlank(message = "The 'sessionId' parameter cannot be empty.") final String sessionId) {
        return ResponseEntity.ok(ApiResponse.ok(jobQueueService.findBySession(sessionId), "Jobs retrieved successfully."));
    }

    @Override
    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<QueueStats>> stats() {
        return ResponseEntity.ok(ApiResponse.ok(jobQueueService.stats(), "Queue statistics retrieved successfully."));
    }

    @Override
    @GetMapping("/workers")
    public ResponseEntity<ApiResponse<PoolStatus>> poolStatus() {
        return ResponseEntity.ok(ApiResponse.ok(workerPool.poolStatus(), "Worker pool status retrieved successfully."));
    }

    @Override
    @PostMapping("/workers/start")
    public ResponseEntity<ApiResponse<PoolStatus>> startWorkers() {
        log.info("Request received to start the worker pool.");
        workerPool.start();
        return ResponseEntity.ok(ApiResponse.ok(workerPool.poolStatus(), "Worker pool started."));
    }

    @Override
    @PostMapping("/workers/stop")
    public ResponseEntity<ApiResponse<PoolStatus>> stopWorkers() {
        log.info("Request received to stop the worker pool.");
        workerPool.stop();
        return ResponseEntity.ok(ApiResponse.ok(workerPool.poolStatus(), "Worker pool stopped."));
    }

    @Override
    @PutMapping("/workers")
    public ResponseEntity<ApiResponse<PoolStatus>> scaleWorkers(
            @RequestParam("size") @Min(value = 0, message = "The 'size' must not be negative.") final int size) {
        log.info("Request received to scale the worker pool to {}.", size);
        workerPool.scaleTo(size);
        return ResponseEntity.ok(ApiResponse.ok(workerPool.poolStatus(), "Worker pool scaled."));
    }
}
