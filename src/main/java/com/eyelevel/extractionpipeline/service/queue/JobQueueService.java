package com.eyelevel.extractionpipeline.service.queue;

import com.eyelevel.extractionpipeline.config.PipelineConfig;
import com.eyelevel.extractionpipeline.dto.job.QueueStats;
import com.eyelevel.extractionpipeline.exception.apiclient.BadRequestException;
import com.eyelevel.extractionpipeline.model.Job;
import com.eyelevel.extractionpipeline.model.JobStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Admits, dispatches and tracks document processing jobs.
 *
 * <p>Every status change is a guarded compare-and-set against the stored status: a transition is only
 * written when the job currently holds the single legal predecessor of the target status. This makes the
 * claim ({@code PENDING -> PROCESSING}) succeed for exactly one caller and keeps terminal states final.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobQueueService {

    private final JobStore jobStore;
    private final JobHashMapper jobHashMapper;
    private final PipelineConfig pipelineConfig;

    /**
     * Validates and admits a new job, then pushes it onto the queue.
     *
     * @param fileReference Path or identifier of the uploaded file.
     * @param sessionId     The session the job belongs to.
     * @param config        Opaque processing options, may be {@code null}.
     *
     * @return the generated job id.
     *
     * @throws BadRequestException if the file reference or session id is blank.
     */
    public String enqueue(String fileReference, String sessionId, @Nullable Map<String, Object> config) {
        if (!StringUtils.hasText(fileReference)) {
            throw new BadRequestException("File reference must not be blank.");
        }
        if (!StringUtils.hasText(sessionId)) {
            throw new BadRequestException("Session id must not be blank.");
        }
        String jobId = UUID.randomUUID().toString();
        Job job = Job.builder()
                     .id(jobId)
                     .fileReference(fileReference)
                     .sessionId(sessionId)
                     .config(config != null ? new LinkedHashMap<>(config) : new LinkedHashMap<>())
                     .status(JobStatus.PENDING)
                     .createdAt(LocalDateTime.now())
                     .progress(0)
                     .result(new LinkedHashMap<>())
                     .build();
        jobStore.create(jobId, jobHashMapper.toFields(job), retention());
        log.info("Enqueued job {} for file '{}' in session {}.", jobId, fileReference, sessionId);
        return jobId;
    }

    /**
     * Waits up to {@code timeout} for the next pending job.
     *
     * @return the job, or empty on timeout or when the popped record has already expired.
     */
    public Optional<Job> dequeue(Duration timeout) {
        Optional<String> jobId = jobStore.popNext(timeout);
        if (jobId.isEmpty()) {
            return Optional.empty();
        }
        Optional<Job> job = get(jobId.get());
        if (job.isEmpty()) {
            log.warn("Dequeued job {} has no record; it expired before dispatch. Skipping.", jobId.get());
        }
        return job;
    }

    public Optional<Job> get(String jobId) {
        Map<String, String> fields = jobStore.findFields(jobId);
        if (fields.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(jobHashMapper.fromFields(fields));
    }

    /**
     * Moves a job to {@code status} if it currently holds that status' predecessor. Entering
     * {@code PROCESSING} stamps {@code started_at}; entering a terminal state stamps {@code completed_at}.
     *
     * @param errorMessage Stored with the transition when given.
     *
     * @return {@code true} when the transition was applied.
     */
    public boolean updateStatus(String jobId, JobStatus status, @Nullable String errorMessage) {
        JobStatus expected = status.predecessor();
        if (expected == null) {
            log.warn("Refusing to move job {} back to {}.", jobId, status);
            return false;
        }
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(JobHashMapper.STATUS, status.value());
        fields.put(JobHashMapper.WRITE_TOKEN, UUID.randomUUID().toString());
        String now = JobHashMapper.formatTime(LocalDateTime.now());
        if (status == JobStatus.PROCESSING) {
            fields.put(JobHashMapper.STARTED_AT, now);
        } else {
            fields.put(JobHashMapper.COMPLETED_AT, now);
        }
        if (status == JobStatus.COMPLETED) {
            fields.put(JobHashMapper.PROGRESS, "100");
        }
        if (errorMessage != null) {
            fields.put(JobHashMapper.ERROR_MESSAGE, errorMessage);
        }
        boolean applied = jobStore.updateFields(jobId, expected.value(), fields);
        if (applied) {
            log.info("Job {} moved to {}.", jobId, status);
        } else {
            log.warn("Job {} was not moved to {}: it is missing or not {}.", jobId, status, expected);
        }
        return applied;
    }

    /**
     * Records progress of a job that is being processed. Values are clamped to [0, 100].
     */
    public boolean updateProgress(String jobId, int percent, @Nullable String message) {
        int clamped = Math.max(0, Math.min(100, percent));
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(JobHashMapper.PROGRESS, String.valueOf(clamped));
        if (message != null) {
            fields.put(JobHashMapper.PROGRESS_MESSAGE, message);
        }
        boolean applied = jobStore.updateFields(jobId, JobStatus.PROCESSING.value(), fields);
        if (!applied) {
            log.debug("Ignored progress {}% for job {}: not processing.", clamped, jobId);
        }
        return applied;
    }

    public boolean setResult(String jobId, Map<String, Object> result) {
        return jobStore.updateFields(jobId, JobStatus.PROCESSING.value(),
                                     Map.of(JobHashMapper.RESULT, jobHashMapper.toJson(result)));
    }

    /**
     * Cancels a job that no worker has claimed yet and removes it from the pending list.
     *
     * @return {@code false} if the job is unknown, already claimed or already terminal.
     */
    public boolean cancel(String jobId) {
        if (!updateStatus(jobId, JobStatus.CANCELLED, null)) {
            return false;
        }
        jobStore.removeFromQueue(jobId);
        return true;
    }

    public QueueStats stats() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0L);
        }
        long total = 0;
        for (Job job : liveJobs()) {
            counts.merge(job.getStatus(), 1L, Long::sum);
            total++;
        }
        return new QueueStats(jobStore.queueLength(), total, counts);
    }

    /**
     * Deletes job records created before {@code now - age}, whatever their state.
     *
     * @return the number of records removed.
     */
    public int cleanupOlderThan(Duration age) {
        LocalDateTime cutoff = LocalDateTime.now().minus(age);
        int removed = 0;
        for (Job job : liveJobs()) {
            if (job.getCreatedAt() != null && job.getCreatedAt().isBefore(cutoff) && jobStore.delete(job.getId())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Removed {} job record(s) created before {}.", removed, cutoff);
        }
        return removed;
    }

    /**
     * @return the session's live jobs, oldest first.
     */
    public List<Job> findBySession(String sessionId) {
        return liveJobs().stream()
                         .filter(job -> sessionId.equals(job.getSessionId()))
                         .sorted(Comparator.comparing(Job::getCreatedAt,
                                                      Comparator.nullsLast(Comparator.naturalOrder())))
                         .toList();
    }

    private List<Job> liveJobs() {
        List<Job> jobs = new ArrayList<>();
        for (String jobId : jobStore.findAllJobIds()) {
            get(jobId).ifPresent(jobs::add);
        }
        return jobs;
    }

    private Duration retention() {
        return Duration.ofHours(pipelineConfig.getQueue().getRetentionHours());
    }
}
