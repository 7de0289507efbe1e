package com.eyelevel.extractionpipeline.scheduler;

import com.eyelevel.extractionpipeline.config.PipelineConfig;
import com.eyelevel.extractionpipeline.service.queue.JobQueueService;
import com.eyelevel.extractionpipeline.service.session.SessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Applies the retention windows of sessions and job records. The two windows are independent: a
 * session normally outlives the jobs that processed it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RetentionScheduler {

    private final SessionService sessionService;
    private final JobQueueService jobQueueService;
    private final PipelineConfig pipelineConfig;

    @Scheduled(cron = "${app.scheduler.session-retention:0 30 2 * * *}")
    public void purgeOldSessions() {
        int retentionDays = pipelineConfig.getSession().getRetentionDays();
        log.info("Running session retention sweep for sessions older than {} day(s).", retentionDays);
        int removed = sessionService.cleanupOlderThan(retentionDays);
        if (removed == 0) {
            log.info("No sessions past retention.");
            return;
        }
        log.warn("Removed {} session(s) past the {}-day retention window.", removed, retentionDays);
    }

    /**
     * Job hashes carry a TTL already; this sweep removes records whose TTL was lost or extended.
     */
    @Scheduled(cron = "${app.scheduler.job-retention:0 0 * * * *}")
    public void purgeOldJobs() {
        long retentionHours = pipelineConfig.getQueue().getRetentionHours();
        int removed = jobQueueService.cleanupOlderThan(Duration.ofHours(retentionHours));
        log.info("Job retention sweep removed {} record(s) older than {}h.", removed, retentionHours);
    }
}
