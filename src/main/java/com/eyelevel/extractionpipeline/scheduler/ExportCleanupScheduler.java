package com.eyelevel.extractionpipeline.scheduler;

import com.eyelevel.extractionpipeline.service.export.ExportService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically purges expired exports, their files and their download links.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExportCleanupScheduler {

    private final ExportService exportService;

    @Scheduled(fixedDelayString = "${app.scheduler.export-cleanup-interval-ms:21600000}",
            initialDelayString = "${app.scheduler.export-cleanup-interval-ms:21600000}")
    public void purgeExpiredExports() {
        log.info("Running export cleanup.");
        try {
            int removed = exportService.cleanupExpired();
            log.info("Finished export cleanup. Removed {} export job(s).", removed);
        } catch (RuntimeException e) {
            log.error("Export cleanup failed. It will run again at the next interval.", e);
        }
    }
}
