package com.eyelevel.extractionpipeline.dto.export;

/**
 * Disk usage of the export area.
 */
public record StorageStats(long totalSizeBytes, double totalSizeMb, int fileCount, int activeJobs,
                           String baseDirectory) {
}
