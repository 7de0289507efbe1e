package com.eyelevel.extractionpipeline.dto.export;

import com.eyelevel.extractionpipeline.model.CompressionType;

import java.time.LocalDateTime;

/**
 * Everything a client needs to fetch a completed export.
 */
public record DownloadInfo(String jobId, String downloadUrl, String token, String filename, long sizeBytes,
                           CompressionType compressionType, double compressionRatio, LocalDateTime expiresAt,
                           int remainingDownloads) {
}
