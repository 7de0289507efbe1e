package com.eyelevel.extractionpipeline.dto.export;

import com.eyelevel.extractionpipeline.model.CompressionType;
import com.eyelevel.extractionpipeline.model.ExportJob;
import com.eyelevel.extractionpipeline.model.ExportStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.LocalDateTime;

/**
 * Client view of an export job. File system paths are not exposed.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExportJobResponse(String jobId,
                                String sessionId,
                                String filename,
                                ExportStatus status,
                                LocalDateTime createdAt,
                                LocalDateTime completedAt,
                                int totalRecords,
                                int processedRecords,
                                double progressPercentage,
                                CompressionType compressionType,
                                long sizeBytes,
                                long compressedSizeBytes,
                                double compressionRatio,
                                boolean downloadAvailable,
                                String errorMessage) {

    public static ExportJobResponse from(ExportJob job) {
        return ExportJobResponse.builder()
                                .jobId(job.getJobId())
                                .sessionId(job.getSessionId())
                                .filename(job.getFilename())
                                .status(job.getStatus())
                                .createdAt(job.getCreatedAt())
                                .completedAt(job.getCompletedAt())
                                .totalRecords(job.getTotalRecords())
                                .processedRecords(job.getProcessedRecords())
                                .progressPercentage(job.getProgressPercentage())
                                .compressionType(job.getCompressionType())
                                .sizeBytes(job.getSizeBytes())
                                .compressedSizeBytes(job.getCompressedSizeBytes())
                                .compressionRatio(job.getCompressionRatio())
                                .downloadAvailable(job.getDownloadToken() != null)
                                .errorMessage(job.getErrorMessage())
                                .build();
    }
}
