package com.eyelevel.extractionpipeline.model;

import lombok.Data;

import java.nio.file.Path;
import java.time.LocalDateTime;

/**
 * Mutable state of one export. Instances live inside
 * {@link com.eyelevel.extractionpipeline.service.export.ExportJobRegistry} and are only mutated while
 * holding its lock; everything else works on copies.
 */
@Data
public class ExportJob {
    private String jobId;
    private String sessionId;
    private String filename;
    private ExportStatus status = ExportStatus.PENDING;
    private LocalDateTime createdAt;
    private LocalDateTime completedAt;
    private int totalRecords;
    private int processedRecords;
    private Path artifactPath;
    private Path compressedPath;
    private String downloadToken;
    private CompressionType compressionType = CompressionType.NONE;
    private long sizeBytes;
    private long compressedSizeBytes;
    private String errorMessage;

    public ExportJob copy() {
        ExportJob copy = new ExportJob();
        copy.setJobId(jobId);
        copy.setSessionId(sessionId);
        copy.setFilename(filename);
        copy.setStatus(status);
        copy.setCreatedAt(createdAt);
        copy.setCompletedAt(completedAt);
        copy.setTotalRecords(totalRecords);
        copy.setProcessedRecords(processedRecords);
        copy.setArtifactPath(artifactPath);
        copy.setCompressedPath(compressedPath);
        copy.setDownloadToken(downloadToken);
        copy.setCompressionType(compressionType);
        copy.setSizeBytes(sizeBytes);
        copy.setCompressedSizeBytes(compressedSizeBytes);
        copy.setErrorMessage(errorMessage);
        return copy;
    }

    public double getProgressPercentage() {
        if (totalRecords <= 0) {
            return status == ExportStatus.COMPLETED ? 100.0 : 0.0;
        }
        return Math.round(processedRecords * 1000.0 / totalRecords) / 10.0;
    }

    /**
     * Percentage saved by compression, 0 when the artifact is not compressed.
     */
    public double getCompressionRatio() {
        if (compressionType == CompressionType.NONE || sizeBytes <= 0 || compressedSizeBytes <= 0) {
            return 0.0;
        }
        return Math.round((1.0 - (double) compressedSizeBytes / sizeBytes) * 1000.0) / 10.0;
    }

    /**
     * @return the compressed artifact when one exists, otherwise the raw CSV.
     */
    public Path getFinalArtifactPath() {
        return compressedPath != null ? compressedPath : artifactPath;
    }
}
