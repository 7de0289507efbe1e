package com.eyelevel.extractionpipeline.model;

import lombok.Getter;

import java.nio.file.Path;
import java.time.LocalDateTime;

/**
 * A secure, expiring, count-limited handle to an export artifact. The download counter is only
 * changed through {@link #tryConsume(LocalDateTime)}.
 */
@Getter
public class DownloadLink {

    private final String token;
    private final Path artifactPath;
    private final LocalDateTime createdTime;
    private final LocalDateTime expiryTime;
    private final int maxDownloads;
    private final long fileSize;
    private int downloadCount;

    public DownloadLink(String token, Path artifactPath, LocalDateTime createdTime, LocalDateTime expiryTime,
                        int maxDownloads, long fileSize) {
        this.token = token;
        this.artifactPath = artifactPath;
        this.createdTime = createdTime;
        this.expiryTime = expiryTime;
        this.maxDownloads = maxDownloads;
        this.fileSize = fileSize;
    }

    public boolean isExpired(LocalDateTime now) {
        return !now.isBefore(expiryTime);
    }

    public synchronized int getDownloadCount() {
        return downloadCount;
    }

    /**
     * Validates the link against the clock, the download cap and the file system, and records one
     * use when all checks pass.
     *
     * @return {@code null} when the download is authorized, otherwise the reason for refusal.
     */
    public synchronized DownloadDenialReason tryConsume(LocalDateTime now) {
        if (isExpired(now)) {
            return DownloadDenialReason.EXPIRED;
        }
        if (downloadCount >= maxDownloads) {
            return DownloadDenialReason.LIMIT_EXCEEDED;
        }
        if (artifactPath == null || !artifactPath.toFile().isFile()) {
            return DownloadDenialReason.FILE_MISSING;
        }
        downloadCount++;
        return null;
    }
}
