package com.eyelevel.extractionpipeline.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Why a download token was refused.
 */
@Getter
@RequiredArgsConstructor
public enum DownloadDenialReason {
    INVALID_TOKEN("Invalid download token"),
    EXPIRED("Download link has expired"),
    LIMIT_EXCEEDED("Download limit exceeded"),
    FILE_MISSING("File no longer available");

    private final String message;
}
