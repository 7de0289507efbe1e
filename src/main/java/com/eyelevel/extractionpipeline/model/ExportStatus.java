package com.eyelevel.extractionpipeline.model;

/**
 * Lifecycle of an export job. {@link #CANCELLED} is reachable from {@link #PENDING} and
 * {@link #PROCESSING} only.
 */
public enum ExportStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
