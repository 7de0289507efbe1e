package com.eyelevel.extractionpipeline.model;

import java.util.Arrays;

/**
 * Defines the lifecycle of a queued job. {@link #PENDING} is the initial state, the remaining three
 * are terminal. Every non-initial state has exactly one legal predecessor.
 */
public enum JobStatus {
    /**
     * Admitted and waiting in the queue.
     */
    PENDING("pending"),
    /**
     * Claimed by exactly one worker.
     */
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed"),
    /**
     * Withdrawn before any worker claimed it.
     */
    CANCELLED("cancelled");

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    /**
     * @return the lowercase form stored in the job hash.
     */
    public String value() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Returns the only status a job may hold immediately before entering this one, or {@code null}
     * for the initial state.
     */
    public JobStatus predecessor() {
        return switch (this) {
            case PENDING -> null;
            case PROCESSING, CANCELLED -> PENDING;
            case COMPLETED, FAILED -> PROCESSING;
        };
    }

    public static JobStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown job status: " + value));
    }
}
