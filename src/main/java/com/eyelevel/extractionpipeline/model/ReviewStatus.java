package com.eyelevel.extractionpipeline.model;

/**
 * Review state of an extracted record.
 */
public enum ReviewStatus {
    PENDING,
    REVIEWED
}
