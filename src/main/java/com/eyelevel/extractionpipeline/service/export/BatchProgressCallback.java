package com.eyelevel.extractionpipeline.service.export;

/**
 * Notified after each batch of rows has been flushed to the artifact.
 */
@FunctionalInterface
public interface BatchProgressCallback {

    void onBatchWritten(int processedRecords, int totalRecords);
}
