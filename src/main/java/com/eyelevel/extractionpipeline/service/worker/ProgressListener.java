package com.eyelevel.extractionpipeline.service.worker;

/**
 * Receives progress reports from a running {@link JobProcessor}.
 */
@FunctionalInterface
public interface ProgressListener {

    /**
     * @param percent Completion in [0, 100]; out of range values are clamped.
     * @param message Optional human-readable stage description.
     */
    void onProgress(int percent, String message);
}
