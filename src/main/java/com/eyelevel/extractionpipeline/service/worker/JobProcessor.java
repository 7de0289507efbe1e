package com.eyelevel.extractionpipeline.service.worker;

import com.eyelevel.extractionpipeline.model.Job;

import java.util.Map;

/**
 * The unit of work a {@link QueueWorker} runs for each claimed job. Any exception marks the job failed.
 */
@FunctionalInterface
public interface JobProcessor {

    /**
     * @return the opaque result stored on the job.
     */
    Map<String, Object> process(Job job, ProgressListener progressListener) throws Exception;
}
