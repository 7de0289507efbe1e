package com.eyelevel.extractionpipeline.exception;

import java.io.Serial;

/**
 * A base exception for errors that occur while queueing, processing or exporting documents.
 */
public class PipelineException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 4656352395708234308L;

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
