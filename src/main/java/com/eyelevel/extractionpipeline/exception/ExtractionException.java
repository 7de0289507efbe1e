package com.eyelevel.extractionpipeline.exception;

import java.io.Serial;

/**
 * Raised by a {@link com.eyelevel.extractionpipeline.service.extraction.DocumentExtractor} when a document
 * cannot be read or turned into records. The worker records the message on the failed job.
 */
public class ExtractionException extends PipelineException {
    @Serial
    private static final long serialVersionUID = 5103057382922194402L;

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
