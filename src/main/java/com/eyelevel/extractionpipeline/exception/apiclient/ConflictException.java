package com.eyelevel.extractionpipeline.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating that a request conflicts with the current state of a resource (HTTP 409),
 * e.g. cancelling a job that has already been dispatched to a worker.
 */
public class ConflictException extends ApiException {

    @Serial
    private static final long serialVersionUID = -5709728403403396930L;

    /**
     * Constructs a new ConflictException with the specified message.
     *
     * @param message A descriptive message about the exception.
     */
    public ConflictException(String message) {
        super(message, 409);
    }
}
