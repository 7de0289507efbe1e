package com.eyelevel.extractionpipeline.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating a malformed request (HTTP 400). Validation failures of job, session and
 * export input are reported with this type and nothing is persisted or enqueued.
 */
public class BadRequestException extends ApiException {

    @Serial
    private static final long serialVersionUID = 2736427319467104752L;

    /**
     * Constructs a new BadRequestException with the specified message.
     *
     * @param message A descriptive message about the exception.
     */
    public BadRequestException(String message) {
        super(message, 400);
    }
}
