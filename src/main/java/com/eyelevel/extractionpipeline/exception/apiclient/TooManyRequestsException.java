package com.eyelevel.extractionpipeline.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating that a usage limit has been reached (HTTP 429).
 */
public class TooManyRequestsException extends ApiException {

    @Serial
    private static final long serialVersionUID = -1318437006225470413L;

    public TooManyRequestsException(String message) {
        super(message, 429);
    }
}
