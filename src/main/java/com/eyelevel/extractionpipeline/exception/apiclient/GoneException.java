package com.eyelevel.extractionpipeline.exception.apiclient;

import java.io.Serial;

/**
 * Exception indicating that a resource existed but is no longer available (HTTP 410).
 */
public class GoneException extends ApiException {

    @Serial
    private static final long serialVersionUID = 6084729105518232904L;

    public GoneException(String message) {
        super(message, 410);
    }
}
