package com.eyelevel.extractionpipeline.dto.common;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Getter;

/**
 * A standardized, generic wrapper for all API responses.
 * It provides a consistent structure for both successful and failed responses.
 **/
@Getter
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    /**
     * A message to display to the user.
     */
    private final String displayMessage;

    /**
     * The response data.
     */
    private final T response;

    /**
     * A flag indicating whether to show the display message.
     */
    private final Boolean showMessage;

    /**
     * The HTTP status code of the response.
     */
    private final Integer statusCode;

    /**
     * Additional detail about a failure, absent on success.
     */
    private final String errorDetail;

    public static <T> ApiResponse<T> ok(T response, String displayMessage) {
        return ApiResponse.<T>builder()
                .response(response)
                .displayMessage(displayMessage)
                .showMessage(true)
                .statusCode(200)
                .build();
    }

    public static <T> ApiResponse<T> error(int statusCode, String displayMessage) {
        return error(statusCode, displayMessage, null);
    }

    public static <T> ApiResponse<T> error(int statusCode, String displayMessage, String errorDetail) {
        return ApiResponse.<T>builder()
                .displayMessage(displayMessage)
                .errorDetail(errorDetail)
                .showMessage(true)
                .statusCode(statusCode)
                .build();
    }
}
