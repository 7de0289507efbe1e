package com.eyelevel.extractionpipeline.dto.job;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

import java.util.Map;

/**
 * Request to queue a document for extraction.
 */
@Data
public class EnqueueJobRequest {

    @NotBlank(message = "The 'fileReference' field cannot be empty.")
    @Schema(description = "Path of the uploaded document", example = "/data/uploads/demo.pdf")
    private String fileReference;

    @NotBlank(message = "The 'sessionId' field cannot be empty.")
    private String sessionId;

    @Schema(description = "Opaque options passed to the extractor")
    private Map<String, Object> config;
}
