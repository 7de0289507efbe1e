package com.eyelevel.extractionpipeline.dto.session;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.util.Map;

@Data
public class CreateSessionRequest {

    @NotBlank(message = "The 'fileName' field cannot be empty.")
    private String fileName;

    @PositiveOrZero(message = "The 'fileSize' must not be negative.")
    private long fileSize;

    @Schema(description = "Record field name to CSV column header, in export order")
    private Map<String, Object> columnMappings;

    private Map<String, Object> processingConfig;
}
