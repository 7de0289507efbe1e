package com.eyelevel.extractionpipeline.dto.export;

import com.eyelevel.extractionpipeline.model.CompressionType;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * Request to export the records of a stored session.
 */
@Data
public class CreateExportRequest {

    @NotBlank
    @Schema(description = "Session whose records are exported")
    private String sessionId;

    @NotBlank
    @Schema(description = "Base name of the generated file", example = "march_extract")
    private String filename;

    private CompressionType compression = CompressionType.NONE;

    @Schema(description = "Export only records flagged for review")
    private boolean flaggedOnly;

    @Schema(description = "Generate the file before responding instead of in the background")
    private boolean synchronous;
}
