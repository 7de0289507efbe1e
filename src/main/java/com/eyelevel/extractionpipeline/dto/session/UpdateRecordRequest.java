package com.eyelevel.extractionpipeline.dto.session;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.util.Map;

/**
 * Reviewer corrections for a single record.
 */
@Data
public class UpdateRecordRequest {

    @Schema(description = "Field values to overwrite; other fields are kept")
    private Map<String, Object> fieldValues;

    private String reviewerNotes;
}
