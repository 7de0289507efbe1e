package com.eyelevel.extractionpipeline.dto.session;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class UpdateSessionStatusRequest {

    @NotBlank(message = "The 'status' field cannot be empty.")
    private String status;

    private Double qualityScore;
}
