package com.eyelevel.extractionpipeline.dto.job;

public record EnqueueJobResponse(String jobId) {
}
