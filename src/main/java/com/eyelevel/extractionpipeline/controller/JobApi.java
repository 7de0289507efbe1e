package com.eyelevel.extractionpipeline.controller;

import com.eyelevel.extractionpipeline.dto.common.ApiResponse;
import com.eyelevel.extractionpipeline.dto.job.EnqueueJobRequest;
import com.eyelevel.extractionpipeline.dto.job.EnqueueJobResponse;
import com.eyelevel.extractionpipeline.dto.job.QueueStats;
import com.eyelevel.extractionpipeline.dto.worker.PoolStatus;
import com.eyelevel.extractionpipeline.model.Job;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;

@Tag(name = "Job Queue", description = "Endpoints for submitting extraction jobs, tracking them and managing the worker pool.")
public interface JobApi {

    @Operation(summary = "Enqueue Job",
            description = "Validates the request and pushes a new extraction job onto the queue. The job starts in the 'pending' state.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Job queued.",
                    content = @Content(mediaType = "application/json",
                            schema = @Schema(implementation = ApiResponse.class),
                            examples = @ExampleObject(name = "Success", value = """
                                    {
                                        "displayMessage": "Job queued successfully.",
                                        "response": { "jobId": "6f1c2a8e-1b7d-4a53-9a53-0f0b8d8f7c11" },
                                        "showMessage": true,
                                        "statusCode": 200
                                    }
                                    """))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Blank file reference or session id.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<ApiResponse<EnqueueJobResponse>> enqueue(@Valid @RequestBody EnqueueJobRequest request);

    @Operation(summary = "Get Job", description = "Returns the current state of a job while its record is retained.")
    ResponseEntity<ApiResponse<Job>> getJob(
            @Parameter(description = "The job id.", required = true) @PathVariable("jobId") String jobId);

    @Operation(summary = "Cancel Job",
            description = "Cancels a job that no worker has claimed yet. Returns 409 once the job is processing or finished.")
    ResponseEntity<ApiResponse<Void>> cancel(@PathVariable("jobId") String jobId);

    @Operation(summary = "List Session Jobs", description = "Lists the retained jobs of a session, oldest first.")
    ResponseEntity<ApiResponse<List<Job>>> listBySession(@RequestParam("sessionId") String sessionId);

    @Operation(summary = "Queue Statistics", description = "Returns the queue length and job counts per status.")
    ResponseEntity<ApiResponse<QueueStats>> stats();

    @Operation(summary = "Worker Pool Status")
    ResponseEntity<ApiResponse<PoolStatus>> poolStatus();

    @Operation(summary = "Start Worker Pool")
    ResponseEntity<ApiResponse<PoolStatus>> startWorkers();

    @Operation(summary = "Stop Worker Pool",
            description = "Stops every worker gracefully. Jobs already dequeued are finished first.")
    ResponseEntity<ApiResponse<PoolStatus>> stopWorkers();

    @Operation(summary = "Scale Worker Pool", description = "Adds workers or gracefully stops the surplus.")
    ResponseEntity<ApiResponse<PoolStatus>> scaleWorkers(
            @Parameter(description = "Target number of workers.", example = "4") @RequestParam("size") int size);
}
