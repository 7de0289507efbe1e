package com.eyelevel.extractionpipeline.controller;

import com.eyelevel.extractionpipeline.dto.common.ApiResponse;
import com.eyelevel.extractionpipeline.dto.export.CreateExportRequest;
import com.eyelevel.extractionpipeline.dto.export.DownloadInfo;
import com.eyelevel.extractionpipeline.dto.export.ExportJobResponse;
import com.eyelevel.extractionpipeline.dto.export.StorageStats;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.core.io.Resource;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;
import java.util.Map;

@Tag(name = "Exports", description = "Endpoints for generating CSV exports of session records and downloading them through secure links.")
public interface ExportApi {

    @Operation(summary = "Create Export",
            description = "Starts a CSV export of a session's records. In synchronous mode the file is generated before the response is sent.")
    ResponseEntity<ApiResponse<ExportJobResponse>> createExport(@Valid @RequestBody CreateExportRequest request);

    @Operation(summary = "Get Export Status", description = "Returns the export job with its progress and compression figures.")
    ResponseEntity<ApiResponse<ExportJobResponse>> getStatus(@PathVariable("jobId") String jobId);

    @Operation(summary = "Get Download Info",
            description = "Returns the download URL and token of a completed export whose file is still available.")
    ResponseEntity<ApiResponse<DownloadInfo>> getDownloadInfo(@PathVariable("jobId") String jobId);

    @Operation(summary = "Cancel Export", description = "Cancels a pending or running export and discards its partial files.")
    ResponseEntity<ApiResponse<Void>> cancel(@PathVariable("jobId") String jobId);

    @Operation(summary = "List Session Exports", description = "Lists a session's exports, newest first.")
    ResponseEntity<ApiResponse<List<ExportJobResponse>>> listForSession(@RequestParam("sessionId") String sessionId);

    @Operation(summary = "Export Storage Statistics")
    ResponseEntity<ApiResponse<StorageStats>> storageStats();

    @Operation(summary = "Purge Expired Exports", description = "Runs the expired export cleanup immediately.")
    ResponseEntity<ApiResponse<Map<String, Integer>>> cleanup();

    @Operation(summary = "Download Export",
            description = "Streams the export file and records one use of the token.")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "The export file.",
                    content = @Content(mediaType = "application/octet-stream")),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Invalid download token.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "410", description = "Link expired or file no longer available.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class))),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "429", description = "Download limit exceeded.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ApiResponse.class)))
    })
    ResponseEntity<Resource> download(
            @Parameter(description = "The download token.", required = true) @PathVariable("token") String token);
}
