package com.eyelevel.extractionpipeline.controller;

import com.eyelevel.extractionpipeline.dto.common.ApiResponse;
import com.eyelevel.extractionpipeline.dto.session.CreateSessionRequest;
import com.eyelevel.extractionpipeline.dto.session.SessionStats;
import com.eyelevel.extractionpipeline.dto.session.StoreRecordsRequest;
import com.eyelevel.extractionpipeline.dto.session.UpdateRecordRequest;
import com.eyelevel.extractionpipeline.dto.session.UpdateSessionStatusRequest;
import com.eyelevel.extractionpipeline.model.ExtractedRecord;
import com.eyelevel.extractionpipeline.model.ProcessingSession;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;
import java.util.Map;

@Tag(name = "Sessions", description = "Endpoints for processing sessions and their extracted records.")
public interface SessionApi {

    @Operation(summary = "Create Session", description = "Registers an uploaded file and returns the new session id.")
    ResponseEntity<ApiResponse<Map<String, String>>> createSession(@Valid @RequestBody CreateSessionRequest request);

    @Operation(summary = "Get Session")
    ResponseEntity<ApiResponse<ProcessingSession>> getSession(@PathVariable("sessionId") String sessionId);

    @Operation(summary = "List Sessions By Status", description = "Lists sessions holding the given status, newest first.")
    ResponseEntity<ApiResponse<List<ProcessingSession>>> listByStatus(
            @Parameter(example = "completed") @RequestParam("status") String status);

    @Operation(summary = "Update Session Status")
    ResponseEntity<ApiResponse<Void>> updateStatus(@PathVariable("sessionId") String sessionId,
                                                   @Valid @RequestBody UpdateSessionStatusRequest request);

    @Operation(summary = "Store Records", description = "Appends records to a session. Existing records are kept.")
    ResponseEntity<ApiResponse<Map<String, Integer>>> storeRecords(@PathVariable("sessionId") String sessionId,
                                                                   @Valid @RequestBody StoreRecordsRequest request);

    @Operation(summary = "Get Records", description = "Returns the session's records in creation order.")
    ResponseEntity<ApiResponse<List<ExtractedRecord>>> getRecords(
            @PathVariable("sessionId") String sessionId,
            @Parameter(description = "Only return records flagged for review.")
            @RequestParam(value = "flaggedOnly", defaultValue = "false") boolean flaggedOnly);

    @Operation(summary = "Review Record",
            description = "Merges corrected values into a record, stores the reviewer notes and marks it reviewed.")
    ResponseEntity<ApiResponse<Void>> updateRecord(@PathVariable("recordId") String recordId,
                                                   @RequestBody UpdateRecordRequest request);

    @Operation(summary = "Session Statistics")
    ResponseEntity<ApiResponse<SessionStats>> stats();

    @Operation(summary = "Purge Old Sessions", description = "Deletes sessions, with their records, older than the given age.")
    ResponseEntity<ApiResponse<Map<String, Integer>>> cleanup(
            @Parameter(example = "30") @RequestParam("olderThanDays") int olderThanDays);
}
