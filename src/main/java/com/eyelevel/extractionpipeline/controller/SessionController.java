package com.eyelevel.extractionpipeline.controller;

import com.eyelevel.extractionpipeline.dto.common.ApiResponse;
import com.eyelevel.extractionpipeline.dto.session.CreateSessionRequest;
import com.eyelevel.extractionpipeline.dto.session.SessionStats;
import com.eyelevel.extractionpipeline.dto.session.StoreRecordsRequest;
import com.eyelevel.extractionpipeline.dto.session.UpdateRecordRequest;
import com.eyelevel.extractionpipeline.dto.session.UpdateSessionStatusRequest;
import com.eyelevel.extractionpipeline.exception.apiclient.NotFoundException;
import com.eyelevel.extractionpipeline.model.ExtractedRecord;
import com.eyelevel.extractionpipeline.model.ProcessingSession;
import com.eyelevel.extractionpipeline.service.session.SessionService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for processing sessions and their records.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/sessions")
@RequiredArgsConstructor
@Validated
public class SessionController implements SessionApi {

    private final SessionService sessionService;

    @Override
    @PostMapping
    public ResponseEntity<ApiResponse<Map<String, String>>> createSession(
            @Valid @RequestBody final CreateSessionRequest request) {
        String sessionId = sessionService.createSession(request.getFileName(), request.getFileSize(),
                                                        request.getColumnMappings(), request.getProcessingConfig());
        return ResponseEntity.ok(ApiResponse.ok(Map.of("sessionId", sessionId), "Session created successfully."));
    }

    @Override
    @GetMapping("/{sessionId}")
    public ResponseEntity<ApiResponse<ProcessingSession>> getSession(@PathVariable("sessionId") final String sessionId) {
        ProcessingSession session = sessionService.getSession(sessionId)
                                                  .orElseThrow(() -> new NotFoundException("Session not found: " + sessionId));
        return ResponseEntity.ok(ApiResponse.ok(session, "Session retrieved successfully."));
    }

    @Override
    @GetMapping
    public ResponseEntity<ApiResponse<List<ProcessingSession>>> listByStatus(@RequestParam("status") final String status) {
        return ResponseEntity.ok(ApiResponse.ok(sessionService.getSessionsByStatus(status), "Sessions retrieved successfully."));
    }

    @Override
    @PutMapping("/{sessionId}/status")
    public ResponseEntity<ApiResponse<Void>> updateStatus(@PathVariable("sessionId") final String sessionId,
                                                          @Valid @RequestBody final UpdateSessionStatusRequest request) {
        if (!sessionService.updateStatus(sessionId, request.getStatus(), request.getQualityScore())) {
            throw new NotFoundException("Session not found: " + sessionId);
        }
        return ResponseEntity.ok(ApiResponse.ok(null, "Session status updated."));
    }

    @Override
    @PostMapping("/{sessionId}/records")
    public ResponseEntity<ApiResponse<Map<String, Integer>>> storeRecords(@PathVariable("sessionId") final String sessionId,
                                                                          @Valid @RequestBody final StoreRecordsRequest request) {
        int stored = sessionService.storeRecords(sessionId, request.getRecords());
        return ResponseEntity.ok(ApiResponse.ok(Map.of("stored", stored), "Records stored successfully."));
    }

    @Override
    @GetMapping("/{sessionId}/records")
    public ResponseEntity<ApiResponse<List<ExtractedRecord>>> getRecords(
            @PathVariable("sessionId") final String sessionId,
            @RequestParam(value = "flaggedOnly", defaultValue = "false") final boolean flaggedOnly) {
        return ResponseEntity.ok(ApiResponse.ok(sessionService.getRecords(sessionId, flaggedOnly),
                                                "Records retrieved successfully."));
    }

    @Override
    @PatchMapping("/records/{recordId}")
    public ResponseEntity<ApiResponse<Void>> updateRecord(@PathVariable("recordId") final String recordId,
                                                          @RequestBody final UpdateRecordRequest request) {
        if (!sessionService.updateRecord(recordId, request.getFieldValues(), request.getReviewerNotes())) {
            throw new NotFoundException("Record not found: " + recordId);
        }
        return ResponseEntity.ok(ApiResponse.ok(null, "Record updated."));
    }

    @Override
    @GetMapping("/stats")
    public ResponseEntity<ApiResponse<SessionStats>> stats() {
        return ResponseEntity.ok(ApiResponse.ok(sessionService.stats(), "Session statistics retrieved successfully."));
    }

    @Override
    @PostMapping("/cleanup")
    public ResponseEntity<ApiResponse<Map<String, Integer>>> cleanup(
            @RequestParam("olderThanDays") @Min(value = 0, message = "The 'olderThanDays' must not be negative.") final int olderThanDays) {
        log.info("Manual session cleanup requested for sessions older than {} day(s).", olderThanDays);
        int removed = sessionService.cleanupOlderThan(olderThanDays);
        return ResponseEntity.ok(ApiResponse.ok(Map.of("removed", removed), "Session cleanup finished."));
    }
}
