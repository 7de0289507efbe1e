package com.eyelevel.extractionpipeline.controller;

import com.eyelevel.extractionpipeline.dto.common.ApiResponse;
import com.eyelevel.extractionpipeline.dto.export.CreateExportRequest;
import com.eyelevel.extractionpipeline.dto.export.DownloadInfo;
import com.eyelevel.extractionpipeline.dto.export.DownloadResult;
import com.eyelevel.extractionpipeline.dto.export.ExportJobResponse;
import com.eyelevel.extractionpipeline.dto.export.StorageStats;
import com.eyelevel.extractionpipeline.exception.apiclient.ApiException;
import com.eyelevel.extractionpipeline.exception.apiclient.ConflictException;
import com.eyelevel.extractionpipeline.exception.apiclient.GoneException;
import com.eyelevel.extractionpipeline.exception.apiclient.NotFoundException;
import com.eyelevel.extractionpipeline.exception.apiclient.TooManyRequestsException;
import com.eyelevel.extractionpipeline.model.ExportJob;
import com.eyelevel.extractionpipeline.service.export.ExportService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * REST controller for exports and token-protected downloads.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Validated
public class ExportController implements ExportApi {

    private final ExportService exportService;

    @Override
    @PostMapping("/exports")
    public ResponseEntity<ApiResponse<ExportJobResponse>> createExport(@Valid @RequestBody final CreateExportRequest request) {
        log.info("Export requested for session {} as '{}' ({}).", request.getSessionId(), request.getFilename(),
                 request.getCompression());
        String jobId = exportService.createExportForSession(request.getSessionId(), request.getFilename(),
                                                            request.getCompression(), request.isFlaggedOnly(),
                                                            request.isSynchronous());
        ExportJob job = exportService.getStatus(jobId).orElseThrow(() -> new NotFoundException("Export not found: " + jobId));
        return ResponseEntity.ok(ApiResponse.ok(ExportJobResponse.from(job), "Export created successfully."));
    }

    @Override
    @GetMapping("/exports/{jobId}")
    public ResponseEntity<ApiResponse<ExportJobResponse>> getStatus(@PathVariable("jobId") final String jobId) {
        ExportJob job = exportService.getStatus(jobId).orElseThrow(() -> new NotFoundException("Export not found: " + jobId));
        return ResponseEntity.ok(ApiResponse.ok(ExportJobResponse.from(job), "Export status retrieved successfully."));
    }

    @Override
    @GetMapping("/exports/{jobId}/download-info")
    public ResponseEntity<ApiResponse<DownloadInfo>> getDownloadInfo(@PathVariable("jobId") final String jobId) {
        DownloadInfo info = exportService.getDownloadInfo(jobId)
                                         .orElseThrow(() -> new NotFoundException("No download available for export: " + jobId));
        return ResponseEntity.ok(ApiResponse.ok(info, "Download information retrieved successfully."));
    }

    @Override
    @DeleteMapping("/exports/{jobId}")
    public ResponseEntity<ApiResponse<Void>> cancel(@PathVariable("jobId") final String jobId) {
        log.info("Cancel request for export {}", jobId);
        if (!exportService.cancel(jobId)) {
            ExportJob job = exportService.getStatus(jobId)
                                         .orElseThrow(() -> new NotFoundException("Export not found: " + jobId));
            throw new ConflictException("Export " + jobId + " cannot be cancelled in state " + job.getStatus() + ".");
        }
        return ResponseEntity.ok(ApiResponse.ok(null, "Export cancelled."));
    }

    @Override
    @GetMapping("/exports")
    public ResponseEntity<ApiResponse<List<ExportJobResponse>>> listForSession(
            @RequestParam("sessionId") @NotBlank(message = "The 'sessionId' parameter cannot be empty.") final String sessionId) {
        List<ExportJobResponse> exports = exportService.listForSession(sessionId).stream()
                                                       .map(ExportJobResponse::from)
                                                       .toList();
        return ResponseEntity.ok(ApiResponse.ok(exports, "Exports retrieved successfully."));
    }

    @Override
    @GetMapping("/exports/storage")
    public ResponseEntity<ApiResponse<StorageStats>> storageStats() {
        return ResponseEntity.ok(ApiResponse.ok(exportService.storageStats(), "Storage statistics retrieved successfully."));
    }

    @Override
    @PostMapping("/exports/cleanup")
    public ResponseEntity<ApiResponse<Map<String, Integer>>> cleanup() {
        int removed = exportService.cleanupExpired();
        return ResponseEntity.ok(ApiResponse.ok(Map.of("removed", removed), "Export cleanup finished."));
    }

    @Override
    @GetMapping("/downloads/{token}")
    public ResponseEntity<Resource> download(@PathVariable("token") final String token) {
        DownloadResult result = exportService.download(token);
        if (!result.authorized()) {
            throw toDenial(result);
        }
        Path path = result.path();
        String filename = path.getFileName().toString();
        log.info("Serving download of {}", filename);
        return ResponseEntity.ok()
                             .header(HttpHeaders.CONTENT_DISPOSITION,
                                     ContentDisposition.attachment().filename(filename).build().toString())
                             .contentType(mediaTypeFor(filename))
                             .contentLength(path.toFile().length())
                             .body(new FileSystemResource(path));
    }

    private static ApiException toDenial(DownloadResult result) {
        return switch (result.reason()) {
            case INVALID_TOKEN -> new NotFoundException(result.message());
            case EXPIRED, FILE_MISSING -> new GoneException(result.message());
            case LIMIT_EXCEEDED -> new TooManyRequestsException(result.message());
        };
    }

    private static MediaType mediaTypeFor(String filename) {
        return switch (FilenameUtils.getExtension(filename).toLowerCase()) {
            case "csv" -> MediaType.parseMediaType("text/csv");
            case "gz" -> MediaType.parseMediaType("application/gzip");
            case "zip" -> MediaType.parseMediaType("application/zip");
            default -> MediaType.APPLICATION_OCTET_STREAM;
        };
    }
}
