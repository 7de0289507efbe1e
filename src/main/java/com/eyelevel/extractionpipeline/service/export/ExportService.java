package com.eyelevel.extractionpipeline.service.export;

import com.eyelevel.extractionpipeline.config.PipelineConfig;
import com.eyelevel.extractionpipeline.dto.export.DownloadInfo;
import com.eyelevel.extractionpipeline.dto.export.DownloadResult;
import com.eyelevel.extractionpipeline.dto.export.StorageStats;
import com.eyelevel.extractionpipeline.dto.session.RecordData;
import com.eyelevel.extractionpipeline.exception.apiclient.BadRequestException;
import com.eyelevel.extractionpipeline.exception.apiclient.NotFoundException;
import com.eyelevel.extractionpipeline.model.CompressionType;
import com.eyelevel.extractionpipeline.model.DownloadLink;
import com.eyelevel.extractionpipeline.model.ExportJob;
import com.eyelevel.extractionpipeline.model.ExportStatus;
import com.eyelevel.extractionpipeline.model.ProcessingSession;
import com.eyelevel.extractionpipeline.service.session.SessionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;

/**
 * Generates CSV exports of extracted records and hands them out through expiring download links.
 *
 * <p>An export moves {@code PENDING -> PROCESSING -> COMPLETED | FAILED}; an operator may cancel it while
 * it is pending or processing. Only a job that is still processing when its artifact is finished gets a
 * download link. Cancelled and failed jobs have their partial files deleted.
 */
@Slf4j
@Service
public class ExportService {

    static final String CANCELLED_MESSAGE = "Export cancelled by user";

    private final ExportJobRegistry exportJobRegistry;
    private final CsvArtifactWriter csvArtifactWriter;
    private final CompressionService compressionService;
    private final DownloadLinkService downloadLinkService;
    private final ArtifactStorage artifactStorage;
    private final SessionService sessionService;
    private final AsyncTaskExecutor exportTaskExecutor;
    private final PipelineConfig pipelineConfig;

    public ExportService(ExportJobRegistry exportJobRegistry, CsvArtifactWriter csvArtifactWriter,
                         CompressionService compressionService, DownloadLinkService downloadLinkService,
                         ArtifactStorage artifactStorage, SessionService sessionService,
                         @Qualifier("exportTaskExecutor") AsyncTaskExecutor exportTaskExecutor,
                         PipelineConfig pipelineConfig) {
        this.exportJobRegistry = exportJobRegistry;
        this.csvArtifactWriter = csvArtifactWriter;
        this.compressionService = compressionService;
        this.downloadLinkService = downloadLinkService;
        this.artifactStorage = artifactStorage;
        this.sessionService = sessionService;
        this.exportTaskExecutor = exportTaskExecutor;
        this.pipelineConfig = pipelineConfig;
    }

    /**
     * Registers an export of the given records and generates it, either in the calling thread or on the
     * export executor.
     *
     * @return the export job id.
     */
    public String createExport(String sessionId, List<RecordData> records, String filename,
                               CompressionType compression, boolean synchronous) {
        return createExport(sessionId, records, Map.of(), filename, compression, synchronous);
    }

    /**
     * Exports the records stored for a session, using the session's column mappings as the header.
     *
     * @throws NotFoundException if the session does not exist.
     */
    public String createExportForSession(String sessionId, String filename, CompressionType compression,
                                         boolean flaggedOnly, boolean synchronous) {
        ProcessingSession session = sessionService.getSession(sessionId)
                                                  .orElseThrow(() -> new NotFoundException(
                                                          "Session not found: " + sessionId));
        List<RecordData> records = sessionService.getRecords(sessionId, flaggedOnly).stream()
                                                 .map(record -> new RecordData(record.getFieldValues(),
                                                                               record.getConfidenceScores(),
                                                                               record.isFlagged()))
                                                 .toList();
        Map<String, String> columns = new LinkedHashMap<>();
        session.getColumnMappings().forEach((field, header) -> columns.put(field, String.valueOf(header)));
        return createExport(sessionId, records, columns, filename, compression, synchronous);
    }

    private String createExport(String sessionId, List<RecordData> records, Map<String, String> columns,
                                String filename, CompressionType compression, boolean synchronous) {
        if (!StringUtils.hasText(sessionId)) {
            throw new BadRequestException("Session id must not be blank.");
        }
        if (!StringUtils.hasText(filename)) {
            throw new BadRequestException("Export filename must not be blank.");
        }
        if (records == null) {
            throw new BadRequestException("Records must not be null.");
        }
        ExportJob job = new ExportJob();
        job.setJobId(UUID.randomUUID().toString());
        job.setSessionId(sessionId);
        job.setFilename(filename);
        job.setCreatedAt(LocalDateTime.now());
        job.setTotalRecords(records.size());
        job.setCompressionType(compression != null ? compression : CompressionType.NONE);
        exportJobRegistry.register(job);
        log.info("Created export {} of {} record(s) for session {} ({}, {}).", job.getJobId(), records.size(),
                 sessionId, job.getCompressionType(), synchronous ? "sync" : "async");

        List<RecordData> snapshot = List.copyOf(records);
        Map<String, String> layout = new LinkedHashMap<>(columns);
        if (synchronous) {
            generate(job.getJobId(), snapshot, layout);
        } else {
            exportTaskExecutor.execute(() -> generate(job.getJobId(), snapshot, layout));
        }
        return job.getJobId();
    }

    public Optional<ExportJob> getStatus(String jobId) {
        return exportJobRegistry.snapshot(jobId);
    }

    /**
     * @return download details for a completed export whose link and file still exist.
     */
    public Optional<DownloadInfo> getDownloadInfo(String jobId) {
        Optional<ExportJob> found = exportJobRegistry.snapshot(jobId);
        if (found.isEmpty() || found.get().getStatus() != ExportStatus.COMPLETED) {
            return Optional.empty();
        }
        ExportJob job = found.get();
        Optional<DownloadLink> link = downloadLinkService.find(job.getDownloadToken());
        Path artifact = job.getFinalArtifactPath();
        if (link.isEmpty() || artifact == null || !Files.isRegularFile(artifact)) {
            return Optional.empty();
        }
        long size;
        try {
            size = artifactStorage.sizeOf(artifact);
        } catch (IOException e) {
            log.warn("Unable to read size of export artifact {}", artifact, e);
            return Optional.empty();
        }
        DownloadLink downloadLink = link.get();
        return Optional.of(new DownloadInfo(jobId, downloadLinkService.downloadUrl(downloadLink.getToken()),
                                            downloadLink.getToken(), artifact.getFileName().toString(), size,
                                            job.getCompressionType(), job.getCompressionRatio(),
                                            downloadLink.getExpiryTime(),
                                            Math.max(0, downloadLink.getMaxDownloads()
                                                    - downloadLink.getDownloadCount())));
    }

    public DownloadResult download(String token) {
        return downloadLinkService.authorize(token);
    }

    /**
     * Cancels a pending or running export. A running export stops at its next batch boundary.
     *
     * @return {@code false} if the export is unknown or already finished.
     */
    public boolean cancel(String jobId) {
        boolean cancelled = exportJobRegistry.update(jobId, job -> {
            if (job.getStatus() != ExportStatus.PENDING && job.getStatus() != ExportStatus.PROCESSING) {
                return false;
            }
            job.setStatus(ExportStatus.CANCELLED);
            job.setErrorMessage(CANCELLED_MESSAGE);
            job.setCompletedAt(LocalDateTime.now());
            return true;
        }).orElse(false);
        if (cancelled) {
            log.info("Export {} cancelled.", jobId);
        }
        return cancelled;
    }

    /**
     * @return the session's exports, newest first.
     */
    public List<ExportJob> listForSession(String sessionId) {
        return exportJobRegistry.snapshots(job -> job.getSessionId().equals(sessionId)).stream()
                                .sorted(Comparator.comparing(ExportJob::getCreatedAt).reversed())
                                .toList();
    }

    /**
     * Drops exports older than the retention window together with their files and links.
     *
     * @return the number of exports removed.
     */
    public int cleanupExpired() {
        LocalDateTime cutoff = LocalDateTime.now().minusHours(pipelineConfig.getExport().getRetentionHours());
        List<ExportJob> expired = exportJobRegistry.removeIf(job -> !job.getCreatedAt().isAfter(cutoff));
        for (ExportJob job : expired) {
            artifactStorage.deleteQuietly(job.getArtifactPath());
            artifactStorage.deleteQuietly(job.getCompressedPath());
            downloadLinkService.revoke(job.getDownloadToken());
        }
        int staleLinks = downloadLinkService.cleanupExpired();
        log.info("Export cleanup removed {} job(s) and {} expired link(s).", expired.size(), staleLinks);
        return expired.size();
    }

    public StorageStats storageStats() {
        return artifactStorage.stats(exportJobRegistry.size());
    }

    void generate(String jobId, List<RecordData> records, Map<String, String> columns) {
        boolean started = exportJobRegistry.update(jobId, job -> {
            if (job.getStatus() != ExportStatus.PENDING) {
                return false;
            }
            job.setStatus(ExportStatus.PROCESSING);
            return true;
        }).orElse(false);
        if (!started) {
            log.info("Export {} was cancelled before it started.", jobId);
            return;
        }
        ExportJob job = exportJobRegistry.snapshot(jobId).orElseThrow();
        Path raw = artifactStorage.rawArtifactPath(job.getFilename(), job.getSessionId(), jobId, job.getCreatedAt());
        Path compressed = null;
        try {
            int written = csvArtifactWriter.write(raw, records, columns,
                                                  (processed, total) -> recordProgress(jobId, processed),
                                                  () -> isCancelled(jobId));
            long rawSize = artifactStorage.sizeOf(raw);
            exportJobRegistry.update(jobId, live -> {
                live.setProcessedRecords(written);
                live.setArtifactPath(raw);
                live.setSizeBytes(rawSize);
                return null;
            });

            if (job.getCompressionType() != CompressionType.NONE) {
                if (isCancelled(jobId)) {
                    throw new CancellationException("Export cancelled before compression");
                }
                compressed = artifactStorage.compressedArtifactPath(raw, job.getCompressionType());
                compressionService.compress(raw, compressed, job.getCompressionType(),
                                            artifactStorage.sanitize(job.getFilename()) + ".csv");
                Path compressedPath = compressed;
                long compressedSize = artifactStorage.sizeOf(compressed);
                exportJobRegistry.update(jobId, live -> {
                    live.setCompressedPath(compressedPath);
                    live.setCompressedSizeBytes(compressedSize);
                    return null;
                });
            }

            if (!complete(jobId)) {
                log.info("Export {} was cancelled during generation; discarding artifacts.", jobId);
                discard(jobId, raw, compressed);
                return;
            }
            log.info("Export {} completed: {} record(s) written to {}.", jobId, written, raw.getFileName());
        } catch (CancellationException e) {
            log.info("Export {} stopped: {}", jobId, e.getMessage());
            discard(jobId, raw, compressed);
        } catch (IOException | RuntimeException e) {
            log.error("Export {} failed.", jobId, e);
            fail(jobId, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            discard(jobId, raw, compressed);
        }
    }

    private boolean complete(String jobId) {
        PipelineConfig.Export config = pipelineConfig.getExport();
        return exportJobRegistry.update(jobId, job -> {
            if (job.getStatus() != ExportStatus.PROCESSING) {
                return false;
            }
            Path artifact = job.getFinalArtifactPath();
            long size = job.getCompressedPath() != null ? job.getCompressedSizeBytes() : job.getSizeBytes();
            job.setDownloadToken(downloadLinkService.createLink(artifact, config.getLinkExpiryHours(),
                                                                config.getMaxDownloads(), size));
            job.setStatus(ExportStatus.COMPLETED);
            job.setCompletedAt(LocalDateTime.now());
            return true;
        }).orElse(false);
    }

    private void fail(String jobId, String message) {
        exportJobRegistry.update(jobId, job -> {
            if (job.getStatus() == ExportStatus.PROCESSING) {
                job.setStatus(ExportStatus.FAILED);
                job.setErrorMessage(message);
                job.setCompletedAt(LocalDateTime.now());
            }
            return null;
        });
    }

    private void discard(String jobId, Path raw, Path compressed) {
        artifactStorage.deleteQuietly(raw);
        artifactStorage.deleteQuietly(compressed);
        exportJobRegistry.update(jobId, job -> {
            job.setArtifactPath(null);
            job.setCompressedPath(null);
            return null;
        });
    }

    private void recordProgress(String jobId, int processed) {
        exportJobRegistry.update(jobId, job -> {
            job.setProcessedRecords(Math.min(processed, job.getTotalRecords()));
            return null;
        });
    }

    private boolean isCancelled(String jobId) {
        return exportJobRegistry.snapshot(jobId).map(job -> job.getStatus() == ExportStatus.CANCELLED).orElse(true);
    }
}
