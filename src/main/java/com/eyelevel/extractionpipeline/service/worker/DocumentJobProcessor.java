package com.eyelevel.extractionpipeline.service.worker;

import com.eyelevel.extractionpipeline.exception.PipelineException;
import com.eyelevel.extractionpipeline.model.Job;
import com.eyelevel.extractionpipeline.model.ProcessingSession;
import com.eyelevel.extractionpipeline.service.extraction.DocumentExtractor;
import com.eyelevel.extractionpipeline.service.extraction.ExtractionResult;
import com.eyelevel.extractionpipeline.service.session.SessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default {@link JobProcessor}: runs the configured {@link DocumentExtractor} on the job's file and
 * records the outcome in the job's session.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentJobProcessor implements JobProcessor {

    private final ObjectProvider<DocumentExtractor> documentExtractorProvider;
    private final SessionService sessionService;

    @Override
    public Map<String, Object> process(Job job, ProgressListener progressListener) {
        String sessionId = job.getSessionId();
        sessionService.updateStatus(sessionId, ProcessingSession.STATUS_PROCESSING, null);
        progressListener.onProgress(10, "Extracting document");

        ExtractionResult extraction;
        try {
            DocumentExtractor extractor = documentExtractorProvider.getIfAvailable();
            if (extractor == null) {
                throw new PipelineException("No document extractor is configured");
            }
            extraction = extractor.extract(Path.of(job.getFileReference()), job.getConfig());
        } catch (RuntimeException e) {
            log.error("Extraction failed for job {} in session {}.", job.getId(), sessionId, e);
            sessionService.updateStatus(sessionId, ProcessingSession.STATUS_FAILED, null);
            throw e;
        }

        progressListener.onProgress(70, "Storing records");
        int stored = sessionService.storeRecords(sessionId, extraction.records());
        int flagged = extraction.flaggedCount();
        sessionService.updateMetrics(sessionId, stored, flagged);
        sessionService.updateStatus(sessionId, ProcessingSession.STATUS_COMPLETED, extraction.qualityScore());
        progressListener.onProgress(100, "Completed");
        log.info("Job {} extracted {} record(s), {} flagged, for session {}.", job.getId(), stored, flagged,
                 sessionId);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("recordCount", stored);
        result.put("flaggedCount", flagged);
        result.put("qualityScore", extraction.qualityScore());
        result.put("metadata", extraction.metadata());
        return result;
    }
}
