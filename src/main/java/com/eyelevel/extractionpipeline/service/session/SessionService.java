package com.eyelevel.extractionpipeline.service.session;

import com.eyelevel.extractionpipeline.dto.session.RecordData;
import com.eyelevel.extractionpipeline.dto.session.SessionStats;
import com.eyelevel.extractionpipeline.exception.apiclient.BadRequestException;
import com.eyelevel.extractionpipeline.exception.apiclient.NotFoundException;
import com.eyelevel.extractionpipeline.model.ExtractedRecord;
import com.eyelevel.extractionpipeline.model.ProcessingSession;
import com.eyelevel.extractionpipeline.model.ReviewStatus;
import com.eyelevel.extractionpipeline.repository.ExtractedRecordRepository;
import com.eyelevel.extractionpipeline.repository.ProcessingSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Manages processing sessions and the records extracted for them. Sessions are independent of the job
 * queue and are only removed by the age-based retention sweep.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class SessionService {

    private final ProcessingSessionRepository sessionRepository;
    private final ExtractedRecordRepository recordRepository;

    /**
     * Creates a session for an uploaded file.
     *
     * @return the generated session id.
     *
     * @throws BadRequestException if the file name is blank or the size is negative.
     */
    public String createSession(String fileName, long fileSize, @Nullable Map<String, Object> columnMappings,
                                @Nullable Map<String, Object> processingConfig) {
        if (!StringUtils.hasText(fileName)) {
            throw new BadRequestException("File name must not be blank.");
        }
        if (fileSize < 0) {
            throw new BadRequestException("File size must not be negative.");
        }
        ProcessingSession session = new ProcessingSession();
        session.setSessionId(UUID.randomUUID().toString());
        session.setFileName(fileName);
        session.setFileSize(fileSize);
        session.setUploadTime(LocalDateTime.now());
        session.setColumnMappings(columnMappings != null ? new LinkedHashMap<>(columnMappings) : new LinkedHashMap<>());
        session.setProcessingConfig(
                processingConfig != null ? new LinkedHashMap<>(processingConfig) : new LinkedHashMap<>());
        sessionRepository.save(session);
        log.info("Created session {} for file '{}' ({} bytes).", session.getSessionId(), fileName, fileSize);
        return session.getSessionId();
    }

    @Transactional(readOnly = true)
    public Optional<ProcessingSession> getSession(String sessionId) {
        return sessionRepository.findById(sessionId);
    }

    /**
     * Sets the session status and, when given, its quality score.
     *
     * @return {@code false} if the session does not exist.
     */
    public boolean updateStatus(String sessionId, String status, @Nullable Double qualityScore) {
        if (!StringUtils.hasText(status)) {
            throw new BadRequestException("Session status must not be blank.");
        }
        Optional<ProcessingSession> found = sessionRepository.findById(sessionId);
        if (found.isEmpty()) {
            log.warn("Cannot update status of unknown session {}.", sessionId);
            return false;
        }
        ProcessingSession session = found.get();
        session.setStatus(status);
        if (qualityScore != null) {
            session.setQualityScore(qualityScore);
        }
        sessionRepository.save(session);
        log.info("Session {} status set to '{}'.", sessionId, status);
        return true;
    }

    public boolean updateMetrics(String sessionId, int totalRecords, int flaggedRecords) {
        if (totalRecords < 0 || flaggedRecords < 0) {
            throw new BadRequestException("Record counts must not be negative.");
        }
        Optional<ProcessingSession> found = sessionRepository.findById(sessionId);
        if (found.isEmpty()) {
            log.warn("Cannot update metrics of unknown session {}.", sessionId);
            return false;
        }
        ProcessingSession session = found.get();
        session.setTotalRecords(totalRecords);
        session.setFlaggedRecords(flaggedRecords);
        sessionRepository.save(session);
        return true;
    }

    /**
     * Appends records to a session. Existing records are never replaced.
     *
     * @return the number of records stored.
     *
     * @throws NotFoundException if the session does not exist.
     */
    public int storeRecords(String sessionId, List<RecordData> records) {
        if (!sessionRepository.existsById(sessionId)) {
            throw new NotFoundException("Session not found: " + sessionId);
        }
        if (records == null || records.isEmpty()) {
            return 0;
        }
        long sequence = recordRepository.findMaxSequenceNumber(sessionId);
        List<ExtractedRecord> entities = new ArrayList<>(records.size());
        for (RecordData data : records) {
            ExtractedRecord record = new ExtractedRecord();
            record.setRecordId(UUID.randomUUID().toString());
            record.setSessionId(sessionId);
            record.setFieldValues(new LinkedHashMap<>(data.fieldValues()));
            record.setOriginalValues(new LinkedHashMap<>(data.fieldValues()));
            record.setConfidenceScores(new LinkedHashMap<>(data.confidenceScores()));
            record.setFlagged(data.flagged());
            record.setSequenceNumber(++sequence);
            entities.add(record);
        }
        recordRepository.saveAll(entities);
        log.info("Stored {} record(s) for session {}.", entities.size(), sessionId);
        return entities.size();
    }

    /**
     * @return the session's records in creation order, optionally only the flagged ones.
     */
    @Transactional(readOnly = true)
    public List<ExtractedRecord> getRecords(String sessionId, boolean flaggedOnly) {
        return flaggedOnly
                ? recordRepository.findAllBySessionIdAndFlaggedTrueOrderBySequenceNumberAsc(sessionId)
                : recordRepository.findAllBySessionIdOrderBySequenceNumberAsc(sessionId);
    }

    /**
     * Merges reviewer corrections into a record and marks it reviewed.
     *
     * @return {@code false} if the record does not exist.
     */
    public boolean updateRecord(String recordId, Map<String, Object> patch, @Nullable String reviewerNotes) {
        Optional<ExtractedRecord> found = recordRepository.findById(recordId);
        if (found.isEmpty()) {
            log.warn("Cannot update unknown record {}.", recordId);
            return false;
        }
        ExtractedRecord record = found.get();
        Map<String, Object> merged = new LinkedHashMap<>(record.getFieldValues());
        if (patch != null) {
            merged.putAll(patch);
        }
        record.setFieldValues(merged);
        record.setReviewStatus(ReviewStatus.REVIEWED);
        if (reviewerNotes != null) {
            record.setReviewerNotes(reviewerNotes);
        }
        recordRepository.save(record);
        return true;
    }

    /**
     * Deletes sessions created more than {@code days} days ago together with their records.
     *
     * @return the number of sessions removed.
     */
    public int cleanupOlderThan(int days) {
        if (days < 0) {
            throw new BadRequestException("Retention days must not be negative.");
        }
        LocalDateTime cutoff = LocalDateTime.now().minusDays(days);
        List<String> sessionIds = sessionRepository.findIdsCreatedBefore(cutoff);
        if (sessionIds.isEmpty()) {
            return 0;
        }
        int records = recordRepository.deleteAllBySessionIdIn(sessionIds);
        int sessions = sessionRepository.deleteAllByIdIn(sessionIds);
        log.info("Retention sweep removed {} session(s) and {} record(s) created before {}.", sessions, records,
                 cutoff);
        return sessions;
    }

    @Transactional(readOnly = true)
    public SessionStats stats() {
        Map<String, Long> byStatus = new LinkedHashMap<>();
        long total = 0;
        for (Object[] row : sessionRepository.countByStatus()) {
            long count = ((Number) row[1]).longValue();
            byStatus.put((String) row[0], count);
            total += count;
        }
        return new SessionStats(total, byStatus, sessionRepository.sumTotalRecords(),
                                sessionRepository.sumFlaggedRecords(), sessionRepository.averageQualityScore());
    }

    /**
     * @return sessions with the given status, newest first.
     */
    @Transactional(readOnly = true)
    public List<ProcessingSession> getSessionsByStatus(String status) {
        return sessionRepository.findAllByStatusOrderByCreatedAtDesc(status);
    }
}
