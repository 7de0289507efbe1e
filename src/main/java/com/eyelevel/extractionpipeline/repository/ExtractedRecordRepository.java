package com.eyelevel.extractionpipeline.repository;

import com.eyelevel.extractionpipeline.model.ExtractedRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Spring Data JPA repository for the {@link ExtractedRecord} entity. Every query is scoped by session.
 */
@Repository
public interface ExtractedRecordRepository extends JpaRepository<ExtractedRecord, String> {

    List<ExtractedRecord> findAllBySessionIdOrderBySequenceNumberAsc(String sessionId);

    List<ExtractedRecord> findAllBySessionIdAndFlaggedTrueOrderBySequenceNumberAsc(String sessionId);

    @Query("SELECT COALESCE(MAX(r.sequenceNumber), 0) FROM ExtractedRecord r WHERE r.sessionId = :sessionId")
    long findMaxSequenceNumber(@Param("sessionId") String sessionId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM ExtractedRecord r WHERE r.sessionId IN :sessionIds")
    int deleteAllBySessionIdIn(@Param("sessionIds") List<String> sessionIds);
}
