package com.eyelevel.extractionpipeline.repository;

import com.eyelevel.extractionpipeline.model.ProcessingSession;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Spring Data JPA repository for the {@link ProcessingSession} entity.
 */
@Repository
public interface ProcessingSessionRepository extends JpaRepository<ProcessingSession, String> {

    List<ProcessingSession> findAllByStatusOrderByCreatedAtDesc(String status);

    @Query("SELECT s.sessionId FROM ProcessingSession s WHERE s.createdAt < :cutoff")
    List<String> findIdsCreatedBefore(@Param("cutoff") LocalDateTime cutoff);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM ProcessingSession s WHERE s.sessionId IN :ids")
    int deleteAllByIdIn(@Param("ids") List<String> ids);

    /**
     * Returns {@code [status, count]} pairs.
     */
    @Query("SELECT s.status, COUNT(s) FROM ProcessingSession s GROUP BY s.status")
    List<Object[]> countByStatus();

    @Query("SELECT COALESCE(SUM(s.totalRecords), 0) FROM ProcessingSession s")
    long sumTotalRecords();

    @Query("SELECT COALESCE(SUM(s.flaggedRecords), 0) FROM ProcessingSession s")
    long sumFlaggedRecords();

    @Query("SELECT AVG(s.qualityScore) FROM ProcessingSession s WHERE s.qualityScore IS NOT NULL")
    Double averageQualityScore();
}
