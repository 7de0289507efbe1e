package com.eyelevel.extractionpipeline.model;

import com.eyelevel.extractionpipeline.model.converter.JsonMapConverter;
import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single uploaded document and the aggregate outcome of extracting it. Sessions outlive the jobs
 * that reference them and are only removed by the retention sweep.
 */
@Entity
@Table(name = "processing_sessions", indexes = {
        @Index(name = "idx_sessions_status", columnList = "processing_status")
})
@Data
public class ProcessingSession {

    public static final String STATUS_PENDING = "pending";
    public static final String STATUS_PROCESSING = "processing";
    public static final String STATUS_COMPLETED = "completed";
    public static final String STATUS_FAILED = "failed";

    @Id
    @Column(name = "session_id", length = 36)
    private String sessionId;

    @Column(nullable = false)
    private String fileName;

    @Column(nullable = false)
    private long fileSize;

    @Column(nullable = false)
    private LocalDateTime uploadTime;

    /**
     * Free-form status string. The pipeline writes the {@code STATUS_*} values.
     */
    @Column(name = "processing_status", nullable = false, length = 50)
    private String status = STATUS_PENDING;

    @Column
    private Double qualityScore;

    @Column(nullable = false)
    private int totalRecords;

    @Column(nullable = false)
    private int flaggedRecords;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> columnMappings = new LinkedHashMap<>();

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> processingConfig = new LinkedHashMap<>();

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
