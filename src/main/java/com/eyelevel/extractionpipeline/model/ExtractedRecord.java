package com.eyelevel.extractionpipeline.model;

import com.eyelevel.extractionpipeline.model.converter.JsonMapConverter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One structured record extracted from a session's document.
 */
@Entity
@Table(name = "extracted_records", indexes = {
        @Index(name = "idx_records_session", columnList = "session_id"),
        @Index(name = "idx_records_flagged", columnList = "is_flagged")
})
@Data
public class ExtractedRecord {

    @Id
    @Column(name = "record_id", length = 36)
    private String recordId;

    @Column(name = "session_id", nullable = false, length = 36)
    private String sessionId;

    /**
     * Read-only view of the owning session; records are written through {@link #sessionId}. Declares the
     * foreign key, so a session cannot be deleted while it still has records.
     */
    @JsonIgnore
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "session_id", insertable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_records_session"))
    private ProcessingSession session;

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> fieldValues = new LinkedHashMap<>();

    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT")
    private Map<String, Object> confidenceScores = new LinkedHashMap<>();

    /**
     * Field values as first stored. Never modified by reviews.
     */
    @Convert(converter = JsonMapConverter.class)
    @Column(columnDefinition = "TEXT", updatable = false)
    private Map<String, Object> originalValues = new LinkedHashMap<>();

    @Column(name = "is_flagged", nullable = false)
    private boolean flagged;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ReviewStatus reviewStatus = ReviewStatus.PENDING;

    @Column(columnDefinition = "TEXT")
    private String reviewerNotes;

    /**
     * Insertion sequence within the owning session. Records are returned in this order.
     */
    @Column(nullable = false)
    private long sequenceNumber;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
