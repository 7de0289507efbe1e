package com.eyelevel.extractionpipeline.service.extraction;

import com.eyelevel.extractionpipeline.dto.session.RecordData;

import java.util.List;
import java.util.Map;

/**
 * Output of a {@link DocumentExtractor}.
 *
 * @param records      Extracted records in document order.
 * @param qualityScore Overall extraction quality in [0, 1], or {@code null} if unknown.
 * @param metadata     Opaque extractor metadata, copied into the job result.
 */
public record ExtractionResult(List<RecordData> records, Double qualityScore, Map<String, Object> metadata) {

    public ExtractionResult {
        records = records != null ? List.copyOf(records) : List.of();
        metadata = metadata != null ? metadata : Map.of();
    }

    public int flaggedCount() {
        return (int) records.stream().filter(RecordData::flagged).count();
    }
}
