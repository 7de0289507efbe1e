package com.eyelevel.extractionpipeline.dto.session;

import java.util.Map;

/**
 * A structured record as produced by an extractor, before it is stored in a session.
 *
 * @param fieldValues      Column name to extracted value.
 * @param confidenceScores Column name to confidence in [0, 1].
 * @param flagged          Whether the record needs human review.
 */
public record RecordData(Map<String, Object> fieldValues, Map<String, Object> confidenceScores, boolean flagged) {

    public RecordData {
        fieldValues = fieldValues != null ? fieldValues : Map.of();
        confidenceScores = confidenceScores != null ? confidenceScores : Map.of();
    }
}
