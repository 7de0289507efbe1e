package com.eyelevel.extractionpipeline.dto.session;

import java.util.Map;

/**
 * Aggregate figures across all stored sessions.
 */
public record SessionStats(long totalSessions, Map<String, Long> sessionsByStatus, long totalRecords,
                           long flaggedRecords, Double averageQualityScore) {
}
