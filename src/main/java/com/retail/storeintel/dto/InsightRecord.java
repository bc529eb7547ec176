package com.retail.storeintel.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.SortedMap;

@Value
@Builder(toBuilder = true)
public class InsightRecord {

    String storeId;
    Instant generatedAt;
    InsightPriority priority;
    InsightCategory category;
    String title;
    String message;

    /**
     * Numeric values that justify the message, keyed by metric name.
     */
    SortedMap<String, Double> supportingMetrics;

    @Singular
    List<String> recommendedActions;

    /**
     * 0..1, blends input completeness and snapshot recency.
     */
    double confidenceScore;

    /**
     * Underlying snapshot is older than its configured maximum age.
     */
    boolean stale;

    /**
     * Built from synthetic fallback data rather than a live provider reading.
     */
    boolean fallbackData;
}
