package com.retail.storeintel.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.SortedMap;

/**
 * Sales and inventory trend for one store over a window of days, compared
 * with the immediately preceding window of the same length.
 */
@Value
@Builder
public class TrendSummary {

    String storeId;
    int windowDays;
    LocalDate asOf;

    /**
     * Total value of the current window.
     */
    double totalValue;

    double priorTotalValue;

    /**
     * (current - prior) / prior * 100, or 0 when the prior window is empty.
     */
    double growthRatePct;

    /**
     * Null when the current window has no data.
     */
    PeakBucket peakPeriod;

    SortedMap<String, Double> categoryGrowth;

    @Singular
    List<ReorderRecommendation> reorderRecommendations;

    /**
     * Set when fewer than 2 x windowDays days of history were available.
     */
    boolean lowConfidence;

    int historyDays;
    Instant computedAt;
}
