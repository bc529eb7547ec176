package com.retail.storeintel.dto;

/**
 * How sales in buckets sharing the latest weather condition compare with the
 * store's overall bucket average.
 */
public record WeatherImpact(
        String storeId,
        String condition,
        double conditionMean,
        double overallMean,
        double variancePct,
        int sampleBuckets
) {}
