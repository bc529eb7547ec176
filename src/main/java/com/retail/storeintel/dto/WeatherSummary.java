package com.retail.storeintel.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class WeatherSummary {
    String storeId;

    /**
     * Null when no refresh has completed for the store yet.
     */
    WeatherSnapshot latest;

    String state;
    boolean fallbackData;
    boolean stale;
    WeatherImpact impact;
}
