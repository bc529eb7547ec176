package com.retail.storeintel.dto;

import java.time.Instant;
import java.util.Map;

public record TrendGeneration(
        long generationId,
        Instant publishedAt,
        Map<String, TrendSummary> trends,
        Map<String, WeatherImpact> weatherImpacts
) {

    public TrendGeneration {
        trends = Map.copyOf(trends);
        weatherImpacts = Map.copyOf(weatherImpacts);
    }

    public TrendSummary trendFor(String storeId) {
        return trends.get(storeId);
    }

    public WeatherImpact weatherImpactFor(String storeId) {
        return weatherImpacts.get(storeId);
    }
}
