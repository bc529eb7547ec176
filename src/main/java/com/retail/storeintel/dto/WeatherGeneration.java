package com.retail.storeintel.dto;

import java.time.Instant;
import java.util.Map;

public record WeatherGeneration(
        long generationId,
        Instant publishedAt,
        Map<String, WeatherSnapshot> byStore
) {

    public WeatherGeneration {
        byStore = Map.copyOf(byStore);
    }

    public WeatherSnapshot snapshotFor(String storeId) {
        return byStore.get(storeId);
    }
}
