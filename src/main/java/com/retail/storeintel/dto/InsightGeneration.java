package com.retail.storeintel.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public record InsightGeneration(
        long generationId,
        Instant publishedAt,
        Map<String, List<InsightRecord>> byStore
) {

    public InsightGeneration {
        byStore = byStore.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> List.copyOf(e.getValue())));
    }

    public List<InsightRecord> insightsFor(String storeId) {
        return byStore.get(storeId);
    }
}
