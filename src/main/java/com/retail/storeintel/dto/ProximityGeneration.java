package com.retail.storeintel.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * One complete proximity recompute: owning store id to its competitors,
 * ascending by distance.
 */
public record ProximityGeneration(
        long generationId,
        Instant publishedAt,
        double radiusKm,
        Map<String, List<ProximityRecord>> byStore
) {

    public ProximityGeneration {
        byStore = byStore.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> List.copyOf(e.getValue())));
    }

    public List<ProximityRecord> recordsFor(String storeId) {
        return byStore.get(storeId);
    }
}
