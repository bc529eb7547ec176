package com.retail.storeintel.dto;

import com.retail.storeintel.entity.StoreChain;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class ProximitySummary {
    String storeId;
    double radiusKm;
    int competitorCount;
    Map<StoreChain, Long> competitorsByChain;
    ProximityRecord nearest;
    List<ProximityRecord> competitors;

    /**
     * Generation the records were read from, or null when computed on demand.
     */
    Long generationId;
}
