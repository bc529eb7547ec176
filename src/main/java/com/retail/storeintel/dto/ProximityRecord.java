package com.retail.storeintel.dto;

import com.retail.storeintel.entity.StoreChain;

import java.time.Instant;

public record ProximityRecord(
        String owningStoreId,
        String competitorStoreId,
        StoreChain competitorChain,
        double distanceKm,
        Instant computedAt
) {}
