package com.retail.storeintel.dto;

import com.retail.storeintel.entity.StoreChain;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Network-wide counts: own stores, competitors per chain, busiest cities.
 */
@Value
@Builder
public class CompetitionSummary {
    long totalOwnStores;
    long totalCompetitorStores;
    Map<StoreChain, Long> competitorsByChain;
    List<CityCount> topCities;
    int uniqueCities;

    public record CityCount(String city, long storeCount) {}
}
