package com.retail.storeintel.service;

import com.retail.storeintel.dto.*;
import com.retail.storeintel.service.weather.WeatherSnapshotCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read side used by the chat and map consumers. Serves published generations
 * and never triggers a provider call, except for forecasts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StoreInsightQueryService {

    private final StoreRegistryService storeRegistry;
    private final SnapshotStore snapshotStore;
    private final InsightAggregator insightAggregator;
    private final ProximityService proximityService;
    private final GeoProximityEngine engine;
    private final WeatherSnapshotCache weatherCache;

    /**
     * Insights from the latest published generation. A store missing from it
     * (first cycle still running, or registered since) is aggregated on demand
     * from whatever inputs exist, without publishing.
     */
    public List<InsightRecord> latestInsights(String storeId) {
        storeRegistry.getStore(storeId);
        Optional<List<InsightRecord>> published = snapshotStore.latestInsights()
                .map(generation -> generation.insightsFor(storeId));
        if (published.isPresent()) {
            return published.get();
        }
        log.debug("INSIGHTS: No published insights for {}, aggregating on demand", storeId);
        return insightAggregator.aggregate(storeId);
    }

    /**
     * Competitors within {@code radiusKm}. Served from the latest proximity
     * generation when its radius covers the request, otherwise computed directly.
     */
    public ProximitySummary proximitySummary(String storeId, double radiusKm) {
        engine.validateRadius(radiusKm);
        storeRegistry.getStore(storeId);

        Optional<ProximityGeneration> generation = snapshotStore.latestProximity()
                .filter(g -> radiusKm <= g.radiusKm() && g.recordsFor(storeId) != null);

        List<ProximityRecord> records;
        Long generationId = null;
        if (generation.isPresent()) {
            records = generation.get().recordsFor(storeId).stream()
                    .filter(record -> record.distanceKm() <= radiusKm)
                    .collect(Collectors.toList());
            generationId = generation.get().generationId();
        } else {
            records = proximityService.findWithinRadius(storeId, radiusKm);
        }

        return ProximitySummary.builder()
                .storeId(storeId)
                .radiusKm(radiusKm)
                .competitorCount(records.size())
                .competitorsByChain(engine.groupByChain(records))
                .nearest(engine.nearest(records).orElse(null))
                .competitors(List.copyOf(records))
                .generationId(generationId)
                .build();
    }

    public WeatherSummary weatherSummary(String storeId) {
        storeRegistry.getStore(storeId);
        WeatherSnapshot latest = weatherCache.getLatest(storeId).orElse(null);
        WeatherImpact impact = snapshotStore.latestTrends()
                .map(generation -> generation.weatherImpactFor(storeId))
                .orElse(null);

        return WeatherSummary.builder()
                .storeId(storeId)
                .latest(latest)
                .state(weatherCache.getState(storeId).name())
                .fallbackData(latest != null && latest.isFallback())
                .stale(latest == null || weatherCache.isExpired(latest))
                .impact(impact)
                .build();
    }

    public List<WeatherSnapshot> weatherForecast(String storeId, int days) {
        return weatherCache.forecast(storeId, days);
    }

    public Optional<TrendSummary> latestTrend(String storeId) {
        storeRegistry.getStore(storeId);
        return snapshotStore.latestTrends().map(generation -> generation.trendFor(storeId));
    }

    /**
     * Every proximity record of the latest generation, grouped by owning store order.
     */
    public List<ProximityRecord> latestProximityRecords() {
        return snapshotStore.latestProximity()
                .map(generation -> generation.byStore().entrySet().stream()
                        .sorted(Map.Entry.comparingByKey())
                        .flatMap(entry -> entry.getValue().stream())
                        .collect(Collectors.toList()))
                .orElse(List.of());
    }
}
