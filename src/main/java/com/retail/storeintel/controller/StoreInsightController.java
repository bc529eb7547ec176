package com.retail.storeintel.controller;

import com.retail.storeintel.dto.*;
import com.retail.storeintel.entity.Store;
import com.retail.storeintel.service.StoreInsightQueryService;
import com.retail.storeintel.service.StoreRegistryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/stores")
@RequiredArgsConstructor
@Tag(name = "Store Insights", description = "Per-store insights, competitors, weather and trends")
public class StoreInsightController {

    private final StoreInsightQueryService queryService;
    private final StoreRegistryService storeRegistry;

    @GetMapping("/{storeId}")
    @Operation(summary = "Get a store by id")
    public ResponseEntity<Store> getStore(@PathVariable String storeId) {
        return ResponseEntity.ok(storeRegistry.getStore(storeId));
    }

    @GetMapping("/{storeId}/insights")
    @Operation(summary = "Latest insights for a store, most urgent first")
    public ResponseEntity<List<InsightRecord>> getInsights(@PathVariable String storeId) {
        return ResponseEntity.ok(queryService.latestInsights(storeId));
    }

    @GetMapping("/{storeId}/proximity")
    @Operation(summary = "Competitor stores within a radius, nearest first")
    public ResponseEntity<ProximitySummary> getProximity(
            @PathVariable String storeId,
            @Parameter(description = "Search radius in kilometres") @RequestParam(defaultValue = "5") double radiusKm) {
        return ResponseEntity.ok(queryService.proximitySummary(storeId, radiusKm));
    }

    @GetMapping("/{storeId}/weather")
    @Operation(summary = "Latest weather snapshot with freshness and fallback markers")
    public ResponseEntity<WeatherSummary> getWeather(@PathVariable String storeId) {
        return ResponseEntity.ok(queryService.weatherSummary(storeId));
    }

    @GetMapping("/{storeId}/weather/forecast")
    @Operation(summary = "Weather forecast per day period",
            description = "Falls back to seasonal values when the provider is unavailable")
    public ResponseEntity<List<WeatherSnapshot>> getForecast(
            @PathVariable String storeId,
            @RequestParam(defaultValue = "5") int days) {
        return ResponseEntity.ok(queryService.weatherForecast(storeId, days));
    }

    @GetMapping("/{storeId}/trend")
    @Operation(summary = "Latest published sales and inventory trend")
    public ResponseEntity<TrendSummary> getTrend(@PathVariable String storeId) {
        return queryService.latestTrend(storeId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.noContent().build());
    }

    @GetMapping("/city/{city}")
    @Operation(summary = "Active stores in a city, own brand and competitors")
    public ResponseEntity<List<Store>> getStoresByCity(@PathVariable String city) {
        return ResponseEntity.ok(storeRegistry.findByCity(city));
    }

    @GetMapping("/competition/summary")
    @Operation(summary = "Competitor counts per chain and top cities by own-store count")
    public ResponseEntity<CompetitionSummary> getCompetitionSummary() {
        return ResponseEntity.ok(storeRegistry.competitionSummary());
    }
}
