package com.retail.storeintel.service;

import com.retail.storeintel.dto.InsightRecord;
import com.retail.storeintel.dto.ProximityRecord;
import com.retail.storeintel.dto.ProximitySummary;
import com.retail.storeintel.dto.WeatherSummary;
import com.retail.storeintel.entity.Store;
import com.retail.storeintel.entity.StoreChain;
import com.retail.storeintel.exception.StoreNotFoundException;
import com.retail.storeintel.exception.ValidationException;
import com.retail.storeintel.service.weather.WeatherSnapshotCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class StoreInsightQueryServiceTest {

    private static final String STORE = "VM_KNP_001";
    private static final Instant NOW = Instant.parse("2024-06-30T09:00:00Z");

    private StoreRegistryService storeRegistry;
    private SnapshotStore snapshotStore;
    private InsightAggregator insightAggregator;
    private ProximityService proximityService;
    private WeatherSnapshotCache weatherCache;
    private StoreInsightQueryService queryService;

    @BeforeEach
    void setUp() {
        storeRegistry = mock(StoreRegistryService.class);
        when(storeRegistry.getStore(STORE)).thenReturn(Store.builder().id(STORE).chain(StoreChain.V_MART).build());
        when(storeRegistry.getStore("NOPE")).thenThrow(new StoreNotFoundException("NOPE"));
        snapshotStore = new SnapshotStore(Clock.fixed(NOW, ZoneOffset.UTC));
        insightAggregator = mock(InsightAggregator.class);
        proximityService = mock(ProximityService.class);
        weatherCache = mock(WeatherSnapshotCache.class);
        queryService = new StoreInsightQueryService(storeRegistry, snapshotStore, insightAggregator,
                proximityService, new GeoProximityEngine(), weatherCache);
    }

    @Test
    void testProximityServedFromGenerationWithinItsRadius() {
        snapshotStore.publishProximity(10, Map.of(STORE, List.of(
                record("ZD_1", StoreChain.ZUDIO, 1.2),
                record("PT_1", StoreChain.PANTALOONS, 4.0),
                record("PT_2", StoreChain.PANTALOONS, 8.5))));

        ProximitySummary summary = queryService.proximitySummary(STORE, 5);

        assertEquals(2, summary.getCompetitorCount());
        assertEquals("ZD_1", summary.getNearest().competitorStoreId());
        assertEquals(1L, summary.getCompetitorsByChain().get(StoreChain.PANTALOONS));
        assertNotNull(summary.getGenerationId());
        verifyNoInteractions(proximityService);
    }

    @Test
    void testProximityBeyondGenerationRadiusIsComputed() {
        snapshotStore.publishProximity(10, Map.of(STORE, List.of()));
        when(proximityService.findWithinRadius(STORE, 25)).thenReturn(List.of(record("PT_9", StoreChain.PANTALOONS, 20)));

        ProximitySummary summary = queryService.proximitySummary(STORE, 25);

        assertEquals(1, summary.getCompetitorCount());
        assertNull(summary.getGenerationId());
    }

    @Test
    void testProximityValidatesRadius() {
        assertThrows(ValidationException.class, () -> queryService.proximitySummary(STORE, -3));
    }

    @Test
    void testInsightsFallBackToOnDemandAggregation() {
        List<InsightRecord> live = List.of();
        when(insightAggregator.aggregate(STORE)).thenReturn(live);

        assertSame(live, queryService.latestInsights(STORE));

        snapshotStore.publishInsights(Map.of(STORE, List.of()));
        queryService.latestInsights(STORE);
        verify(insightAggregator, times(1)).aggregate(STORE);
    }

    @Test
    void testUnknownStoreIsNotFound() {
        assertThrows(StoreNotFoundException.class, () -> queryService.latestInsights("NOPE"));
        assertThrows(StoreNotFoundException.class, () -> queryService.weatherSummary("NOPE"));
    }

    @Test
    void testWeatherSummaryWithoutDataIsStale() {
        when(weatherCache.getLatest(STORE)).thenReturn(Optional.empty());
        when(weatherCache.getState(STORE)).thenReturn(WeatherSnapshotCache.State.STALE);

        WeatherSummary summary = queryService.weatherSummary(STORE);

        assertNull(summary.getLatest());
        assertTrue(summary.isStale());
        assertFalse(summary.isFallbackData());
        assertEquals("STALE", summary.getState());
    }

    private static ProximityRecord record(String id, StoreChain chain, double km) {
        return new ProximityRecord(STORE, id, chain, km, NOW);
    }
}
