package com.retail.storeintel.service;

import com.retail.storeintel.MutableClock;
import com.retail.storeintel.config.AnalyticsProperties;
import com.retail.storeintel.dto.*;
import com.retail.storeintel.entity.DayPeriod;
import com.retail.storeintel.entity.StoreChain;
import com.retail.storeintel.exception.StoreNotFoundException;
import com.retail.storeintel.repository.StoreRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class InsightAggregatorTest {

    private static final String STORE = "VM_KNP_001";
    private static final Instant NOW = Instant.parse("2024-06-30T09:00:00Z");

    private StoreRepository storeRepository;
    private SnapshotStore snapshotStore;
    private AnalyticsProperties properties;
    private MutableClock clock;
    private InsightAggregator aggregator;

    @BeforeEach
    void setUp() {
        storeRepository = mock(StoreRepository.class);
        when(storeRepository.existsById(STORE)).thenReturn(true);
        clock = new MutableClock(NOW);
        snapshotStore = new SnapshotStore(clock);
        properties = new AnalyticsProperties();
        aggregator = new InsightAggregator(storeRepository, snapshotStore, properties, clock);
    }

    @Test
    void testUnknownStoreIsNotFound() {
        assertThrows(StoreNotFoundException.class, () -> aggregator.aggregate("NOPE"));
    }

    @Test
    void testNoInputsGiveNoInsights() {
        assertTrue(aggregator.aggregate(STORE).isEmpty());
    }

    @Test
    void testAggregationIsIdempotent() {
        publishAll(weather(DataOrigin.PROVIDER), trend(-15, false, List.of()));

        AggregationInputs inputs = snapshotStore.captureInputs();

        List<InsightRecord> first = aggregator.aggregate(STORE, inputs);
        clock.advance(Duration.ofMinutes(30));
        List<InsightRecord> second = aggregator.aggregate(STORE, inputs);
        clock.advance(Duration.ofHours(12));
        List<InsightRecord> third = aggregator.aggregate(STORE);

        assertFalse(first.isEmpty());
        assertNotEquals(first.get(0).getGeneratedAt(), second.get(0).getGeneratedAt());
        assertEquals(withoutTimestamps(first), withoutTimestamps(second));
        assertEquals(withoutTimestamps(first), withoutTimestamps(third));
    }

    @Test
    void testMissingWeatherDegradesGracefully() {
        snapshotStore.publishProximity(10, Map.of(STORE, competitors(2)));
        snapshotStore.publishTrends(Map.of(STORE, trend(5, false, List.of())), Map.of());

        List<InsightRecord> insights = aggregator.aggregate(STORE);

        assertTrue(insights.stream().noneMatch(i -> i.getCategory() == InsightCategory.WEATHER));
        assertTrue(insights.stream().anyMatch(i -> i.getCategory() == InsightCategory.SALES));
        assertTrue(insights.stream().anyMatch(i -> i.getCategory() == InsightCategory.COMPETITION));
        assertTrue(insights.stream().allMatch(i -> i.getConfidenceScore() < 1.0));
    }

    @Test
    void testFallbackWeatherLowersConfidence() {
        publishAll(weather(DataOrigin.PROVIDER), trend(5, false, List.of()));
        InsightRecord live = weatherInsight(aggregator.aggregate(STORE));

        snapshotStore.publishWeather(Map.of(STORE, weather(DataOrigin.FALLBACK)));
        InsightRecord fallback = weatherInsight(aggregator.aggregate(STORE));

        assertFalse(live.isFallbackData());
        assertTrue(fallback.isFallbackData());
        assertTrue(fallback.getConfidenceScore() < live.getConfidenceScore());
    }

    @Test
    void testCompleteFreshInputsGiveFullConfidence() {
        publishAll(weather(DataOrigin.PROVIDER), trend(5, false, List.of()));

        List<InsightRecord> insights = aggregator.aggregate(STORE);

        insights.forEach(insight -> assertEquals(1.0, insight.getConfidenceScore(), 1e-9));
        insights.forEach(insight -> assertFalse(insight.isStale()));
    }

    @Test
    void testSalesDeclineThresholds() {
        publishAll(weather(DataOrigin.PROVIDER), trend(-15, false, List.of()));
        assertEquals(InsightPriority.HIGH, salesInsight(aggregator.aggregate(STORE)).getPriority());

        snapshotStore.publishTrends(Map.of(STORE, trend(-30, false, List.of())), Map.of());
        assertEquals(InsightPriority.CRITICAL, salesInsight(aggregator.aggregate(STORE)).getPriority());

        snapshotStore.publishTrends(Map.of(STORE, trend(-5, false, List.of())), Map.of());
        assertEquals(InsightPriority.LOW, salesInsight(aggregator.aggregate(STORE)).getPriority());
    }

    @Test
    void testCompetitionRules() {
        snapshotStore.publishProximity(10, Map.of(STORE, competitors(6)));
        assertEquals(InsightPriority.HIGH, competitionInsight(aggregator.aggregate(STORE)).getPriority());

        snapshotStore.publishProximity(10, Map.of(STORE, List.of(
                competitor("ZD_1", StoreChain.ZUDIO, 1.5))));
        InsightRecord close = competitionInsight(aggregator.aggregate(STORE));
        assertEquals(InsightPriority.MEDIUM, close.getPriority());
        assertEquals(1.5, close.getSupportingMetrics().get("nearestDistanceKm"), 1e-9);

        snapshotStore.publishProximity(10, Map.of(STORE, List.of(
                competitor("ZD_1", StoreChain.ZUDIO, 6.0))));
        assertEquals(InsightPriority.LOW, competitionInsight(aggregator.aggregate(STORE)).getPriority());
    }

    @Test
    void testWeatherVarianceOutsideBandIsMedium() {
        publishAll(weather(DataOrigin.PROVIDER), trend(5, false, List.of()));
        snapshotStore.publishTrends(Map.of(STORE, trend(5, false, List.of())),
                Map.of(STORE, new WeatherImpact(STORE, "Rain", 70, 100, -30, 6)));

        InsightRecord insight = weatherInsight(aggregator.aggregate(STORE));

        assertEquals(InsightPriority.MEDIUM, insight.getPriority());
        assertEquals(-30.0, insight.getSupportingMetrics().get("variancePct"), 1e-9);
    }

    @Test
    void testInsightsAreRankedByPriorityThenConfidence() {
        ReorderRecommendation critical = new ReorderRecommendation("Apparel", 4, 5, 0.8, 66, InsightPriority.CRITICAL);
        ReorderRecommendation high = new ReorderRecommendation("Footwear", 20, 5, 4, 50, InsightPriority.HIGH);
        snapshotStore.publishProximity(10, Map.of(STORE, competitors(6)));
        snapshotStore.publishWeather(Map.of(STORE, weather(DataOrigin.FALLBACK)));
        snapshotStore.publishTrends(Map.of(STORE, trend(-5, false, List.of(critical, high))), Map.of());

        List<InsightRecord> insights = aggregator.aggregate(STORE);

        assertEquals(InsightPriority.CRITICAL, insights.get(0).getPriority());
        assertEquals("Reorder Apparel", insights.get(0).getTitle());
        for (int i = 1; i < insights.size(); i++) {
            InsightRecord previous = insights.get(i - 1);
            InsightRecord current = insights.get(i);
            assertTrue(previous.getPriority().compareTo(current.getPriority()) <= 0);
            if (previous.getPriority() == current.getPriority()) {
                assertTrue(previous.getConfidenceScore() >= current.getConfidenceScore());
            }
        }
    }

    @Test
    void testOldSnapshotIsMarkedStale() {
        snapshotStore.publishWeather(Map.of(STORE, new WeatherSnapshot(STORE, LocalDate.of(2024, 6, 29),
                DayPeriod.MORNING, Measurement.present(30), "Clear", Measurement.present(60),
                Measurement.present(10), DataOrigin.PROVIDER, NOW.minus(Duration.ofHours(7)))));

        InsightRecord insight = weatherInsight(aggregator.aggregate(STORE));

        assertTrue(insight.isStale());
    }

    private void publishAll(WeatherSnapshot weather, TrendSummary trend) {
        snapshotStore.publishProximity(10, Map.of(STORE, competitors(2)));
        snapshotStore.publishWeather(Map.of(STORE, weather));
        snapshotStore.publishTrends(Map.of(STORE, trend), Map.of());
    }

    private static List<InsightRecord> withoutTimestamps(List<InsightRecord> insights) {
        return insights.stream().map(insight -> insight.toBuilder().generatedAt(null).build()).toList();
    }

    private static InsightRecord salesInsight(List<InsightRecord> insights) {
        return single(insights, InsightCategory.SALES);
    }

    private static InsightRecord weatherInsight(List<InsightRecord> insights) {
        return single(insights, InsightCategory.WEATHER);
    }

    private static InsightRecord competitionInsight(List<InsightRecord> insights) {
        return single(insights, InsightCategory.COMPETITION);
    }

    private static InsightRecord single(List<InsightRecord> insights, InsightCategory category) {
        List<InsightRecord> matching = insights.stream().filter(i -> i.getCategory() == category).toList();
        assertEquals(1, matching.size(), "expected one " + category + " insight");
        return matching.get(0);
    }

    private static WeatherSnapshot weather(DataOrigin origin) {
        boolean fallback = origin == DataOrigin.FALLBACK;
        return new WeatherSnapshot(STORE, LocalDate.of(2024, 6, 30), DayPeriod.MORNING,
                fallback ? Measurement.fallback(22) : Measurement.present(31),
                "Clear",
                fallback ? Measurement.fallback(65) : Measurement.present(55),
                fallback ? Measurement.fallback(15) : Measurement.present(9),
                origin, NOW);
    }

    private static TrendSummary trend(double growth, boolean lowConfidence, List<ReorderRecommendation> reorders) {
        return TrendSummary.builder()
                .storeId(STORE)
                .windowDays(30)
                .asOf(LocalDate.of(2024, 6, 30))
                .totalValue(100 + growth)
                .priorTotalValue(100)
                .growthRatePct(growth)
                .peakPeriod(new PeakBucket(DayOfWeek.SATURDAY, DayPeriod.EVENING, 42))
                .categoryGrowth(new TreeMap<>(Map.of("Apparel", growth)))
                .reorderRecommendations(reorders)
                .lowConfidence(lowConfidence)
                .historyDays(lowConfidence ? 10 : 60)
                .computedAt(NOW)
                .build();
    }

    private static List<ProximityRecord> competitors(int count) {
        List<ProximityRecord> records = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            records.add(competitor("PT_" + i, StoreChain.PANTALOONS, 2.5 + i));
        }
        return records;
    }

    private static ProximityRecord competitor(String id, StoreChain chain, double km) {
        return new ProximityRecord(STORE, id, chain, km, NOW);
    }
}
