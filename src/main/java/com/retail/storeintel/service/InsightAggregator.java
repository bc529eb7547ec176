package com.retail.storeintel.service;

import com.retail.storeintel.config.AnalyticsProperties;
import com.retail.storeintel.dto.*;
import com.retail.storeintel.entity.StoreChain;
import com.retail.storeintel.exception.StoreNotFoundException;
import com.retail.storeintel.repository.StoreRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Combines the latest proximity, weather and trend generations into ranked,
 * per-store insights. A missing input removes its insights and lowers the
 * confidence of the rest; only an unknown store is an error.
 */
@Slf4j
@Service
public class InsightAggregator {

    static final Comparator<InsightRecord> RANKING = Comparator
            .comparing(InsightRecord::getPriority)
            .thenComparing(Comparator.comparingDouble(InsightRecord::getConfidenceScore).reversed())
            .thenComparing(InsightRecord::getCategory)
            .thenComparing(InsightRecord::getTitle);

    private final StoreRepository storeRepository;
    private final SnapshotStore snapshotStore;
    private final AnalyticsProperties properties;
    private final Clock clock;

    public InsightAggregator(StoreRepository storeRepository,
                             SnapshotStore snapshotStore,
                             AnalyticsProperties properties,
                             Clock clock) {
        this.storeRepository = storeRepository;
        this.snapshotStore = snapshotStore;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @throws StoreNotFoundException if the store is unknown
     */
    public List<InsightRecord> aggregate(String storeId) {
        return aggregate(storeId, snapshotStore.captureInputs());
    }

    /**
     * Same inputs give the same records apart from {@code generatedAt}.
     */
    public List<InsightRecord> aggregate(String storeId, AggregationInputs inputs) {
        if (!storeRepository.existsById(storeId)) {
            throw new StoreNotFoundException(storeId);
        }
        Instant now = clock.instant();
        Instant asOf = inputs.referenceTime().orElse(now);
        AnalyticsProperties.Insight config = properties.getInsight();

        List<ProximityRecord> competitors = inputs.proximity() != null
                ? inputs.proximity().recordsFor(storeId) : null;
        WeatherSnapshot weather = inputs.weather() != null ? inputs.weather().snapshotFor(storeId) : null;
        TrendSummary trend = inputs.trends() != null ? inputs.trends().trendFor(storeId) : null;
        WeatherImpact impact = inputs.trends() != null ? inputs.trends().weatherImpactFor(storeId) : null;

        double completeness = completeness(competitors != null, weather, trend);
        InsightFactory factory = new InsightFactory(storeId, now, completeness, config);

        List<InsightRecord> insights = new ArrayList<>();
        if (trend != null) {
            Duration age = Duration.between(trend.getComputedAt(), asOf);
            double quality = trend.isLowConfidence() ? config.getLowConfidenceTrendQuality() : 1.0;
            Freshness freshness = new Freshness(age, config.getTrendMaxAge(), quality, false);
            insights.add(salesInsight(factory, trend, freshness));
            insights.addAll(inventoryInsights(factory, trend, freshness));
        }
        if (weather != null) {
            Duration age = Duration.between(weather.fetchedAt(), asOf);
            double quality = weather.isFallback() ? config.getFallbackWeatherQuality() : 1.0;
            insights.add(weatherInsight(factory, weather, impact,
                    new Freshness(age, config.getWeatherMaxAge(), quality, weather.isFallback())));
        }
        if (competitors != null) {
            Duration age = Duration.between(inputs.proximity().publishedAt(), asOf);
            insights.add(competitionInsight(factory, competitors, inputs.proximity().radiusKm(),
                    new Freshness(age, config.getProximityMaxAge(), 1.0, false)));
        }

        insights.sort(RANKING);
        log.debug("INSIGHTS: {} -> {} insights (completeness={})", storeId, insights.size(), completeness);
        return insights;
    }

    private InsightRecord salesInsight(InsightFactory factory, TrendSummary trend, Freshness freshness) {
        AnalyticsProperties.Insight config = properties.getInsight();
        double growth = trend.getGrowthRatePct();

        SortedMap<String, Double> metrics = new TreeMap<>();
        metrics.put("growthRatePct", round(growth));
        metrics.put("totalValue", round(trend.getTotalValue()));
        metrics.put("priorTotalValue", round(trend.getPriorTotalValue()));
        metrics.put("windowDays", (double) trend.getWindowDays());
        trend.getCategoryGrowth().forEach((category, pct) -> metrics.put("category." + category + ".growthPct", round(pct)));

        String peak = describePeak(trend.getPeakPeriod());
        if (trend.getPeakPeriod() != null) {
            metrics.put("peakMeanValue", round(trend.getPeakPeriod().meanValue()));
        }

        boolean critical = growth < -config.getSalesCriticalDeclinePct();
        if (critical || growth < -config.getSalesDeclineThresholdPct()) {
            return factory.create(critical ? InsightPriority.CRITICAL : InsightPriority.HIGH, InsightCategory.SALES,
                    critical ? "Severe sales decline" : "Sales decline",
                    format("Sales fell %.1f%% versus the previous %d days. %s", -growth, trend.getWindowDays(), peak),
                    metrics,
                    List.of("Review pricing and promotions for declining categories",
                            "Compare footfall with nearby competitor activity",
                            "Check stock availability of best sellers"),
                    freshness);
        }
        String title = growth >= config.getSalesGrowthHighlightPct() ? "Sales growing" : "Sales steady";
        return factory.create(InsightPriority.LOW, InsightCategory.SALES, title,
                format("Sales changed %+.1f%% versus the previous %d days. %s", growth, trend.getWindowDays(), peak),
                metrics,
                List.of("Keep staffing aligned with the peak trading period"),
                freshness);
    }

    private List<InsightRecord> inventoryInsights(InsightFactory factory, TrendSummary trend, Freshness freshness) {
        List<InsightRecord> insights = new ArrayList<>();
        for (ReorderRecommendation recommendation : trend.getReorderRecommendations()) {
            SortedMap<String, Double> metrics = new TreeMap<>();
            metrics.put("currentStock", (double) recommendation.currentStock());
            metrics.put("averageDailyConsumption", round(recommendation.averageDailyConsumption()));
            metrics.put("daysOfCover", round(recommendation.daysOfCover()));
            metrics.put("suggestedQuantity", (double) recommendation.suggestedQuantity());

            insights.add(factory.create(recommendation.urgency(), InsightCategory.INVENTORY,
                    "Reorder " + recommendation.category(),
                    format("%s has %.1f days of cover left at %.1f units per day.",
                            recommendation.category(), recommendation.daysOfCover(),
                            recommendation.averageDailyConsumption()),
                    metrics,
                    List.of(format("Order %d units of %s", recommendation.suggestedQuantity(), recommendation.category())),
                    freshness));
        }
        return insights;
    }

    private InsightRecord weatherInsight(InsightFactory factory, WeatherSnapshot weather, WeatherImpact impact,
                                         Freshness freshness) {
        SortedMap<String, Double> metrics = new TreeMap<>();
        putMeasurement(metrics, "temperatureC", weather.temperatureC());
        putMeasurement(metrics, "humidity", weather.humidity());
        putMeasurement(metrics, "windSpeedKmh", weather.windSpeed());

        List<String> actions = weatherActions(weather);
        String source = weather.isFallback() ? " (seasonal estimate)" : "";

        if (impact != null) {
            metrics.put("variancePct", round(impact.variancePct()));
            metrics.put("sampleBuckets", (double) impact.sampleBuckets());
            if (Math.abs(impact.variancePct()) > properties.getInsight().getWeatherVarianceBandPct()) {
                return factory.create(InsightPriority.MEDIUM, InsightCategory.WEATHER, "Weather affecting sales",
                        format("Sales during %s conditions run %+.1f%% against the store average%s.",
                                impact.condition(), impact.variancePct(), source),
                        metrics, actions, freshness);
            }
        }
        return factory.create(InsightPriority.LOW, InsightCategory.WEATHER, "Current weather",
                format("%s, %.1fC during the %s period%s.", weather.condition(),
                        weather.temperatureC().orElse(Double.NaN), weather.period().name().toLowerCase(Locale.ROOT), source),
                metrics, actions, freshness);
    }

    private InsightRecord competitionInsight(InsightFactory factory, List<ProximityRecord> competitors,
                                             double radiusKm, Freshness freshness) {
        AnalyticsProperties.Insight config = properties.getInsight();

        SortedMap<String, Double> metrics = new TreeMap<>();
        metrics.put("competitorCount", (double) competitors.size());
        metrics.put("radiusKm", radiusKm);
        Map<StoreChain, Long> byChain = new EnumMap<>(StoreChain.class);
        competitors.forEach(record -> byChain.merge(record.competitorChain(), 1L, Long::sum));
        byChain.forEach((chain, count) -> metrics.put("chain." + chain.name(), count.doubleValue()));

        ProximityRecord nearest = competitors.isEmpty() ? null : competitors.get(0);
        if (nearest != null) {
            metrics.put("nearestDistanceKm", round(nearest.distanceKm()));
        }

        if (competitors.size() > config.getHighDensityCompetitorCount()) {
            return factory.create(InsightPriority.HIGH, InsightCategory.COMPETITION, "High competitor density",
                    format("%d competitor stores within %.1f km.", competitors.size(), radiusKm),
                    metrics,
                    List.of("Benchmark prices against the nearest competitors",
                            "Strengthen loyalty offers for repeat customers"),
                    freshness);
        }
        if (nearest != null && nearest.distanceKm() <= config.getCloseCompetitorKm()) {
            return factory.create(InsightPriority.MEDIUM, InsightCategory.COMPETITION, "Competitor close by",
                    format("%s store %s is %.2f km away.", nearest.competitorChain().getDisplayName(),
                            nearest.competitorStoreId(), nearest.distanceKm()),
                    metrics,
                    List.of("Track promotions at " + nearest.competitorChain().getDisplayName()),
                    freshness);
        }
        return factory.create(InsightPriority.LOW, InsightCategory.COMPETITION, "Competitive landscape",
                format("%d competitor stores within %.1f km.", competitors.size(), radiusKm),
                metrics,
                List.of(),
                freshness);
    }

    private static List<String> weatherActions(WeatherSnapshot weather) {
        String condition = weather.condition() == null ? "" : weather.condition().toLowerCase(Locale.ROOT);
        double temperature = weather.temperatureC().orElse(Double.NaN);
        if (condition.contains("rain") || condition.contains("drizzle") || condition.contains("thunder")) {
            return List.of("Move umbrellas and rainwear to the entrance");
        }
        if (temperature > 30) {
            return List.of("Feature summer wear and cotton lines");
        }
        if (temperature < 15) {
            return List.of("Feature winter wear and layering");
        }
        return List.of("Keep the standard seasonal layout");
    }

    /**
     * Fraction of the three inputs present; fallback weather and low-confidence
     * trends count half.
     */
    private static double completeness(boolean hasProximity, WeatherSnapshot weather, TrendSummary trend) {
        double score = hasProximity ? 1.0 : 0.0;
        if (weather != null) {
            score += weather.isFallback() ? 0.5 : 1.0;
        }
        if (trend != null) {
            score += trend.isLowConfidence() ? 0.5 : 1.0;
        }
        return score / 3.0;
    }

    private static void putMeasurement(SortedMap<String, Double> metrics, String name, Measurement measurement) {
        if (!measurement.isAbsent()) {
            metrics.put(name, round(measurement.value()));
        }
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }

    private static String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args).trim();
    }

    private static String describePeak(PeakBucket peak) {
        if (peak == null) {
            return "";
        }
        String day = peak.dayOfWeek().name().charAt(0) + peak.dayOfWeek().name().substring(1).toLowerCase(Locale.ROOT);
        return "Peak trading: " + day + " " + peak.period().name().toLowerCase(Locale.ROOT) + ".";
    }

    /**
     * Age and quality of the snapshot an insight was built from.
     */
    private record Freshness(Duration age, Duration maxAge, double quality, boolean fallback) {

        double recency() {
            if (maxAge.isZero() || maxAge.isNegative()) {
                return 0.0;
            }
            double ratio = (double) Math.max(0, age.toMillis()) / maxAge.toMillis();
            return Math.max(0.0, 1.0 - ratio);
        }

        boolean stale() {
            return age.compareTo(maxAge) > 0;
        }
    }

    private static final class InsightFactory {

        private final String storeId;
        private final Instant generatedAt;
        private final double completeness;
        private final AnalyticsProperties.Insight config;

        private InsightFactory(String storeId, Instant generatedAt, double completeness,
                               AnalyticsProperties.Insight config) {
            this.storeId = storeId;
            this.generatedAt = generatedAt;
            this.completeness = completeness;
            this.config = config;
        }

        InsightRecord create(InsightPriority priority, InsightCategory category, String title, String message,
                             SortedMap<String, Double> metrics, List<String> actions, Freshness freshness) {
            double raw = (config.getCompletenessWeight() * completeness
                    + config.getRecencyWeight() * freshness.recency()) * freshness.quality();
            double confidence = round(Math.min(1.0, Math.max(0.0, raw)));

            return InsightRecord.builder()
                    .storeId(storeId)
                    .generatedAt(generatedAt)
                    .priority(priority)
                    .category(category)
                    .title(title)
                    .message(message)
                    .supportingMetrics(Collections.unmodifiableSortedMap(metrics))
                    .recommendedActions(actions)
                    .confidenceScore(confidence)
                    .stale(freshness.stale())
                    .fallbackData(freshness.fallback())
                    .build();
        }
    }
}
