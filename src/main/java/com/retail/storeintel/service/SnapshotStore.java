package com.retail.storeintel.service;

import com.retail.storeintel.dto.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Latest published generation of each derived data set. A generation is
 * immutable once built and replaced by a single pointer swap, so readers see
 * either the previous or the next generation, never a mix.
 */
@Slf4j
@Component
public class SnapshotStore {

    private final Clock clock;
    private final AtomicLong generationSequence = new AtomicLong();

    private final AtomicReference<ProximityGeneration> proximity = new AtomicReference<>();
    private final AtomicReference<WeatherGeneration> weather = new AtomicReference<>();
    private final AtomicReference<TrendGeneration> trends = new AtomicReference<>();
    private final AtomicReference<InsightGeneration> insights = new AtomicReference<>();

    public SnapshotStore(Clock clock) {
        this.clock = clock;
    }

    public ProximityGeneration publishProximity(double radiusKm, Map<String, List<ProximityRecord>> byStore) {
        ProximityGeneration generation = new ProximityGeneration(
                generationSequence.incrementAndGet(), clock.instant(), radiusKm, byStore);
        proximity.set(generation);
        log.info("SNAPSHOT: Published proximity generation {} ({} stores)", generation.generationId(), byStore.size());
        return generation;
    }

    public WeatherGeneration publishWeather(Map<String, WeatherSnapshot> byStore) {
        WeatherGeneration generation = new WeatherGeneration(
                generationSequence.incrementAndGet(), clock.instant(), byStore);
        weather.set(generation);
        log.info("SNAPSHOT: Published weather generation {} ({} stores)", generation.generationId(), byStore.size());
        return generation;
    }

    public TrendGeneration publishTrends(Map<String, TrendSummary> trendsByStore, Map<String, WeatherImpact> impacts) {
        TrendGeneration generation = new TrendGeneration(
                generationSequence.incrementAndGet(), clock.instant(), trendsByStore, impacts);
        trends.set(generation);
        log.info("SNAPSHOT: Published trend generation {} ({} stores)", generation.generationId(), trendsByStore.size());
        return generation;
    }

    public InsightGeneration publishInsights(Map<String, List<InsightRecord>> byStore) {
        InsightGeneration generation = new InsightGeneration(
                generationSequence.incrementAndGet(), clock.instant(), byStore);
        insights.set(generation);
        log.info("SNAPSHOT: Published insight generation {} ({} stores)", generation.generationId(), byStore.size());
        return generation;
    }

    public Optional<ProximityGeneration> latestProximity() {
        return Optional.ofNullable(proximity.get());
    }

    public Optional<WeatherGeneration> latestWeather() {
        return Optional.ofNullable(weather.get());
    }

    public Optional<TrendGeneration> latestTrends() {
        return Optional.ofNullable(trends.get());
    }

    public Optional<InsightGeneration> latestInsights() {
        return Optional.ofNullable(insights.get());
    }

    /**
     * Reads each input pointer exactly once. Everything aggregated from the
     * returned value comes from one consistent set of generations.
     */
    public AggregationInputs captureInputs() {
        return new AggregationInputs(proximity.get(), weather.get(), trends.get());
    }
}
