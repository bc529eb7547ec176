package com.retail.storeintel.service.weather;

import com.retail.storeintel.config.WeatherProperties;
import com.retail.storeintel.dto.DataOrigin;
import com.retail.storeintel.dto.Measurement;
import com.retail.storeintel.dto.WeatherObservation;
import com.retail.storeintel.dto.WeatherSnapshot;
import com.retail.storeintel.dto.WeatherSnapshot.BucketKey;
import com.retail.storeintel.entity.DayPeriod;
import com.retail.storeintel.entity.Store;
import com.retail.storeintel.entity.StoreWeatherData;
import com.retail.storeintel.exception.StoreNotFoundException;
import com.retail.storeintel.exception.ValidationException;
import com.retail.storeintel.repository.StoreRepository;
import com.retail.storeintel.repository.StoreWeatherDataRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.*;
import java.util.*;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Per-store weather snapshots with a bounded history.
 *
 * <p>A refresh calls the provider, retries once after a short backoff and then
 * falls back to a seasonal average built from stored readings for the same month
 * and day period (or fixed per-period baselines when there are none). Concurrent
 * refreshes of the same store share a single provider call.
 */
@Slf4j
@Service
public class WeatherSnapshotCache {

    public enum State {
        STALE,
        REFRESHING,
        FRESH
    }

    private static final int MAX_ATTEMPTS = 2;

    private static final Map<DayPeriod, Double> BASELINE_TEMPERATURE = Map.of(
            DayPeriod.MORNING, 22.0,
            DayPeriod.AFTERNOON, 32.0,
            DayPeriod.EVENING, 28.0,
            DayPeriod.NIGHT, 20.0);
    private static final double BASELINE_HUMIDITY = 65.0;
    private static final double BASELINE_WIND_KMH = 15.0;
    private static final String BASELINE_CONDITION = "Clear";

    private final WeatherProvider provider;
    private final StoreRepository storeRepository;
    private final StoreWeatherDataRepository weatherRepository;
    private final WeatherProperties properties;
    private final Clock clock;

    private final ConcurrentMap<String, ConcurrentNavigableMap<BucketKey, WeatherSnapshot>> history = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, CompletableFuture<WeatherSnapshot>> inFlight = new ConcurrentHashMap<>();

    public WeatherSnapshotCache(WeatherProvider provider,
                                StoreRepository storeRepository,
                                StoreWeatherDataRepository weatherRepository,
                                WeatherProperties properties,
                                Clock clock) {
        this.provider = provider;
        this.storeRepository = storeRepository;
        this.weatherRepository = weatherRepository;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Most recent snapshot for the store, empty if it has never been refreshed.
     */
    public Optional<WeatherSnapshot> getLatest(String storeId) {
        NavigableMap<BucketKey, WeatherSnapshot> entries = history.get(storeId);
        if (entries == null || entries.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(entries.lastEntry().getValue());
    }

    /**
     * Fetches current weather for the store. Never fails because of the provider:
     * after the retry the result is a fallback snapshot flagged as such.
     *
     * @throws StoreNotFoundException if the store is unknown
     */
    public WeatherSnapshot refresh(String storeId) {
        CompletableFuture<WeatherSnapshot> mine = new CompletableFuture<>();
        CompletableFuture<WeatherSnapshot> existing = inFlight.putIfAbsent(storeId, mine);
        if (existing != null) {
            log.debug("WEATHER REFRESH: Joining in-flight refresh for {}", storeId);
            return await(existing);
        }

        try {
            Store store = storeRepository.findById(storeId)
                    .orElseThrow(() -> new StoreNotFoundException(storeId));
            WeatherSnapshot snapshot = fetchWithFallback(store);
            record(snapshot);
            mine.complete(snapshot);
            return snapshot;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(storeId, mine);
        }
    }

    public State getState(String storeId) {
        if (inFlight.containsKey(storeId)) {
            return State.REFRESHING;
        }
        return getLatest(storeId)
                .map(snapshot -> isExpired(snapshot) ? State.STALE : State.FRESH)
                .orElse(State.STALE);
    }

    public boolean isExpired(WeatherSnapshot snapshot) {
        return snapshot.fetchedAt().plus(properties.getTtl()).isBefore(clock.instant());
    }

    /**
     * Snapshots held for the store, oldest first.
     */
    public List<WeatherSnapshot> history(String storeId) {
        NavigableMap<BucketKey, WeatherSnapshot> entries = history.get(storeId);
        return entries == null ? List.of() : List.copyOf(entries.values());
    }

    /**
     * Forecast snapshots for the next {@code days} days. Falls back to seasonal
     * values for every (date, period) when the provider is unavailable.
     */
    public List<WeatherSnapshot> forecast(String storeId, int days) {
        if (days <= 0 || days > properties.getForecastDays()) {
            throw new ValidationException("Forecast days must be between 1 and " + properties.getForecastDays());
        }
        Store store = storeRepository.findById(storeId)
                .orElseThrow(() -> new StoreNotFoundException(storeId));

        try {
            List<WeatherObservation> readings = provider.getForecast(store.getLatitude(), store.getLongitude(), days);
            Map<BucketKey, WeatherSnapshot> byBucket = new TreeMap<>();
            for (WeatherObservation reading : readings) {
                WeatherSnapshot snapshot = fromObservation(storeId, reading);
                byBucket.putIfAbsent(snapshot.bucket(), snapshot);
            }
            return List.copyOf(byBucket.values());
        } catch (RuntimeException e) {
            log.warn("WEATHER FORECAST: Provider unavailable for {}, using seasonal values: {}", storeId, e.getMessage());
            LocalDate today = BucketKey.of(LocalDateTime.now(clock)).date();
            List<WeatherSnapshot> fallback = new ArrayList<>();
            for (int day = 0; day < days; day++) {
                for (DayPeriod period : DayPeriod.values()) {
                    fallback.add(seasonalFallback(storeId, today.plusDays(day), period));
                }
            }
            return fallback;
        }
    }

    /**
     * Drops snapshots and stored readings older than the retention window.
     *
     * @return number of in-memory snapshots removed
     */
    public int prune() {
        LocalDate cutoff = LocalDate.now(clock).minusDays(properties.getRetentionDays());
        int removed = 0;
        for (ConcurrentNavigableMap<BucketKey, WeatherSnapshot> entries : history.values()) {
            removed += pruneBefore(entries, cutoff);
        }
        try {
            int deleted = weatherRepository.deleteOlderThan(cutoff);
            log.info("WEATHER PRUNE: Removed {} cached and {} stored readings older than {}", removed, deleted, cutoff);
        } catch (RuntimeException e) {
            log.warn("WEATHER PRUNE: Could not delete stored readings older than {}: {}", cutoff, e.getMessage());
        }
        return removed;
    }

    private WeatherSnapshot fetchWithFallback(Store store) {
        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                WeatherObservation observation = provider.getCurrent(store.getLatitude(), store.getLongitude());
                WeatherSnapshot snapshot = fromObservation(store.getId(), observation);
                log.info("WEATHER FETCH: {} {} {} {}C ({})", store.getId(), snapshot.date(), snapshot.period(),
                        observation.temperatureC(), observation.condition());
                return snapshot;
            } catch (RuntimeException e) {
                lastFailure = e;
                log.warn("WEATHER FETCH: Attempt {}/{} failed for {}: {}", attempt, MAX_ATTEMPTS, store.getId(), e.getMessage());
                if (attempt < MAX_ATTEMPTS && !backoff()) {
                    break;
                }
            }
        }

        BucketKey current = BucketKey.of(LocalDateTime.now(clock));
        log.warn("WEATHER FALLBACK: Using seasonal average for {} after provider failure: {}",
                store.getId(), lastFailure != null ? lastFailure.getMessage() : "interrupted");
        return seasonalFallback(store.getId(), current.date(), current.period());
    }

    /**
     * @return false if the thread was interrupted while waiting
     */
    private boolean backoff() {
        long millis = properties.getRetryBackoff().toMillis();
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private WeatherSnapshot fromObservation(String storeId, WeatherObservation observation) {
        BucketKey bucket = BucketKey.of(observation.observedAt());
        return new WeatherSnapshot(
                storeId,
                bucket.date(),
                bucket.period(),
                Measurement.present(observation.temperatureC()),
                observation.condition(),
                Measurement.ofNullable(observation.humidity()),
                Measurement.ofNullable(observation.windSpeed()),
                DataOrigin.PROVIDER,
                clock.instant());
    }

    /**
     * Average of stored readings for the same month and day period; fixed
     * per-period baselines when nothing is stored. Deterministic for a given
     * store, date, period and stored history.
     */
    WeatherSnapshot seasonalFallback(String storeId, LocalDate date, DayPeriod period) {
        List<StoreWeatherData> samples;
        try {
            samples = weatherRepository.findByStoreIdAndObservedMonthAndPeriod(storeId, date.getMonthValue(), period);
        } catch (RuntimeException e) {
            log.warn("WEATHER FALLBACK: Stored readings unavailable for {}: {}", storeId, e.getMessage());
            samples = List.of();
        }

        double temperature = average(samples, StoreWeatherData::getTemperatureC)
                .orElse(BASELINE_TEMPERATURE.get(period));
        double humidity = average(samples, StoreWeatherData::getHumidity).orElse(BASELINE_HUMIDITY);
        double wind = average(samples, StoreWeatherData::getWindSpeed).orElse(BASELINE_WIND_KMH);

        return new WeatherSnapshot(
                storeId,
                date,
                period,
                Measurement.fallback(temperature),
                dominantCondition(samples),
                Measurement.fallback(humidity),
                Measurement.fallback(wind),
                DataOrigin.FALLBACK,
                clock.instant());
    }

    private void record(WeatherSnapshot snapshot) {
        ConcurrentNavigableMap<BucketKey, WeatherSnapshot> entries =
                history.computeIfAbsent(snapshot.storeId(), id -> new ConcurrentSkipListMap<>());
        entries.put(snapshot.bucket(), snapshot);
        pruneBefore(entries, LocalDate.now(clock).minusDays(properties.getRetentionDays()));

        if (!snapshot.isFallback()) {
            persist(snapshot);
        }
    }

    private int pruneBefore(ConcurrentNavigableMap<BucketKey, WeatherSnapshot> entries, LocalDate cutoff) {
        NavigableMap<BucketKey, WeatherSnapshot> expired = entries.headMap(new BucketKey(cutoff, DayPeriod.MORNING), false);
        int count = expired.size();
        expired.clear();
        return count;
    }

    private void persist(WeatherSnapshot snapshot) {
        try {
            StoreWeatherData row = weatherRepository
                    .findByStoreIdAndObservedDateAndPeriod(snapshot.storeId(), snapshot.date(), snapshot.period())
                    .orElseGet(() -> new StoreWeatherData(snapshot.storeId(), snapshot.date(), snapshot.period()));
            row.setTemperatureC(snapshot.temperatureC().value());
            row.setWeatherCondition(snapshot.condition());
            row.setHumidity(snapshot.humidity().value());
            row.setWindSpeed(snapshot.windSpeed().value());
            row.setLastUpdated(LocalDateTime.now(clock));
            row.setSource(provider.name());
            weatherRepository.save(row);
        } catch (RuntimeException e) {
            log.warn("WEATHER SAVE: Could not store reading for {} {} {}: {}",
                    snapshot.storeId(), snapshot.date(), snapshot.period(), e.getMessage());
        }
    }

    private static WeatherSnapshot await(CompletableFuture<WeatherSnapshot> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    private static Optional<Double> average(List<StoreWeatherData> samples, Function<StoreWeatherData, Double> field) {
        OptionalDouble mean = samples.stream()
                .map(field)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .average();
        return mean.isPresent() ? Optional.of(mean.getAsDouble()) : Optional.empty();
    }

    private static String dominantCondition(List<StoreWeatherData> samples) {
        Map<String, Long> counts = samples.stream()
                .map(StoreWeatherData::getWeatherCondition)
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(Function.identity(), TreeMap::new, Collectors.counting()));
        // TreeMap iteration plus strict comparison keeps the alphabetically first on ties
        String best = BASELINE_CONDITION;
        long bestCount = 0;
        for (Map.Entry<String, Long> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }
}
