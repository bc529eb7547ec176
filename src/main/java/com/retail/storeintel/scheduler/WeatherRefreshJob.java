package com.retail.storeintel.scheduler;

import com.retail.storeintel.config.SchedulerProperties;
import com.retail.storeintel.dto.WeatherSnapshot;
import com.retail.storeintel.entity.Store;
import com.retail.storeintel.service.SnapshotStore;
import com.retail.storeintel.service.StoreRegistryService;
import com.retail.storeintel.service.weather.WeatherSnapshotCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Refreshes weather for every active own-brand store and publishes a new
 * weather generation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WeatherRefreshJob implements RefreshJob {

    public static final String NAME = "weather-refresh";

    private final StoreRegistryService storeRegistry;
    private final WeatherSnapshotCache weatherCache;
    private final SnapshotStore snapshotStore;
    private final PerStoreRunner perStoreRunner;
    private final SchedulerProperties properties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Duration cadence() {
        return properties.getWeatherCadence();
    }

    @Override
    public void run(JobContext context) {
        List<Store> stores = storeRegistry.findOwnStores();
        log.info("WEATHER REFRESH: Starting for {} stores", stores.size());

        Map<String, WeatherSnapshot> refreshed = perStoreRunner.forEachStore(NAME, stores,
                store -> weatherCache.refresh(store.getId()), context);
        if (context.isStopRequested()) {
            log.info("WEATHER REFRESH: Stop requested, discarding {} snapshots", refreshed.size());
            return;
        }

        // keep the previous reading for stores whose refresh failed outright
        Map<String, WeatherSnapshot> generation = new LinkedHashMap<>();
        long fallbacks = 0;
        for (Store store : stores) {
            WeatherSnapshot snapshot = refreshed.get(store.getId());
            if (snapshot == null) {
                snapshot = weatherCache.getLatest(store.getId()).orElse(null);
            }
            if (snapshot != null) {
                generation.put(store.getId(), snapshot);
                if (snapshot.isFallback()) {
                    fallbacks++;
                }
            }
        }

        weatherCache.prune();
        snapshotStore.publishWeather(generation);
        log.info("WEATHER REFRESH: Completed {} stores ({} fallback)", generation.size(), fallbacks);
    }
}
