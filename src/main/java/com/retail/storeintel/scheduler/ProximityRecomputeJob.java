package com.retail.storeintel.scheduler;

import com.retail.storeintel.config.GeoProperties;
import com.retail.storeintel.config.SchedulerProperties;
import com.retail.storeintel.dto.ProximityRecord;
import com.retail.storeintel.entity.Store;
import com.retail.storeintel.service.GeoProximityEngine;
import com.retail.storeintel.service.SnapshotStore;
import com.retail.storeintel.service.StoreRegistryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds the competitor list of every active own-brand store at the
 * configured analysis radius.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProximityRecomputeJob implements RefreshJob {

    public static final String NAME = "proximity-recompute";

    private final StoreRegistryService storeRegistry;
    private final GeoProximityEngine engine;
    private final SnapshotStore snapshotStore;
    private final PerStoreRunner perStoreRunner;
    private final GeoProperties geoProperties;
    private final SchedulerProperties properties;
    private final Clock clock;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Duration cadence() {
        return properties.getProximityCadence();
    }

    @Override
    public void run(JobContext context) {
        List<Store> ownStores = storeRegistry.findOwnStores();
        List<Store> competitors = storeRegistry.findCompetitorStores();
        double radiusKm = geoProperties.getAnalysisRadiusKm();
        Instant computedAt = clock.instant();
        log.info("PROXIMITY: Recomputing {} stores against {} competitors within {} km",
                ownStores.size(), competitors.size(), radiusKm);

        Map<String, List<ProximityRecord>> byStore = perStoreRunner.forEachStore(NAME, ownStores,
                store -> engine.findWithinRadius(store, competitors, radiusKm, computedAt), context);
        if (context.isStopRequested()) {
            log.info("PROXIMITY: Stop requested, discarding partial recompute");
            return;
        }

        snapshotStore.publishProximity(radiusKm, byStore);
        long pairs = byStore.values().stream().mapToLong(List::size).sum();
        log.info("PROXIMITY: Found {} competitor pairs across {} stores", pairs, byStore.size());
    }
}
