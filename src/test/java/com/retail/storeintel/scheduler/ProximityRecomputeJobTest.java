package com.retail.storeintel.scheduler;

import com.retail.storeintel.config.GeoProperties;
import com.retail.storeintel.config.SchedulerProperties;
import com.retail.storeintel.dto.ProximityGeneration;
import com.retail.storeintel.entity.Store;
import com.retail.storeintel.entity.StoreChain;
import com.retail.storeintel.service.GeoProximityEngine;
import com.retail.storeintel.service.SnapshotStore;
import com.retail.storeintel.service.StoreRegistryService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ProximityRecomputeJobTest {

    private StoreRegistryService storeRegistry;
    private SnapshotStore snapshotStore;
    private ThreadPoolTaskExecutor workers;
    private ProximityRecomputeJob job;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-06-30T09:00:00Z"), ZoneOffset.UTC);
        storeRegistry = mock(StoreRegistryService.class);
        snapshotStore = new SnapshotStore(clock);
        workers = new ThreadPoolTaskExecutor();
        workers.setCorePoolSize(2);
        workers.initialize();
        job = new ProximityRecomputeJob(storeRegistry, new GeoProximityEngine(), snapshotStore, new PerStoreRunner(workers),
                new GeoProperties(), new SchedulerProperties(), clock);

        when(storeRegistry.findOwnStores()).thenReturn(List.of(
                store("VM_KNP_001", StoreChain.V_MART, 26.4499, 80.3319),
                store("VM_LKO_001", StoreChain.V_MART, 26.8467, 80.9462),
                store("VM_JPR_001", StoreChain.V_MART, 26.9124, 75.7873)));
        when(storeRegistry.findCompetitorStores()).thenReturn(List.of(
                store("ZD_KNP_001", StoreChain.ZUDIO, 26.4619, 80.3318),
                store("PT_KNP_001", StoreChain.PANTALOONS, 26.4478, 80.3465),
                store("WS_LKO_001", StoreChain.WESTSIDE, 26.8523, 80.9456)));
    }

    @AfterEach
    void tearDown() {
        workers.shutdown();
    }

    @Test
    void testPublishesOneGenerationForAllOwnStores() {
        job.run(JobContext.NEVER_STOPPED);

        ProximityGeneration generation = snapshotStore.latestProximity().orElseThrow();
        assertEquals(10.0, generation.radiusKm(), 1e-9);
        assertEquals(2, generation.recordsFor("VM_KNP_001").size());
        assertEquals("WS_LKO_001", generation.recordsFor("VM_LKO_001").get(0).competitorStoreId());
        // a store with no competitors nearby still has an entry
        assertTrue(generation.recordsFor("VM_JPR_001").isEmpty());
    }

    @Test
    void testStopRequestPublishesNothing() {
        job.run(() -> true);

        assertTrue(snapshotStore.latestProximity().isEmpty());
    }

    @Test
    void testGenerationIsImmutable() {
        job.run(JobContext.NEVER_STOPPED);

        ProximityGeneration generation = snapshotStore.latestProximity().orElseThrow();
        assertThrows(UnsupportedOperationException.class, () -> generation.recordsFor("VM_KNP_001").clear());
    }

    private static Store store(String id, StoreChain chain, double latitude, double longitude) {
        return Store.builder().id(id).name(id).chain(chain).latitude(latitude).longitude(longitude).build();
    }
}
