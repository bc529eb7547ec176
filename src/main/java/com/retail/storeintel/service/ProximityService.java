package com.retail.storeintel.service;

import com.retail.storeintel.dto.ProximityRecord;
import com.retail.storeintel.entity.Store;
import com.retail.storeintel.exception.StoreNotFoundException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Resolves store ids and runs radius queries against the active competitor set.
 */
@Service
@RequiredArgsConstructor
public class ProximityService {

    private final StoreRegistryService storeRegistry;
    private final GeoProximityEngine engine;
    private final Clock clock;

    /**
     * @throws com.retail.storeintel.exception.ValidationException if the radius is not positive
     * @throws StoreNotFoundException                              if the store is unknown
     */
    public List<ProximityRecord> findWithinRadius(String storeId, double radiusKm) {
        engine.validateRadius(radiusKm);
        Store origin = storeRegistry.getStore(storeId);
        return engine.findWithinRadius(origin, storeRegistry.findCompetitorStores(), radiusKm, clock.instant());
    }
}
