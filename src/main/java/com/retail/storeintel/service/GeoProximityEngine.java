package com.retail.storeintel.service;

import com.retail.storeintel.dto.GeoPoint;
import com.retail.storeintel.dto.ProximityRecord;
import com.retail.storeintel.entity.Store;
import com.retail.storeintel.entity.StoreChain;
import com.retail.storeintel.exception.ValidationException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;

/**
 * Great-circle distance and radius queries over store coordinates.
 * Holds no state; safe to call from any number of worker threads.
 */
@Component
public class GeoProximityEngine {

    public static final double EARTH_RADIUS_KM = 6371.0;

    private static final Comparator<ProximityRecord> BY_DISTANCE_THEN_ID =
            Comparator.comparingDouble(ProximityRecord::distanceKm)
                    .thenComparing(ProximityRecord::competitorStoreId);

    /**
     * Haversine distance in kilometres.
     */
    public double distance(GeoPoint a, GeoPoint b) {
        if (a == null || b == null || !a.isValid() || !b.isValid()) {
            throw new ValidationException("Invalid coordinates: " + a + ", " + b);
        }
        double lat1 = Math.toRadians(a.latitude());
        double lat2 = Math.toRadians(b.latitude());
        double dLat = lat2 - lat1;
        double dLon = Math.toRadians(b.longitude() - a.longitude());

        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        // rounding can push h a hair outside [0, 1] for antipodal points
        h = Math.min(1.0, Math.max(0.0, h));
        return 2 * EARTH_RADIUS_KM * Math.asin(Math.sqrt(h));
    }

    public double distance(Store a, Store b) {
        return distance(pointOf(a), pointOf(b));
    }

    /**
     * Candidates within {@code radiusKm} of {@code origin} (inclusive), ascending by
     * distance with ties broken by competitor id. The origin itself is never returned.
     *
     * @throws ValidationException if the radius is not a positive finite number
     */
    public List<ProximityRecord> findWithinRadius(Store origin, Collection<Store> candidates,
                                                  double radiusKm, Instant computedAt) {
        validateRadius(radiusKm);
        GeoPoint from = pointOf(origin);

        List<ProximityRecord> matches = new ArrayList<>();
        for (Store candidate : candidates) {
            if (candidate.getId().equals(origin.getId())) {
                continue;
            }
            double km = distance(from, pointOf(candidate));
            if (km <= radiusKm) {
                matches.add(new ProximityRecord(origin.getId(), candidate.getId(),
                        candidate.getChain(), km, computedAt));
            }
        }
        matches.sort(BY_DISTANCE_THEN_ID);
        return matches;
    }

    /**
     * Competitor counts per chain. Chains with no records are left out.
     */
    public Map<StoreChain, Long> groupByChain(Collection<ProximityRecord> records) {
        Map<StoreChain, Long> counts = new EnumMap<>(StoreChain.class);
        for (ProximityRecord record : records) {
            counts.merge(record.competitorChain(), 1L, Long::sum);
        }
        return counts;
    }

    public Optional<ProximityRecord> nearest(Collection<ProximityRecord> records) {
        return records.stream().min(BY_DISTANCE_THEN_ID);
    }

    public void validateRadius(double radiusKm) {
        if (Double.isNaN(radiusKm) || Double.isInfinite(radiusKm) || radiusKm <= 0) {
            throw new ValidationException("Radius must be a positive number of kilometres, got " + radiusKm);
        }
    }

    private GeoPoint pointOf(Store store) {
        if (store.getLatitude() == null || store.getLongitude() == null) {
            throw new ValidationException("Store " + store.getId() + " has no coordinates");
        }
        return new GeoPoint(store.getLatitude(), store.getLongitude());
    }
}
