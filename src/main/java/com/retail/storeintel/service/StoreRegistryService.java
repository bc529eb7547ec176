package com.retail.storeintel.service;

import com.retail.storeintel.config.GeoProperties;
import com.retail.storeintel.dto.CompetitionSummary;
import com.retail.storeintel.entity.Store;
import com.retail.storeintel.entity.StoreChain;
import com.retail.storeintel.exception.StoreNotFoundException;
import com.retail.storeintel.exception.ValidationException;
import com.retail.storeintel.repository.StoreRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Store directory: registration with coordinate validation, lookups and
 * network-level counts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StoreRegistryService {

    private static final int TOP_CITY_LIMIT = 10;

    private final StoreRepository storeRepository;
    private final GeoProperties geoProperties;

    /**
     * @throws ValidationException if required fields are missing or the coordinates
     *                             fall outside the configured bounding box
     */
    @Transactional
    public Store register(Store store) {
        validate(store);
        if (storeRepository.existsById(store.getId())) {
            throw new ValidationException("Store already registered: " + store.getId());
        }
        Store saved = storeRepository.save(store);
        log.info("STORE REGISTERED: {} ({}, {})", saved.getId(), saved.getChain(), saved.getCity());
        return saved;
    }

    /**
     * Registers every store not already present. Invalid entries are logged and skipped.
     *
     * @return number of stores added
     */
    @Transactional
    public int registerMissing(Collection<Store> stores) {
        int added = 0;
        for (Store store : stores) {
            if (store.getId() != null && storeRepository.existsById(store.getId())) {
                continue;
            }
            try {
                register(store);
                added++;
            } catch (ValidationException e) {
                log.warn("STORE SKIPPED: {}", e.getMessage());
            }
        }
        return added;
    }

    public Store getStore(String storeId) {
        return storeRepository.findById(storeId)
                .orElseThrow(() -> new StoreNotFoundException(storeId));
    }

    @Transactional
    public Store deactivate(String storeId) {
        Store store = getStore(storeId);
        store.setActive(false);
        log.info("STORE DEACTIVATED: {}", storeId);
        return storeRepository.save(store);
    }

    public List<Store> findOwnStores() {
        return storeRepository.findByChainAndActiveTrueOrderByIdAsc(StoreChain.V_MART);
    }

    public List<Store> findCompetitorStores() {
        return storeRepository.findByChainNotAndActiveTrueOrderByIdAsc(StoreChain.V_MART);
    }

    /**
     * @param chainLabel enum name or display name, e.g. "Zudio" or "RELIANCE_TRENDS"
     * @throws ValidationException if the label is not a competitor chain
     */
    public List<Store> findCompetitorStores(String chainLabel) {
        StoreChain chain;
        try {
            chain = StoreChain.fromLabel(chainLabel);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage(), e);
        }
        if (chain.isOwnBrand()) {
            throw new ValidationException(chain.getDisplayName() + " is not a competitor chain");
        }
        return storeRepository.findByChainAndActiveTrueOrderByIdAsc(chain);
    }

    public List<Store> findByCity(String city) {
        if (city == null || city.isBlank()) {
            throw new ValidationException("City is required");
        }
        return storeRepository.findByCityIgnoreCaseAndActiveTrueOrderByIdAsc(city.trim());
    }

    public CompetitionSummary competitionSummary() {
        Map<StoreChain, Long> byChain = new EnumMap<>(StoreChain.class);
        for (Object[] row : storeRepository.countCompetitorsByChain(StoreChain.V_MART)) {
            byChain.put((StoreChain) row[0], ((Number) row[1]).longValue());
        }

        List<Object[]> cityRows = storeRepository.countByCityForChain(StoreChain.V_MART);
        List<CompetitionSummary.CityCount> topCities = cityRows.stream()
                .limit(TOP_CITY_LIMIT)
                .map(row -> new CompetitionSummary.CityCount((String) row[0], ((Number) row[1]).longValue()))
                .collect(Collectors.toList());

        long competitorTotal = byChain.values().stream().mapToLong(Long::longValue).sum();
        return CompetitionSummary.builder()
                .totalOwnStores(storeRepository.countByChainAndActiveTrue(StoreChain.V_MART))
                .totalCompetitorStores(competitorTotal)
                .competitorsByChain(byChain)
                .topCities(topCities)
                .uniqueCities(cityRows.size())
                .build();
    }

    private void validate(Store store) {
        if (store == null) {
            throw new ValidationException("Store is required");
        }
        if (store.getId() == null || store.getId().isBlank()) {
            throw new ValidationException("Store id is required");
        }
        if (store.getName() == null || store.getName().isBlank()) {
            throw new ValidationException("Store name is required for " + store.getId());
        }
        if (store.getChain() == null) {
            throw new ValidationException("Store chain is required for " + store.getId());
        }
        validateCoordinates(store.getId(), store.getLatitude(), store.getLongitude());
    }

    void validateCoordinates(String storeId, Double latitude, Double longitude) {
        if (latitude == null || longitude == null || latitude.isNaN() || longitude.isNaN()) {
            throw new ValidationException("Coordinates are required for " + storeId);
        }
        if (latitude < -90 || latitude > 90 || longitude < -180 || longitude > 180) {
            throw new ValidationException(String.format(
                    "Coordinates out of range for %s: (%s, %s)", storeId, latitude, longitude));
        }
        if (!geoProperties.contains(latitude, longitude)) {
            throw new ValidationException(String.format(
                    "Coordinates for %s lie outside the supported region: (%s, %s)", storeId, latitude, longitude));
        }
    }
}
