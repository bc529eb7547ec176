package com.retail.storeintel.service;

import com.retail.storeintel.config.GeoProperties;
import com.retail.storeintel.dto.CompetitionSummary;
import com.retail.storeintel.entity.Store;
import com.retail.storeintel.entity.StoreChain;
import com.retail.storeintel.exception.StoreNotFoundException;
import com.retail.storeintel.exception.ValidationException;
import com.retail.storeintel.repository.StoreRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class StoreRegistryServiceTest {

    private StoreRepository storeRepository;
    private StoreRegistryService registry;

    @BeforeEach
    void setUp() {
        storeRepository = mock(StoreRepository.class);
        when(storeRepository.save(any(Store.class))).thenAnswer(invocation -> invocation.getArgument(0));
        registry = new StoreRegistryService(storeRepository, new GeoProperties());
    }

    @Test
    void testRegisterValidStore() {
        Store saved = registry.register(store("VM_IND_001", 22.7196, 75.8577));

        assertEquals("VM_IND_001", saved.getId());
        verify(storeRepository).save(any(Store.class));
    }

    @Test
    void testCoordinatesOutsideRegionAreRejected() {
        // London
        Store outside = store("VM_LON_001", 51.5074, -0.1278);

        assertThrows(ValidationException.class, () -> registry.register(outside));
        verify(storeRepository, never()).save(any());
    }

    @Test
    void testInvalidCoordinatesAreRejected() {
        assertThrows(ValidationException.class, () -> registry.register(store("VM_X", 95.0, 80.0)));
        assertThrows(ValidationException.class, () -> registry.register(store("VM_Y", null, 80.0)));
    }

    @Test
    void testMissingFieldsAreRejected() {
        Store noChain = store("VM_Z", 26.0, 80.0);
        noChain.setChain(null);

        assertThrows(ValidationException.class, () -> registry.register(noChain));
        assertThrows(ValidationException.class, () -> registry.register(store(" ", 26.0, 80.0)));
    }

    @Test
    void testDuplicateIdIsRejected() {
        when(storeRepository.existsById("VM_KNP_001")).thenReturn(true);

        assertThrows(ValidationException.class, () -> registry.register(store("VM_KNP_001", 26.4499, 80.3319)));
    }

    @Test
    void testRegisterMissingSkipsExistingAndInvalid() {
        when(storeRepository.existsById("VM_KNP_001")).thenReturn(true);

        int added = registry.registerMissing(List.of(
                store("VM_KNP_001", 26.4499, 80.3319),
                store("VM_LON_001", 51.5074, -0.1278),
                store("VM_LKO_001", 26.8467, 80.9462)));

        assertEquals(1, added);
    }

    @Test
    void testDeactivateKeepsStoreButMarksInactive() {
        Store store = store("VM_KNP_001", 26.4499, 80.3319);
        when(storeRepository.findById("VM_KNP_001")).thenReturn(Optional.of(store));

        Store result = registry.deactivate("VM_KNP_001");

        assertFalse(result.isActiveStore());
        verify(storeRepository, never()).delete(any());
    }

    @Test
    void testUnknownStoreIsNotFound() {
        when(storeRepository.findById("NOPE")).thenReturn(Optional.empty());

        StoreNotFoundException e = assertThrows(StoreNotFoundException.class, () -> registry.getStore("NOPE"));
        assertEquals("NOPE", e.getStoreId());
    }

    @Test
    void testCompetitorsByChainLabel() {
        when(storeRepository.findByChainAndActiveTrueOrderByIdAsc(StoreChain.RELIANCE_TRENDS)).thenReturn(List.of());

        assertTrue(registry.findCompetitorStores("Reliance Trends").isEmpty());
        verify(storeRepository).findByChainAndActiveTrueOrderByIdAsc(StoreChain.RELIANCE_TRENDS);
        assertThrows(ValidationException.class, () -> registry.findCompetitorStores("V-Mart"));
        assertThrows(ValidationException.class, () -> registry.findCompetitorStores("Unknown Mart"));
    }

    @Test
    void testCompetitionSummary() {
        when(storeRepository.countCompetitorsByChain(StoreChain.V_MART)).thenReturn(List.of(
                new Object[]{StoreChain.ZUDIO, 4L},
                new Object[]{StoreChain.PANTALOONS, 6L}));
        when(storeRepository.countByCityForChain(StoreChain.V_MART)).thenReturn(List.of(
                new Object[]{"Lucknow", 3L},
                new Object[]{"Kanpur", 2L}));
        when(storeRepository.countByChainAndActiveTrue(StoreChain.V_MART)).thenReturn(5L);

        CompetitionSummary summary = registry.competitionSummary();

        assertEquals(5, summary.getTotalOwnStores());
        assertEquals(10, summary.getTotalCompetitorStores());
        assertEquals(6L, summary.getCompetitorsByChain().get(StoreChain.PANTALOONS));
        assertEquals("Lucknow", summary.getTopCities().get(0).city());
        assertEquals(2, summary.getUniqueCities());
    }

    private static Store store(String id, Double latitude, Double longitude) {
        return Store.builder()
                .id(id)
                .name("Store " + id)
                .chain(StoreChain.V_MART)
                .latitude(latitude)
                .longitude(longitude)
                .city("Kanpur")
                .build();
    }
}
