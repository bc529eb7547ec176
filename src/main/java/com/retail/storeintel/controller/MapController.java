package com.retail.storeintel.controller;

import com.retail.storeintel.dto.ProximityRecord;
import com.retail.storeintel.entity.Store;
import com.retail.storeintel.service.StoreInsightQueryService;
import com.retail.storeintel.service.StoreRegistryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/map")
@RequiredArgsConstructor
@Tag(name = "Map API", description = "Bulk store and competitor data for map rendering")
public class MapController {

    private final StoreRegistryService storeRegistry;
    private final StoreInsightQueryService queryService;

    @GetMapping("/stores")
    @Operation(summary = "All active own-brand stores with coordinates")
    public ResponseEntity<List<Store>> getOwnStores() {
        return ResponseEntity.ok(storeRegistry.findOwnStores());
    }

    @GetMapping("/competitors")
    @Operation(summary = "Active competitor stores with coordinates, optionally for one chain")
    public ResponseEntity<List<Store>> getCompetitors(
            @Parameter(description = "Chain name, e.g. Zudio") @RequestParam(required = false) String chain) {
        List<Store> stores = chain == null
                ? storeRegistry.findCompetitorStores()
                : storeRegistry.findCompetitorStores(chain);
        return ResponseEntity.ok(stores);
    }

    @GetMapping("/proximity")
    @Operation(summary = "Store to competitor pairs from the latest proximity recompute")
    public ResponseEntity<List<ProximityRecord>> getProximity() {
        return ResponseEntity.ok(queryService.latestProximityRecords());
    }
}
