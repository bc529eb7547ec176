package com.retail.storeintel.init;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.retail.storeintel.entity.Store;
import com.retail.storeintel.repository.StoreRepository;
import com.retail.storeintel.service.StoreRegistryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Seeds own-brand and competitor stores from {@code data/initial-stores.json}.
 * Only runs in 'dev' profile and only into an empty store table.
 */
@Component
@Profile("dev")
@RequiredArgsConstructor
@Slf4j
public class StoreDataSeeder implements CommandLineRunner {

    static final String SEED_RESOURCE = "data/initial-stores.json";

    private final StoreRepository storeRepository;
    private final StoreRegistryService storeRegistry;
    private final ObjectMapper objectMapper;

    @Override
    public void run(String... args) throws IOException {
        if (storeRepository.count() > 0) {
            log.info("Database already has stores, skipping seeding");
            return;
        }

        List<Store> stores;
        try (InputStream in = new ClassPathResource(SEED_RESOURCE).getInputStream()) {
            stores = objectMapper.readValue(in, new TypeReference<List<Store>>() {});
        }

        int added = storeRegistry.registerMissing(stores);
        log.info("Seeded {} of {} stores from {}", added, stores.size(), SEED_RESOURCE);
    }
}
