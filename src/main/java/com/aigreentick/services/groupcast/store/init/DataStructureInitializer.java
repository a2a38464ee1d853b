package com.aigreentick.services.groupcast.store.init;

import java.util.List;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import com.aigreentick.services.groupcast.settings.service.SettingsService;
import com.aigreentick.services.groupcast.statistics.model.Statistics;
import com.aigreentick.services.groupcast.store.enums.CollectionName;
import com.aigreentick.services.groupcast.store.repository.StoredDocumentRepository;
import com.aigreentick.services.groupcast.store.service.PersistenceGateway;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Seeds every collection that has never been written, so readers always find a document.
 */
@Slf4j
@Component
@Order(0)
@RequiredArgsConstructor
public class DataStructureInitializer implements ApplicationRunner {

    private final StoredDocumentRepository storedDocumentRepository;
    private final PersistenceGateway persistenceGateway;
    private final SettingsService settingsService;

    @Override
    public void run(ApplicationArguments args) {
        seed(CollectionName.CAMPAIGNS, List.of());
        seed(CollectionName.GROUPS, List.of());
        seed(CollectionName.STATISTICS, Statistics.empty());
        seed(CollectionName.SETTINGS, settingsService.defaults());
    }

    private void seed(CollectionName collection, Object initial) {
        if (storedDocumentRepository.existsById(collection.getKey())) {
            return;
        }
        if (!persistenceGateway.write(collection, initial)) {
            throw new IllegalStateException("Could not initialize collection " + collection.getKey());
        }
        log.info("Initialized collection {}", collection.getKey());
    }
}
