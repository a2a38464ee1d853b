package com.aigreentick.services.groupcast.campaign.repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

import org.springframework.stereotype.Repository;

import com.aigreentick.services.groupcast.campaign.model.Campaign;
import com.aigreentick.services.groupcast.store.enums.CollectionName;
import com.aigreentick.services.groupcast.store.service.PersistenceException;
import com.aigreentick.services.groupcast.store.service.PersistenceGateway;
import com.fasterxml.jackson.core.type.TypeReference;

import lombok.RequiredArgsConstructor;

/**
 * Campaign list stored as one document. All mutations are serialized here
 * so concurrent read-modify-write cycles cannot lose updates.
 */
@Repository
@RequiredArgsConstructor
public class CampaignStore {

    private static final TypeReference<List<Campaign>> CAMPAIGN_LIST_TYPE = new TypeReference<>() {
    };

    private final PersistenceGateway persistenceGateway;

    public synchronized List<Campaign> findAll() {
        return load();
    }

    public synchronized Optional<Campaign> findById(String id) {
        return load().stream().filter(c -> c.getId().equals(id)).findFirst();
    }

    public synchronized Campaign save(Campaign campaign) {
        List<Campaign> campaigns = load();
        campaigns.removeIf(c -> c.getId().equals(campaign.getId()));
        campaigns.add(campaign);
        persist(campaigns);
        return campaign;
    }

    /**
     * Applies {@code mutation} to the stored campaign and writes the list back.
     *
     * @return the updated campaign, or empty if no campaign has this id
     */
    public synchronized Optional<Campaign> update(String id, Consumer<Campaign> mutation) {
        List<Campaign> campaigns = load();
        for (Campaign campaign : campaigns) {
            if (campaign.getId().equals(id)) {
                mutation.accept(campaign);
                persist(campaigns);
                return Optional.of(campaign);
            }
        }
        return Optional.empty();
    }

    public synchronized boolean delete(String id) {
        List<Campaign> campaigns = load();
        boolean removed = campaigns.removeIf(c -> c.getId().equals(id));
        if (removed) {
            persist(campaigns);
        }
        return removed;
    }

    private List<Campaign> load() {
        return new ArrayList<>(persistenceGateway.read(CollectionName.CAMPAIGNS, CAMPAIGN_LIST_TYPE)
                .orElseGet(List::of));
    }

    private void persist(List<Campaign> campaigns) {
        if (!persistenceGateway.write(CollectionName.CAMPAIGNS, campaigns)) {
            throw new PersistenceException("Failed to save campaigns", null);
        }
    }
}
