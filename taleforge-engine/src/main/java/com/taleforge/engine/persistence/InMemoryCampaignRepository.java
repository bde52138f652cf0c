package com.taleforge.engine.persistence;

import com.taleforge.core.model.Campaign;
import com.taleforge.core.repository.CampaignRepository;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of CampaignRepository.
 */
public class InMemoryCampaignRepository implements CampaignRepository {

    private final Map<UUID, Campaign> campaigns = new ConcurrentHashMap<>();

    @Override
    public void save(Campaign campaign) {
        campaigns.put(campaign.campaignId(), campaign);
    }

    @Override
    public Optional<Campaign> findById(UUID campaignId) {
        return Optional.ofNullable(campaigns.get(campaignId));
    }
}
