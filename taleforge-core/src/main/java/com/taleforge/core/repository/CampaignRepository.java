package com.taleforge.core.repository;

import com.taleforge.core.model.Campaign;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for Campaign aggregates.
 */
public interface CampaignRepository {

    /**
     * Insert or update a campaign.
     */
    void save(Campaign campaign);

    Optional<Campaign> findById(UUID campaignId);
}
