package com.taleforge.core.repository;

import com.taleforge.core.model.CanonicalCampaignState;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for cached canonical state snapshots.
 */
public interface SnapshotRepository {

    /**
     * Store a snapshot, superseding any existing snapshot at the same index.
     */
    void save(CanonicalCampaignState snapshot);

    /**
     * The snapshot with the highest turn index that is <= turnIndex.
     */
    Optional<CanonicalCampaignState> findLatestAtOrBefore(UUID campaignId, int turnIndex);

    List<CanonicalCampaignState> findByCampaign(UUID campaignId);

    /**
     * Delete every snapshot with turnIndex > afterIndex.
     *
     * @return number of snapshots deleted
     */
    int deleteAfter(UUID campaignId, int afterIndex);

    /**
     * Delete every snapshot of a campaign.
     *
     * @return number of snapshots deleted
     */
    int deleteAll(UUID campaignId);
}
