package com.taleforge.core.model;

/**
 * Lifecycle status of a campaign.
 */
public enum CampaignStatus {
    ACTIVE,
    PAUSED,
    ENDED;

    /**
     * Ended campaigns accept no further turns or rewinds.
     */
    public boolean acceptsChanges() {
        return this != ENDED;
    }
}
