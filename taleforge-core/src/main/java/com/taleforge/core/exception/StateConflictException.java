package com.taleforge.core.exception;

import java.util.UUID;

/**
 * Thrown when a structural change to a campaign cannot proceed:
 * the campaign lock is held by another turn, the rewind target is
 * out of range, or the campaign has ended.
 */
public class StateConflictException extends TaleforgeException {

    public static final String ERROR_CODE = "STATE_CONFLICT";

    private final UUID campaignId;

    public StateConflictException(UUID campaignId, String reason) {
        super(ERROR_CODE, String.format(
            "Campaign %s: %s",
            campaignId, reason
        ));
        this.campaignId = campaignId;
    }

    public UUID getCampaignId() {
        return campaignId;
    }

    public static StateConflictException lockHeld(UUID campaignId) {
        return new StateConflictException(campaignId, "another turn or rewind is in progress");
    }

    public static StateConflictException campaignEnded(UUID campaignId) {
        return new StateConflictException(campaignId, "campaign has ended");
    }
}
