package com.taleforge.engine.service;

import com.taleforge.core.model.Campaign;
import com.taleforge.core.model.CampaignState;
import com.taleforge.engine.coordinator.RewindResult;

import java.util.UUID;

/**
 * Core service for campaign turn processing.
 * Manages the campaign lifecycle, the turn log and rewinds.
 */
public interface TurnService {

    /**
     * Register a new campaign. Its initial state is turn index 0.
     *
     * @param campaign The campaign
     * @return The stored campaign
     */
    Campaign registerCampaign(Campaign campaign);

    /**
     * Get a campaign by ID.
     *
     * @throws com.taleforge.core.exception.NotFoundException if it does not exist
     */
    Campaign getCampaign(UUID campaignId);

    /**
     * Pause an active campaign. Paused campaigns accept rewinds but no turns.
     */
    Campaign pauseCampaign(UUID campaignId);

    /**
     * Resume a paused campaign.
     */
    Campaign resumeCampaign(UUID campaignId);

    /**
     * End a campaign. Ended campaigns accept no further turns or rewinds.
     */
    Campaign endCampaign(UUID campaignId);

    /**
     * Process one turn: ask the narrator, run mechanics, validate and commit.
     *
     * Content problems (malformed narrator output, invalid patches) produce a
     * FAILED result carrying every accumulated error. Caller faults are thrown.
     *
     * @param request The turn request
     * @return The outcome, PERSISTED or FAILED
     * @throws com.taleforge.core.exception.NotFoundException      if the campaign does not exist
     * @throws com.taleforge.core.exception.StateConflictException if the campaign is locked or not active
     */
    TurnResult submitTurn(TurnRequest request);

    /**
     * Truncate the turn log after targetTurnIndex.
     *
     * @throws com.taleforge.core.exception.StateConflictException if the target is beyond the latest
     *         turn, the campaign has ended or the campaign is locked
     */
    RewindResult rewind(UUID campaignId, int targetTurnIndex);

    /**
     * Canonical state after the latest committed turn.
     */
    CampaignState getCurrentState(UUID campaignId);

    /**
     * Request to process a turn.
     *
     * @param diceSeed explicit seed for this turn's dice, or null to derive it
     *                 from the campaign seed and the turn index
     */
    record TurnRequest(
        UUID campaignId,
        String playerInput,
        Long diceSeed
    ) {
        public TurnRequest {
            if (campaignId == null) {
                throw new IllegalArgumentException("campaignId is required");
            }
            playerInput = playerInput != null ? playerInput : "";
        }

        public static TurnRequest of(UUID campaignId, String playerInput) {
            return new TurnRequest(campaignId, playerInput, null);
        }
    }
}
