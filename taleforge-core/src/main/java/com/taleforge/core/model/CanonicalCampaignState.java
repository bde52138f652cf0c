package com.taleforge.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Cached snapshot of the canonical state at a turn index.
 * Snapshots bound replay cost and are never required for correctness.
 *
 * Primary Key: snapshotId
 * Unique Constraint: (campaignId, turnIndex)
 *
 * Invariants:
 * - never mutated, only superseded or deleted by rewind
 * - stateHash equals the canonical hash of state
 */
public record CanonicalCampaignState(
    UUID snapshotId,
    UUID campaignId,
    int turnIndex,
    CampaignState state,
    String stateHash,
    Instant createdAt
) {
    public static CanonicalCampaignState of(CampaignState state, String stateHash) {
        return new CanonicalCampaignState(
            UUID.randomUUID(),
            state.campaignId(),
            state.turnIndex(),
            state,
            stateHash,
            Instant.now()
        );
    }
}
