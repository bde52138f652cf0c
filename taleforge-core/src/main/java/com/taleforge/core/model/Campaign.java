package com.taleforge.core.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;
import java.util.UUID;

/**
 * Aggregate root owning a campaign's turn log and snapshots.
 * Configuration here is read-only input to mechanics and validation;
 * the turn engine never mutates it.
 *
 * Primary Key: campaignId
 *
 * Invariants:
 * - initialParty and initialWorld are the state at turn index 0
 * - diceSeed is the base from which per-turn seeds are derived
 */
public record Campaign(
    UUID campaignId,
    String name,
    CampaignStatus status,

    // Configuration
    FailureStyle failureStyle,
    ContentRating contentRating,
    UniverseTime startUniverseTime,
    long diceSeed,

    // Turn 0 state
    ObjectNode initialParty,
    ObjectNode initialWorld,

    Instant createdAt
) {
    public Campaign {
        if (campaignId == null) {
            throw new IllegalArgumentException("campaignId is required");
        }
        status = status != null ? status : CampaignStatus.ACTIVE;
        failureStyle = failureStyle != null ? failureStyle : FailureStyle.FAIL_FORWARD;
        contentRating = contentRating != null ? contentRating : ContentRating.PG13;
        startUniverseTime = startUniverseTime != null ? startUniverseTime : UniverseTime.EPOCH;
        initialParty = initialParty != null ? initialParty.deepCopy() : JsonNodeFactory.instance.objectNode();
        initialWorld = initialWorld != null ? initialWorld.deepCopy() : JsonNodeFactory.instance.objectNode();
    }

    /**
     * Create a new active campaign.
     */
    public static Campaign create(
            String name,
            FailureStyle failureStyle,
            ContentRating contentRating,
            UniverseTime startUniverseTime,
            long diceSeed,
            ObjectNode initialParty,
            ObjectNode initialWorld) {
        return new Campaign(
            UUID.randomUUID(),
            name,
            CampaignStatus.ACTIVE,
            failureStyle,
            contentRating,
            startUniverseTime,
            diceSeed,
            initialParty,
            initialWorld,
            Instant.now()
        );
    }

    /**
     * Create a copy with updated status.
     */
    public Campaign withStatus(CampaignStatus newStatus) {
        return new Campaign(
            campaignId, name, newStatus, failureStyle, contentRating,
            startUniverseTime, diceSeed, initialParty, initialWorld, createdAt
        );
    }
}
