package com.taleforge.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.UUID;

/**
 * Full game state of a campaign at one turn index.
 *
 * The document holds two roots, {@code party} and {@code world}, plus
 * a read-only {@code rules} section derived from campaign configuration.
 * The universe clock is carried separately.
 *
 * Invariants:
 * - turnIndex >= 0 (0 is the initial state)
 * - the document is never shared: construction and {@link #mutableDocument()} copy it
 */
public record CampaignState(
    UUID campaignId,
    int turnIndex,
    UniverseTime universeTime,
    ObjectNode document
) {
    public static final String PARTY = "party";
    public static final String WORLD = "world";
    public static final String RULES = "rules";

    public CampaignState {
        if (turnIndex < 0) {
            throw new IllegalArgumentException("turnIndex must be >= 0: " + turnIndex);
        }
        if (universeTime == null) {
            throw new IllegalArgumentException("universeTime is required");
        }
        document = document != null ? document.deepCopy() : JsonNodeFactory.instance.objectNode();
    }

    /**
     * A private copy of the document that may be modified freely.
     */
    public ObjectNode mutableDocument() {
        return document.deepCopy();
    }

    public JsonNode party() {
        return document.path(PARTY);
    }

    public JsonNode world() {
        return document.path(WORLD);
    }

    /**
     * The player character inside the party root.
     */
    public JsonNode player() {
        return party().path("player");
    }

    /**
     * Copy of this state at a new index, clock and document.
     */
    public CampaignState advance(int newTurnIndex, UniverseTime newTime, ObjectNode newDocument) {
        return new CampaignState(campaignId, newTurnIndex, newTime, newDocument);
    }
}
