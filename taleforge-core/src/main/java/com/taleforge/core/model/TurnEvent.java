package com.taleforge.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Immutable record of one committed turn.
 * Append-only log entry and the unit of replay.
 *
 * Primary Key: eventId
 * Unique Constraint: (campaignId, turnIndex)
 *
 * Invariants:
 * - turnIndex >= 1; indices per campaign are gap-free and strictly increasing
 * - stateHash is the canonical hash of the state after applying patch
 * - never mutated; only rewind deletes trailing events
 */
public record TurnEvent(
    // Primary key
    UUID eventId,

    // Ordering
    UUID campaignId,
    int turnIndex,

    // Exchange
    String playerInput,
    String narratorText,

    // Mechanics
    JsonNode rollSpec,
    List<RollResult> rollResults,
    long diceSeed,

    // State transition
    StatePatch patch,
    String stateHash,
    UniverseTime universeTimeAfter,

    // Derived data
    List<LoreDelta> loreDeltas,

    Instant createdAt
) {
    public TurnEvent {
        if (turnIndex < 1) {
            throw new IllegalArgumentException("turnIndex must be >= 1: " + turnIndex);
        }
        rollResults = rollResults == null ? List.of() : List.copyOf(rollResults);
        loreDeltas = loreDeltas == null ? List.of() : List.copyOf(loreDeltas);
        patch = patch != null ? patch : StatePatch.EMPTY;
    }

    public static TurnEvent create(
            UUID campaignId,
            int turnIndex,
            String playerInput,
            String narratorText,
            JsonNode rollSpec,
            List<RollResult> rollResults,
            long diceSeed,
            StatePatch patch,
            String stateHash,
            UniverseTime universeTimeAfter,
            List<LoreDelta> loreDeltas) {
        return new TurnEvent(
            UUID.randomUUID(),
            campaignId,
            turnIndex,
            playerInput,
            narratorText,
            rollSpec,
            rollResults,
            diceSeed,
            patch,
            stateHash,
            universeTimeAfter,
            loreDeltas,
            Instant.now()
        );
    }
}
