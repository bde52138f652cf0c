package com.taleforge.engine.lore;

import com.taleforge.core.model.LoreDelta;

import java.util.List;
import java.util.UUID;

/**
 * Receiver of the lore emitted by committed turns.
 * Entries are keyed by their source turn so that rewind can drop them.
 */
public interface LoreSink {

    /**
     * Record the validated lore deltas of a committed turn.
     *
     * @param campaignId The campaign
     * @param turnIndex  Index of the source turn
     * @param eventId    Identifier of the source TurnEvent
     * @param deltas     Lore in emission order
     */
    void publish(UUID campaignId, int turnIndex, UUID eventId, List<LoreDelta> deltas);

    /**
     * Invalidate every lore entry whose source turn is after turnIndex.
     *
     * @return number of entries invalidated
     */
    int invalidateAfter(UUID campaignId, int turnIndex);
}
