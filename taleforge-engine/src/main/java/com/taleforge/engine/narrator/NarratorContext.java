package com.taleforge.engine.narrator;

import com.taleforge.core.model.Campaign;
import com.taleforge.core.model.CampaignState;
import com.taleforge.core.model.TurnEvent;

import java.util.List;

/**
 * Everything the narrator is shown for one turn.
 *
 * Invariants:
 * - state is the canonical state before the turn
 * - turnIndex == state.turnIndex() + 1
 * - recentTurns are in ascending turn order
 */
public record NarratorContext(
    Campaign campaign,
    CampaignState state,
    int turnIndex,
    String playerInput,
    String universeTimeLabel,
    List<TurnEvent> recentTurns
) {
    public NarratorContext {
        recentTurns = recentTurns == null ? List.of() : List.copyOf(recentTurns);
    }
}
