package com.taleforge.engine.history;

import java.util.List;
import java.util.UUID;

/**
 * Result of re-deriving every turn of a campaign from its initial state.
 *
 * @param turnsChecked       number of turns whose hash was recomputed
 * @param mismatchedTurns    indices whose recomputed hash differs from the stored one
 * @param brokenAtTurn       index where replay could not continue, or null
 * @param failure            why replay stopped, or null
 */
public record IntegrityReport(
    UUID campaignId,
    int turnsChecked,
    List<Integer> mismatchedTurns,
    Integer brokenAtTurn,
    String failure
) {
    public IntegrityReport {
        mismatchedTurns = mismatchedTurns == null ? List.of() : List.copyOf(mismatchedTurns);
    }

    public boolean intact() {
        return mismatchedTurns.isEmpty() && brokenAtTurn == null;
    }
}
