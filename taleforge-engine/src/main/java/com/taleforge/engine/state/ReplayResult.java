package com.taleforge.engine.state;

import com.taleforge.core.model.CampaignState;

/**
 * Outcome of reconstructing state at a turn index.
 *
 * @param snapshotIndex  index of the snapshot replay started from, or null when it started from turn 0
 * @param turnsReplayed  number of stored patches re-applied
 * @param stateHash      canonical hash of the reconstructed state
 * @param storedHash     hash recorded on the turn event at the target index, null for index 0
 */
public record ReplayResult(
    CampaignState state,
    Integer snapshotIndex,
    int turnsReplayed,
    String stateHash,
    String storedHash
) {
    public int turnIndex() {
        return state.turnIndex();
    }

    public boolean fromSnapshot() {
        return snapshotIndex != null;
    }

    /**
     * Whether the reconstructed hash agrees with the logged one. Always true at index 0.
     */
    public boolean hashMatches() {
        return storedHash == null || storedHash.equals(stateHash);
    }
}
