package com.taleforge.engine.coordinator;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of a rewind.
 *
 * @param previousTurnIndex latest turn before the rewind
 * @param targetTurnIndex   latest turn after the rewind
 * @param removedTurns      indices of the deleted turn events, ascending
 * @param stateHash         hash of the rebuilt state at the target
 * @param warnings          problems that did not stop the rewind
 */
public record RewindResult(
    UUID campaignId,
    int previousTurnIndex,
    int targetTurnIndex,
    List<Integer> removedTurns,
    int snapshotsDeleted,
    int loreInvalidated,
    String stateHash,
    List<String> warnings
) {
    public RewindResult {
        removedTurns = removedTurns == null ? List.of() : List.copyOf(removedTurns);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static RewindResult noOp(UUID campaignId, int turnIndex, String stateHash) {
        return new RewindResult(campaignId, turnIndex, turnIndex, List.of(), 0, 0, stateHash, List.of());
    }

    public boolean isNoOp() {
        return removedTurns.isEmpty();
    }
}
