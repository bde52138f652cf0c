package com.taleforge.core.exception;

import java.util.UUID;

/**
 * Thrown when the stored turn log cannot be replayed: a gap in the
 * index sequence, or a stored patch that no longer applies.
 */
public class StateReplayException extends TaleforgeException {

    public static final String ERROR_CODE = "STATE_REPLAY_FAILED";

    public StateReplayException(UUID campaignId, int turnIndex, String reason) {
        super(ERROR_CODE, String.format(
            "Cannot replay campaign %s at turn %d: %s",
            campaignId, turnIndex, reason
        ));
    }

    public StateReplayException(UUID campaignId, int turnIndex, Throwable cause) {
        super(ERROR_CODE, String.format(
            "Cannot replay campaign %s at turn %d: %s",
            campaignId, turnIndex, cause.getMessage()
        ), cause);
    }
}
