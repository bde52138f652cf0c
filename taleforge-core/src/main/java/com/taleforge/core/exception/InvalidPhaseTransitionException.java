package com.taleforge.core.exception;

import com.taleforge.core.model.TurnPhase;

/**
 * Thrown when a turn attempts an illegal phase transition.
 */
public class InvalidPhaseTransitionException extends TaleforgeException {

    public static final String ERROR_CODE = "INVALID_PHASE_TRANSITION";

    public InvalidPhaseTransitionException(TurnPhase currentPhase, TurnPhase targetPhase) {
        super(ERROR_CODE, String.format(
            "Cannot transition turn from %s to %s",
            currentPhase, targetPhase
        ));
    }
}
