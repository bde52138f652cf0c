package com.taleforge.core.model;

/**
 * Phases a single turn moves through.
 * Transitions are linear; FAILED is reachable from any non-terminal phase.
 */
public enum TurnPhase {
    /**
     * Turn request accepted, nothing gathered yet.
     * Transitions: -> CONTEXT_BUILT, FAILED
     */
    INITIALIZED,

    /**
     * Prior state and narrator context gathered.
     * Transitions: -> PROPOSAL_RECEIVED, FAILED
     */
    CONTEXT_BUILT,

    /**
     * Narrator response parsed into narrative and payload.
     * Transitions: -> MECHANICS_EXECUTED, FAILED
     */
    PROPOSAL_RECEIVED,

    /**
     * Every roll request executed, including ones that reported an error.
     * Transitions: -> FINAL_RESPONSE, FAILED
     */
    MECHANICS_EXECUTED,

    /**
     * Narrative and roll outcomes merged into the response payload.
     * Transitions: -> VALIDATED, FAILED
     */
    FINAL_RESPONSE,

    /**
     * Output validation passed with zero errors.
     * Transitions: -> PERSISTED, FAILED
     */
    VALIDATED,

    /**
     * Turn record and state hash durably written. Terminal state.
     */
    PERSISTED,

    /**
     * Turn aborted with a typed reason. Terminal state.
     */
    FAILED;

    public boolean isTerminal() {
        return this == PERSISTED || this == FAILED;
    }

    /**
     * Check if this phase can transition to the target phase.
     */
    public boolean canTransitionTo(TurnPhase target) {
        if (isTerminal()) {
            return false;
        }
        if (target == FAILED) {
            return true;
        }
        return switch (this) {
            case INITIALIZED -> target == CONTEXT_BUILT;
            case CONTEXT_BUILT -> target == PROPOSAL_RECEIVED;
            case PROPOSAL_RECEIVED -> target == MECHANICS_EXECUTED;
            case MECHANICS_EXECUTED -> target == FINAL_RESPONSE;
            case FINAL_RESPONSE -> target == VALIDATED;
            case VALIDATED -> target == PERSISTED;
            case PERSISTED, FAILED -> false;
        };
    }
}
