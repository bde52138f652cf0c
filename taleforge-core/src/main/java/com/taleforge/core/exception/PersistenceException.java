package com.taleforge.core.exception;

/**
 * Thrown when a durable write fails. Fatal to the turn in progress;
 * the caller may retry with the same inputs.
 */
public class PersistenceException extends TaleforgeException {

    public static final String ERROR_CODE = "PERSISTENCE_FAILED";
    public static final String DUPLICATE_CODE = "DUPLICATE_TURN_INDEX";

    public PersistenceException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }

    private PersistenceException(String errorCode, String message) {
        super(errorCode, message);
    }

    public static PersistenceException duplicateTurn(Object campaignId, int turnIndex) {
        return new PersistenceException(DUPLICATE_CODE, String.format(
            "Turn %d already exists for campaign %s",
            turnIndex, campaignId
        ));
    }
}
