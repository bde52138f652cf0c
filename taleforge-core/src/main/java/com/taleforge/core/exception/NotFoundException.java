package com.taleforge.core.exception;

/**
 * Thrown when a campaign or turn is not found.
 */
public class NotFoundException extends TaleforgeException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format(
            "%s not found: %s",
            entityType, entityId
        ));
    }
}
