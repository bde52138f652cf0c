package com.taleforge.core.exception;

/**
 * Thrown when a patch operation cannot be applied to a state document.
 */
public class PatchApplicationException extends TaleforgeException {

    public static final String ERROR_CODE = "PATCH_APPLICATION_FAILED";

    private final String path;

    public PatchApplicationException(String path, String reason) {
        super(ERROR_CODE, String.format(
            "Cannot apply patch at %s: %s",
            path, reason
        ));
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
