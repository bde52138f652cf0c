package com.taleforge.core.model;

/**
 * A single validation problem tied to a field path.
 *
 * @param path    location in the payload, e.g. {@code roll_requests[1].dc}
 * @param code    machine-readable upper-snake code, e.g. {@code INVALID_DC}
 * @param message human-readable description
 */
public record FieldError(
    String path,
    String code,
    String message
) {
    @Override
    public String toString() {
        return path + ": " + message + " [" + code + "]";
    }
}
