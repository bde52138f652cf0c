package com.taleforge.engine.parser;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taleforge.core.model.ValidationResult;

/**
 * A narrator response split into narrative text and structured payload.
 *
 * @param narrative recovered narrative, never null, possibly empty
 * @param payload   the structured payload, or null when absent or malformed
 * @param problems  parse errors (malformed payload) and warnings (missing markers or payload)
 */
public record ParsedResponse(
    String narrative,
    ObjectNode payload,
    ValidationResult problems
) {
    public ParsedResponse {
        narrative = narrative == null ? "" : narrative;
        problems = problems == null ? ValidationResult.ok() : problems;
    }

    public boolean hasPayload() {
        return payload != null;
    }

    /**
     * True when a payload was present but could not be used.
     */
    public boolean hasErrors() {
        return !problems.valid();
    }
}
