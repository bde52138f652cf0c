package com.taleforge.core.model;

/**
 * How the narrator is told to treat failed checks.
 */
public enum FailureStyle {
    /** Failure advances the story with a complication. */
    FAIL_FORWARD,
    /** Failure is applied strictly by the rules as written. */
    STRICT_RAW
}
