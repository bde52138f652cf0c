package com.taleforge.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Whether a d20 roll draws twice and keeps the higher or lower value.
 */
public enum AdvantageState {
    NONE("none"),
    ADVANTAGE("advantage"),
    DISADVANTAGE("disadvantage");

    private final String code;

    AdvantageState(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<AdvantageState> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (AdvantageState state : values()) {
            if (state.code.equals(normalized)) {
                return Optional.of(state);
            }
        }
        return Optional.empty();
    }
}
