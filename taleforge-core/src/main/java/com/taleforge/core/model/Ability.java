package com.taleforge.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The six ability scores.
 */
public enum Ability {
    STR("str"),
    DEX("dex"),
    CON("con"),
    INT("int"),
    WIS("wis"),
    CHA("cha");

    private final String code;

    Ability(String code) {
        this.code = code;
    }

    /**
     * Short wire code, e.g. "dex".
     */
    public String code() {
        return code;
    }

    /**
     * Resolve a wire code, ignoring case and surrounding whitespace.
     */
    public static Optional<Ability> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (Ability ability : values()) {
            if (ability.code.equals(normalized)) {
                return Optional.of(ability);
            }
        }
        return Optional.empty();
    }
}
