package com.taleforge.core.model;

import java.util.Optional;

/**
 * Kinds of roll a narrator may request.
 */
public enum RollKind {
    ABILITY_CHECK("ability_check"),
    SAVING_THROW("saving_throw"),
    ATTACK_ROLL("attack_roll"),
    DAMAGE_ROLL("damage_roll");

    private final String code;

    RollKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Whether this kind is resolved with a single d20.
     */
    public boolean usesD20() {
        return this != DAMAGE_ROLL;
    }

    public static Optional<RollKind> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        for (RollKind kind : values()) {
            if (kind.code.equals(code)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
