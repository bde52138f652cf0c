package com.taleforge.core.model;

import java.util.Optional;

/**
 * Category of a lore delta. Hard canon bypasses soft-lore compaction.
 */
public enum LoreType {
    HARD_CANON("hard_canon"),
    SOFT_LORE("soft_lore");

    private final String code;

    LoreType(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<LoreType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        for (LoreType type : values()) {
            if (type.code.equals(code)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
