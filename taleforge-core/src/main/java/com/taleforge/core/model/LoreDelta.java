package com.taleforge.core.model;

import java.util.List;
import java.util.Optional;

/**
 * A piece of lore emitted by a turn, forwarded to the lore collaborator.
 * The type is kept as received; {@link #loreType()} resolves it.
 */
public record LoreDelta(
    String type,
    String text,
    List<String> tags,
    UniverseTime timeRef
) {
    public LoreDelta {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static LoreDelta of(LoreType type, String text, List<String> tags) {
        return new LoreDelta(type.code(), text, tags, null);
    }

    public Optional<LoreType> loreType() {
        return LoreType.fromCode(type);
    }
}
