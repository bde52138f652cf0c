package com.taleforge.engine.history;

import com.taleforge.core.model.TurnEvent;
import com.taleforge.core.model.UniverseTime;

import java.time.Instant;

/**
 * One line of a campaign's turn history, with shortened texts.
 */
public record TurnSummary(
    int turnIndex,
    String playerInputPreview,
    String narratorPreview,
    UniverseTime universeTime,
    String stateHash,
    Instant createdAt
) {
    public static final int PREVIEW_LENGTH = 100;

    public static TurnSummary of(TurnEvent event) {
        return new TurnSummary(
            event.turnIndex(),
            preview(event.playerInput()),
            preview(event.narratorText()),
            event.universeTimeAfter(),
            event.stateHash(),
            event.createdAt()
        );
    }

    static String preview(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= PREVIEW_LENGTH ? text : text.substring(0, PREVIEW_LENGTH) + "...";
    }
}
