package com.taleforge.engine.service;

import com.taleforge.core.model.FieldError;
import com.taleforge.core.model.RollResult;
import com.taleforge.core.model.TurnEvent;
import com.taleforge.core.model.TurnPhase;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of one turn submission.
 *
 * Invariants:
 * - phase is PERSISTED or FAILED
 * - PERSISTED: turnEvent is set, errors is empty, failedAt is null
 * - FAILED: turnEvent is null, failedAt is the phase the turn could not reach
 *   and errors is non-empty
 */
public record TurnResult(
    UUID campaignId,
    TurnPhase phase,
    TurnPhase failedAt,
    String narrative,
    TurnEvent turnEvent,
    List<RollResult> rollResults,
    List<FieldError> errors,
    List<FieldError> warnings
) {
    public TurnResult {
        rollResults = rollResults == null ? List.of() : List.copyOf(rollResults);
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static TurnResult persisted(TurnEvent event, String narrative, List<FieldError> warnings) {
        return new TurnResult(event.campaignId(), TurnPhase.PERSISTED, null, narrative, event,
            event.rollResults(), List.of(), warnings);
    }

    public static TurnResult failed(UUID campaignId, TurnPhase failedAt, String narrative,
                                    List<RollResult> rollResults, List<FieldError> errors,
                                    List<FieldError> warnings) {
        return new TurnResult(campaignId, TurnPhase.FAILED, failedAt, narrative, null,
            rollResults, errors, warnings);
    }

    public boolean succeeded() {
        return phase == TurnPhase.PERSISTED;
    }

    /**
     * Index of the committed turn, or null for a failed turn.
     */
    public Integer turnIndex() {
        return turnEvent != null ? turnEvent.turnIndex() : null;
    }

    public String stateHash() {
        return turnEvent != null ? turnEvent.stateHash() : null;
    }

    public boolean hasErrorCode(String code) {
        return errors.stream().anyMatch(e -> e.code().equals(code));
    }

    public boolean hasWarningCode(String code) {
        return warnings.stream().anyMatch(w -> w.code().equals(code));
    }
}
