package com.taleforge.engine.coordinator;

import com.taleforge.core.exception.InvalidPhaseTransitionException;
import com.taleforge.core.model.FieldError;
import com.taleforge.core.model.RollResult;
import com.taleforge.core.model.TurnEvent;
import com.taleforge.core.model.TurnPhase;
import com.taleforge.core.model.ValidationResult;
import com.taleforge.engine.logging.LoggingContext;
import com.taleforge.engine.service.TurnResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Mutable progress of one turn through its phases.
 * Owned by a single thread while the campaign lock is held.
 */
final class TurnExecution {

    private static final Logger log = LoggerFactory.getLogger(TurnExecution.class);

    private final UUID campaignId;
    private final List<FieldError> warnings = new ArrayList<>();
    private TurnPhase phase = TurnPhase.INITIALIZED;
    private String narrative = "";
    private List<RollResult> rollResults = List.of();

    TurnExecution(UUID campaignId) {
        this.campaignId = campaignId;
        LoggingContext.setPhase(phase);
    }

    TurnPhase phase() {
        return phase;
    }

    /**
     * Move to the next phase.
     *
     * @throws InvalidPhaseTransitionException if the move is not allowed from the current phase
     */
    void advance(TurnPhase target) {
        if (!phase.canTransitionTo(target)) {
            throw new InvalidPhaseTransitionException(phase, target);
        }
        log.debug("Turn phase {} -> {}", phase, target);
        phase = target;
        LoggingContext.setPhase(target);
    }

    /**
     * The phase this turn is working towards.
     */
    TurnPhase pendingPhase() {
        return switch (phase) {
            case INITIALIZED -> TurnPhase.CONTEXT_BUILT;
            case CONTEXT_BUILT -> TurnPhase.PROPOSAL_RECEIVED;
            case PROPOSAL_RECEIVED -> TurnPhase.MECHANICS_EXECUTED;
            case MECHANICS_EXECUTED -> TurnPhase.FINAL_RESPONSE;
            case FINAL_RESPONSE -> TurnPhase.VALIDATED;
            case VALIDATED -> TurnPhase.PERSISTED;
            case PERSISTED, FAILED -> phase;
        };
    }

    void narrative(String text) {
        narrative = text != null ? text : "";
    }

    String narrative() {
        return narrative;
    }

    void rollResults(List<RollResult> results) {
        rollResults = List.copyOf(results);
    }

    List<RollResult> rollResults() {
        return rollResults;
    }

    void warn(String path, String code, String message) {
        warnings.add(new FieldError(path, code, message));
    }

    void warnAll(ValidationResult result) {
        warnings.addAll(result.warnings());
    }

    List<FieldError> warnings() {
        return warnings;
    }

    TurnResult persisted(TurnEvent event) {
        advance(TurnPhase.PERSISTED);
        return TurnResult.persisted(event, narrative, warnings);
    }

    TurnResult fail(List<FieldError> errors) {
        TurnPhase failedAt = pendingPhase();
        advance(TurnPhase.FAILED);
        return TurnResult.failed(campaignId, failedAt, narrative, rollResults, errors, warnings);
    }

    TurnResult fail(String path, String code, String message) {
        return fail(List.of(new FieldError(path, code, message)));
    }
}
