package com.taleforge.core.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class TurnPhaseTest {

    @Test
    void isTerminal_shouldIdentifyTerminalPhases() {
        assertTrue(TurnPhase.PERSISTED.isTerminal());
        assertTrue(TurnPhase.FAILED.isTerminal());

        assertFalse(TurnPhase.INITIALIZED.isTerminal());
        assertFalse(TurnPhase.CONTEXT_BUILT.isTerminal());
        assertFalse(TurnPhase.VALIDATED.isTerminal());
    }

    @Test
    void canTransitionTo_shouldFollowLinearOrder() {
        assertTrue(TurnPhase.INITIALIZED.canTransitionTo(TurnPhase.CONTEXT_BUILT));
        assertTrue(TurnPhase.CONTEXT_BUILT.canTransitionTo(TurnPhase.PROPOSAL_RECEIVED));
        assertTrue(TurnPhase.PROPOSAL_RECEIVED.canTransitionTo(TurnPhase.MECHANICS_EXECUTED));
        assertTrue(TurnPhase.MECHANICS_EXECUTED.canTransitionTo(TurnPhase.FINAL_RESPONSE));
        assertTrue(TurnPhase.FINAL_RESPONSE.canTransitionTo(TurnPhase.VALIDATED));
        assertTrue(TurnPhase.VALIDATED.canTransitionTo(TurnPhase.PERSISTED));
    }

    @Test
    void canTransitionTo_shouldRejectSkipsAndCycles() {
        assertFalse(TurnPhase.INITIALIZED.canTransitionTo(TurnPhase.PROPOSAL_RECEIVED));
        assertFalse(TurnPhase.CONTEXT_BUILT.canTransitionTo(TurnPhase.VALIDATED));
        assertFalse(TurnPhase.VALIDATED.canTransitionTo(TurnPhase.CONTEXT_BUILT));
        assertFalse(TurnPhase.MECHANICS_EXECUTED.canTransitionTo(TurnPhase.MECHANICS_EXECUTED));
    }

    @ParameterizedTest
    @EnumSource(value = TurnPhase.class, names = {"PERSISTED", "FAILED"}, mode = EnumSource.Mode.EXCLUDE)
    void canTransitionTo_failedReachableFromEveryNonTerminalPhase(TurnPhase phase) {
        assertTrue(phase.canTransitionTo(TurnPhase.FAILED));
    }

    @ParameterizedTest
    @EnumSource(TurnPhase.class)
    void canTransitionTo_terminalPhasesGoNowhere(TurnPhase target) {
        assertFalse(TurnPhase.PERSISTED.canTransitionTo(target));
        assertFalse(TurnPhase.FAILED.canTransitionTo(target));
    }
}
