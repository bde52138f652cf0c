package com.taleforge.engine.coordinator;

import com.taleforge.core.exception.NotFoundException;
import com.taleforge.core.exception.StateConflictException;
import com.taleforge.core.model.CanonicalCampaignState;
import com.taleforge.core.model.LoreDelta;
import com.taleforge.core.model.TurnEvent;
import com.taleforge.core.repository.SnapshotRepository;
import com.taleforge.engine.EngineFixture;
import com.taleforge.engine.config.EngineSettings;
import com.taleforge.engine.lore.LoreSink;
import com.taleforge.engine.service.TurnResult;
import com.taleforge.engine.service.TurnService.TurnRequest;
import com.taleforge.engine.state.InitialStateFactory;
import com.taleforge.engine.state.StateService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Rewind")
class RewindCoordinatorTest {

    private EngineFixture fixture;
    private UUID campaignId;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture(EngineSettings.DEFAULTS.withSnapshotInterval(2));
        campaignId = fixture.registerCampaign(7).campaignId();
        for (int i = 1; i <= 5; i++) {
            playTurn(i);
        }
    }

    private TurnResult playTurn(int gold) {
        fixture.narrator.propose(String.format("""
            DM_TEXT: You count your coins: %1$d.
            DM_JSON: {"patches": [{"op": "replace", "path": "/party/player/money/gp", "value": %1$d},
                                  {"op": "advance_time", "value": {"hours": 1}}],
                      "lore_deltas": [{"type": "soft_lore", "text": "Mira had %1$d gold."}]}
            """, gold));
        TurnResult result = fixture.coordinator.submitTurn(TurnRequest.of(campaignId, "count " + gold));
        assertTrue(result.succeeded(), () -> result.errors().toString());
        return result;
    }

    @Test
    @DisplayName("Rewinding to K truncates the log and the next turn gets K+1")
    void rewindThenContinue() {
        String hashAtTwo = fixture.turns.findByIndex(campaignId, 2).orElseThrow().stateHash();

        RewindResult result = fixture.coordinator.rewind(campaignId, 2);

        assertFalse(result.isNoOp());
        assertEquals(5, result.previousTurnIndex());
        assertThat(result.removedTurns()).containsExactlyInAnyOrder(3, 4, 5);
        assertEquals(hashAtTwo, result.stateHash());
        assertEquals(2, fixture.coordinator.getCurrentState(campaignId).turnIndex());
        assertEquals(2, fixture.coordinator.getCurrentState(campaignId).player().path("money").path("gp").asInt());

        TurnResult next = playTurn(40);
        assertEquals(3, next.turnIndex());
        assertThat(fixture.turns.findByCampaign(campaignId))
            .extracting(TurnEvent::playerInput)
            .containsExactly("count 1", "count 2", "count 40");
    }

    @Test
    void snapshotsAfterTargetAreReplacedByOneAtTarget() {
        RewindResult result = fixture.coordinator.rewind(campaignId, 3);

        assertEquals(1, result.snapshotsDeleted());
        assertEquals(3, fixture.snapshots.findLatestAtOrBefore(campaignId, 10).orElseThrow().turnIndex());
        assertEquals(result.stateHash(), fixture.snapshots.findLatestAtOrBefore(campaignId, 10).orElseThrow().stateHash());
    }

    @Test
    void loreFromRemovedTurnsIsInvalidated() {
        RewindResult result = fixture.coordinator.rewind(campaignId, 1);

        assertEquals(4, result.loreInvalidated());
        assertThat(fixture.lore.findByCampaign(campaignId)).hasSize(1);
        assertEquals("Mira had 1 gold.", fixture.lore.findByCampaign(campaignId).get(0).delta().text());
    }

    @Test
    void rewindToZeroRestoresInitialState() {
        String initialHash = fixture.stateService.replayTo(campaignId, 0).stateHash();

        RewindResult result = fixture.coordinator.rewind(campaignId, 0);

        assertEquals(initialHash, result.stateHash());
        assertTrue(fixture.turns.findByCampaign(campaignId).isEmpty());
        assertEquals(EngineFixture.START, fixture.coordinator.getCurrentState(campaignId).universeTime());
    }

    @Test
    void rewindToLatestIsANoOp() {
        RewindResult result = fixture.coordinator.rewind(campaignId, 5);

        assertTrue(result.isNoOp());
        assertThat(result.removedTurns()).isEmpty();
        assertEquals(fixture.turns.findByIndex(campaignId, 5).orElseThrow().stateHash(), result.stateHash());
        assertEquals(5, fixture.turns.findByCampaign(campaignId).size());
    }

    @Test
    void targetsOutsideTheLogAreConflicts() {
        assertThrows(StateConflictException.class, () -> fixture.coordinator.rewind(campaignId, 6));
        assertThrows(StateConflictException.class, () -> fixture.coordinator.rewind(campaignId, -1));
        assertEquals(5, fixture.turns.findByCampaign(campaignId).size());
    }

    @Test
    void pausedCampaignCanRewindButEndedCannot() {
        fixture.coordinator.pauseCampaign(campaignId);
        assertEquals(4, fixture.coordinator.rewind(campaignId, 4).targetTurnIndex());

        fixture.coordinator.endCampaign(campaignId);
        assertThrows(StateConflictException.class, () -> fixture.coordinator.rewind(campaignId, 2));
    }

    @Test
    void unknownCampaignIsNotFound() {
        assertThrows(NotFoundException.class, () -> fixture.coordinator.rewind(UUID.randomUUID(), 0));
    }

    @Test
    @DisplayName("A lore store failure is reported but the rewind stands")
    void loreFailureIsAWarning() {
        LoreSink broken = new LoreSink() {
            @Override
            public void publish(UUID id, int turnIndex, UUID eventId, List<LoreDelta> deltas) {
                throw new UnsupportedOperationException("not used by rewind");
            }

            @Override
            public int invalidateAfter(UUID id, int turnIndex) {
                throw new IllegalStateException("lore store offline");
            }
        };
        RewindCoordinator rewinds = new RewindCoordinator(fixture.campaigns, fixture.turns,
            fixture.stateService, broken, fixture.locks, fixture.metrics);

        RewindResult result = rewinds.rewind(campaignId, 2);

        assertEquals(0, result.loreInvalidated());
        assertThat(result.warnings()).hasSize(1);
        assertThat(result.warnings().get(0)).contains("lore store offline");
        assertEquals(2, fixture.stateService.latestTurnIndex(campaignId));
    }

    @Test
    @DisplayName("A snapshot store failure aborts the rewind with the log intact")
    void snapshotFailureKeepsTheLog() {
        SnapshotRepository failingDeletes = new SnapshotRepository() {
            @Override
            public void save(CanonicalCampaignState snapshot) {
                fixture.snapshots.save(snapshot);
            }

            @Override
            public Optional<CanonicalCampaignState> findLatestAtOrBefore(UUID id, int turnIndex) {
                return fixture.snapshots.findLatestAtOrBefore(id, turnIndex);
            }

            @Override
            public List<CanonicalCampaignState> findByCampaign(UUID id) {
                return fixture.snapshots.findByCampaign(id);
            }

            @Override
            public int deleteAfter(UUID id, int afterIndex) {
                throw new IllegalStateException("snapshot store offline");
            }

            @Override
            public int deleteAll(UUID id) {
                return fixture.snapshots.deleteAll(id);
            }
        };
        StateService states = new StateService(fixture.campaigns, fixture.turns, failingDeletes,
            new InitialStateFactory(), fixture.patchApplier, fixture.hasher, fixture.metrics, 2);
        RewindCoordinator rewinds = new RewindCoordinator(fixture.campaigns, fixture.turns,
            states, fixture.lore, fixture.locks, fixture.metrics);

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> rewinds.rewind(campaignId, 1));

        assertThat(e.getMessage()).contains("snapshot store offline");
        assertThat(fixture.turns.findByCampaign(campaignId)).extracting(TurnEvent::turnIndex)
            .containsExactly(1, 2, 3, 4, 5);
        for (CanonicalCampaignState snapshot : fixture.snapshots.findByCampaign(campaignId)) {
            assertEquals(fixture.turns.findByIndex(campaignId, snapshot.turnIndex()).orElseThrow().stateHash(),
                snapshot.stateHash());
        }
        assertTrue(fixture.stateService.replayTo(campaignId, 5).hashMatches());
        assertFalse(fixture.locks.isLocked(campaignId));

        assertEquals(1, fixture.coordinator.rewind(campaignId, 1).targetTurnIndex());
    }
}
