package com.taleforge.engine.state;

import com.taleforge.core.exception.NotFoundException;
import com.taleforge.core.exception.PatchApplicationException;
import com.taleforge.core.exception.StateReplayException;
import com.taleforge.core.model.Campaign;
import com.taleforge.core.model.CampaignState;
import com.taleforge.core.model.CanonicalCampaignState;
import com.taleforge.core.model.StatePatch;
import com.taleforge.core.model.TurnEvent;
import com.taleforge.core.repository.CampaignRepository;
import com.taleforge.core.repository.SnapshotRepository;
import com.taleforge.core.repository.TurnEventRepository;
import com.taleforge.engine.metrics.TurnMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Derives canonical campaign state from the turn log.
 *
 * State at index N is the initial state with the stored patches of turns
 * 1..N applied in order. Snapshots only shorten that walk: replay starts
 * from the latest snapshot at or before N, and dropping every snapshot
 * gives the same result.
 */
public class StateService {

    private static final Logger log = LoggerFactory.getLogger(StateService.class);

    private final CampaignRepository campaignRepository;
    private final TurnEventRepository turnEventRepository;
    private final SnapshotRepository snapshotRepository;
    private final InitialStateFactory initialStateFactory;
    private final PatchApplier patchApplier;
    private final CanonicalStateHasher hasher;
    private final TurnMetrics metrics;
    private final int snapshotInterval;

    public StateService(
            CampaignRepository campaignRepository,
            TurnEventRepository turnEventRepository,
            SnapshotRepository snapshotRepository,
            InitialStateFactory initialStateFactory,
            PatchApplier patchApplier,
            CanonicalStateHasher hasher,
            TurnMetrics metrics,
            int snapshotInterval) {
        this.campaignRepository = campaignRepository;
        this.turnEventRepository = turnEventRepository;
        this.snapshotRepository = snapshotRepository;
        this.initialStateFactory = initialStateFactory;
        this.patchApplier = patchApplier;
        this.hasher = hasher;
        this.metrics = metrics;
        this.snapshotInterval = snapshotInterval;
    }

    // ========== Reads ==========

    public CampaignState initialState(UUID campaignId) {
        return initialStateFactory.create(getCampaign(campaignId));
    }

    /**
     * State after the latest committed turn.
     */
    public CampaignState getCurrentState(UUID campaignId) {
        return getStateAt(campaignId, latestTurnIndex(campaignId));
    }

    public CampaignState getStateAt(UUID campaignId, int turnIndex) {
        return replayTo(campaignId, turnIndex).state();
    }

    public int latestTurnIndex(UUID campaignId) {
        return turnEventRepository.findLatest(campaignId).map(TurnEvent::turnIndex).orElse(0);
    }

    /**
     * Reconstruct state at turnIndex, starting from the nearest snapshot.
     */
    public ReplayResult replayTo(UUID campaignId, int turnIndex) {
        return replayTo(campaignId, turnIndex, true);
    }

    /**
     * Reconstruct state at turnIndex.
     *
     * @param useSnapshots false to replay from turn 0 regardless of snapshots
     * @throws NotFoundException    if the campaign or the target turn does not exist
     * @throws StateReplayException if the log has a gap or a stored patch no longer applies
     */
    public ReplayResult replayTo(UUID campaignId, int turnIndex, boolean useSnapshots) {
        Campaign campaign = getCampaign(campaignId);
        if (turnIndex < 0) {
            throw new IllegalArgumentException("turnIndex must be >= 0: " + turnIndex);
        }
        int latest = latestTurnIndex(campaignId);
        if (turnIndex > latest) {
            throw new NotFoundException("TurnEvent", campaignId + "#" + turnIndex);
        }

        CampaignState state;
        Integer snapshotIndex = null;
        Optional<CanonicalCampaignState> snapshot = useSnapshots
            ? snapshotRepository.findLatestAtOrBefore(campaignId, turnIndex)
            : Optional.empty();
        if (snapshot.isPresent()) {
            state = snapshot.get().state();
            snapshotIndex = snapshot.get().turnIndex();
        } else {
            state = initialStateFactory.create(campaign);
        }

        List<TurnEvent> events = state.turnIndex() < turnIndex
            ? turnEventRepository.findRange(campaignId, state.turnIndex() + 1, turnIndex)
            : List.of();
        String storedHash = null;
        int expectedIndex = state.turnIndex() + 1;
        for (TurnEvent event : events) {
            if (event.turnIndex() != expectedIndex) {
                throw new StateReplayException(campaignId, expectedIndex, "turn log has a gap");
            }
            try {
                state = patchApplier.apply(state, event.patch(), event.turnIndex());
            } catch (PatchApplicationException e) {
                throw new StateReplayException(campaignId, event.turnIndex(), e);
            }
            storedHash = event.stateHash();
            expectedIndex++;
        }
        if (state.turnIndex() != turnIndex) {
            throw new StateReplayException(campaignId, expectedIndex, "turn log has a gap");
        }
        if (storedHash == null && turnIndex > 0) {
            storedHash = turnEventRepository.findByIndex(campaignId, turnIndex)
                .map(TurnEvent::stateHash)
                .orElse(null);
        }

        String hash = hasher.hash(state);
        metrics.turnsReplayed(events.size());
        ReplayResult result = new ReplayResult(state, snapshotIndex, events.size(), hash, storedHash);
        if (!result.hashMatches()) {
            log.warn("Replayed state hash differs from log: campaign={} turn={} stored={} replayed={}",
                campaignId, turnIndex, storedHash, hash);
        }
        log.debug("Replayed campaign {} to turn {}: snapshot={}, turnsReplayed={}",
            campaignId, turnIndex, snapshotIndex, events.size());
        return result;
    }

    /**
     * Whether the replayed state at turnIndex has the expected hash.
     */
    public boolean verifyStateHash(UUID campaignId, int turnIndex, String expectedHash) {
        return replayTo(campaignId, turnIndex).stateHash().equals(expectedHash);
    }

    public String computeHash(CampaignState state) {
        return hasher.hash(state);
    }

    // ========== Transitions ==========

    /**
     * Apply a validated patch to produce the state at a new index.
     * The input state is not modified.
     */
    public CampaignState applyPatch(CampaignState state, StatePatch patch, int newTurnIndex) {
        return patchApplier.apply(state, patch, newTurnIndex);
    }

    // ========== Snapshots ==========

    /**
     * Store a snapshot of the state when it falls on the snapshot interval,
     * or always when forced. An existing snapshot at the same index is kept
     * unless forced or its hash differs from the state's.
     */
    public Optional<CanonicalCampaignState> saveSnapshot(CampaignState state, boolean force) {
        if (!force && (snapshotInterval <= 0 || state.turnIndex() % snapshotInterval != 0)) {
            return Optional.empty();
        }
        String stateHash = hasher.hash(state);
        if (!force) {
            Optional<CanonicalCampaignState> existing =
                snapshotRepository.findLatestAtOrBefore(state.campaignId(), state.turnIndex());
            if (existing.isPresent() && existing.get().turnIndex() == state.turnIndex()) {
                if (existing.get().stateHash().equals(stateHash)) {
                    return Optional.empty();
                }
                log.warn("Replacing stale snapshot for campaign {} at turn {}: hash {} != {}",
                    state.campaignId(), state.turnIndex(), existing.get().stateHash(), stateHash);
            }
        }
        CanonicalCampaignState snapshot = CanonicalCampaignState.of(state, stateHash);
        snapshotRepository.save(snapshot);
        metrics.snapshotCreated();
        log.info("Saved state snapshot for campaign {} at turn {}", state.campaignId(), state.turnIndex());
        return Optional.of(snapshot);
    }

    public int deleteSnapshotsAfter(UUID campaignId, int turnIndex) {
        return snapshotRepository.deleteAfter(campaignId, turnIndex);
    }

    private Campaign getCampaign(UUID campaignId) {
        return campaignRepository.findById(campaignId)
            .orElseThrow(() -> new NotFoundException("Campaign", campaignId.toString()));
    }
}
