package com.taleforge.engine.coordinator;

import com.taleforge.core.exception.NotFoundException;
import com.taleforge.core.exception.StateConflictException;
import com.taleforge.core.model.Campaign;
import com.taleforge.core.model.CampaignStatus;
import com.taleforge.core.model.TurnEvent;
import com.taleforge.core.repository.CampaignRepository;
import com.taleforge.core.repository.TurnEventRepository;
import com.taleforge.engine.lock.CampaignLockManager;
import com.taleforge.engine.lock.CampaignLockManager.CampaignLock;
import com.taleforge.engine.logging.LoggingContext;
import com.taleforge.engine.lore.LoreSink;
import com.taleforge.engine.metrics.TurnMetrics;
import com.taleforge.engine.state.ReplayResult;
import com.taleforge.engine.state.StateService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Truncates a campaign's turn log and everything derived from the removed turns.
 *
 * Order of work: turn events, then snapshots, then lore, then a forced
 * snapshot of the rebuilt state at the target. The log is authoritative, so
 * a lore failure after truncation is reported as a warning rather than
 * undoing the rewind.
 */
public class RewindCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RewindCoordinator.class);

    private final CampaignRepository campaignRepository;
    private final TurnEventRepository turnEventRepository;
    private final StateService stateService;
    private final LoreSink loreSink;
    private final CampaignLockManager lockManager;
    private final TurnMetrics metrics;

    public RewindCoordinator(
            CampaignRepository campaignRepository,
            TurnEventRepository turnEventRepository,
            StateService stateService,
            LoreSink loreSink,
            CampaignLockManager lockManager,
            TurnMetrics metrics) {
        this.campaignRepository = campaignRepository;
        this.turnEventRepository = turnEventRepository;
        this.stateService = stateService;
        this.loreSink = loreSink;
        this.lockManager = lockManager;
        this.metrics = metrics;
    }

    /**
     * Rewind to targetTurnIndex. Rewinding to the latest index succeeds without changes.
     *
     * @throws NotFoundException      if the campaign does not exist
     * @throws StateConflictException if the target is negative or beyond the latest turn,
     *                                the campaign has ended, or the campaign lock is held
     */
    public RewindResult rewind(UUID campaignId, int targetTurnIndex) {
        try (CampaignLock lock = lockManager.acquire(campaignId);
             LoggingContext ctx = LoggingContext.forRewind(campaignId, targetTurnIndex)) {
            Campaign campaign = campaignRepository.findById(campaignId)
                .orElseThrow(() -> new NotFoundException("Campaign", campaignId.toString()));
            if (campaign.status() == CampaignStatus.ENDED) {
                throw StateConflictException.campaignEnded(campaignId);
            }
            int latest = stateService.latestTurnIndex(campaignId);
            if (targetTurnIndex < 0 || targetTurnIndex > latest) {
                throw new StateConflictException(campaignId, String.format(
                    "rewind target %d is outside turns 0..%d", targetTurnIndex, latest));
            }
            if (targetTurnIndex == latest) {
                log.info("Rewind to current turn {} is a no-op", latest);
                return RewindResult.noOp(campaignId, latest,
                    stateService.replayTo(campaignId, latest).stateHash());
            }

            log.info("Rewinding campaign {} from turn {} to turn {}", campaignId, latest, targetTurnIndex);
            // snapshots go first: a failure here leaves the full log, which still matches every snapshot
            int snapshotsDeleted = stateService.deleteSnapshotsAfter(campaignId, targetTurnIndex);
            List<TurnEvent> removed = turnEventRepository.deleteAfter(campaignId, targetTurnIndex);

            List<String> warnings = new ArrayList<>();
            int loreInvalidated = 0;
            try {
                loreInvalidated = loreSink.invalidateAfter(campaignId, targetTurnIndex);
            } catch (RuntimeException e) {
                log.warn("Lore after turn {} not invalidated: {}", targetTurnIndex, e.getMessage());
                warnings.add("lore invalidation failed: " + e.getMessage());
            }

            ReplayResult rebuilt = stateService.replayTo(campaignId, targetTurnIndex);
            stateService.saveSnapshot(rebuilt.state(), true);
            metrics.rewound(removed.size());

            List<Integer> removedIndices = removed.stream()
                .map(TurnEvent::turnIndex)
                .collect(Collectors.toList());
            log.info("Rewind complete: removed {} turns, {} snapshots, {} lore entries; state hash {}",
                removedIndices.size(), snapshotsDeleted, loreInvalidated, rebuilt.stateHash());
            return new RewindResult(campaignId, latest, targetTurnIndex, removedIndices,
                snapshotsDeleted, loreInvalidated, rebuilt.stateHash(), warnings);
        }
    }
}
