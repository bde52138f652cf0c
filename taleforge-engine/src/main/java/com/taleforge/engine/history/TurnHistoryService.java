package com.taleforge.engine.history;

import com.taleforge.core.exception.NotFoundException;
import com.taleforge.core.exception.PatchApplicationException;
import com.taleforge.core.model.CampaignState;
import com.taleforge.core.model.TurnEvent;
import com.taleforge.core.repository.TurnEventRepository;
import com.taleforge.engine.state.StateService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Read side of the turn log.
 *
 * Provides:
 * - rewindable turns, newest first
 * - single turn lookup
 * - integrity verification by full replay
 */
public class TurnHistoryService {

    private static final Logger log = LoggerFactory.getLogger(TurnHistoryService.class);

    private final TurnEventRepository turnEventRepository;
    private final StateService stateService;

    public TurnHistoryService(TurnEventRepository turnEventRepository, StateService stateService) {
        this.turnEventRepository = turnEventRepository;
        this.stateService = stateService;
    }

    /**
     * Turns a campaign can be rewound to, most recent first.
     */
    public List<TurnSummary> listRewindableTurns(UUID campaignId, int limit) {
        return turnEventRepository.findRecent(campaignId, limit).stream()
            .map(TurnSummary::of)
            .collect(Collectors.toList());
    }

    public TurnEvent getTurn(UUID campaignId, int turnIndex) {
        return turnEventRepository.findByIndex(campaignId, turnIndex)
            .orElseThrow(() -> new NotFoundException("TurnEvent", campaignId + "#" + turnIndex));
    }

    /**
     * Replay every turn from the initial state, ignoring snapshots, and compare
     * each recomputed hash with the stored one.
     */
    public IntegrityReport verifyIntegrity(UUID campaignId) {
        log.info("Verifying turn log integrity for campaign {}", campaignId);
        CampaignState state = stateService.initialState(campaignId);
        List<TurnEvent> events = turnEventRepository.findByCampaign(campaignId);
        List<Integer> mismatched = new ArrayList<>();
        int checked = 0;

        for (TurnEvent event : events) {
            if (event.turnIndex() != state.turnIndex() + 1) {
                log.warn("Turn log gap before turn {}", event.turnIndex());
                return new IntegrityReport(campaignId, checked, mismatched, state.turnIndex() + 1,
                    "turn log has a gap");
            }
            try {
                state = stateService.applyPatch(state, event.patch(), event.turnIndex());
            } catch (PatchApplicationException e) {
                log.warn("Stored patch of turn {} no longer applies: {}", event.turnIndex(), e.getMessage());
                return new IntegrityReport(campaignId, checked, mismatched, event.turnIndex(), e.getMessage());
            }
            checked++;
            if (!stateService.computeHash(state).equals(event.stateHash())) {
                mismatched.add(event.turnIndex());
            }
        }

        if (!mismatched.isEmpty()) {
            log.warn("Campaign {} has {} turns with mismatching state hashes: {}",
                campaignId, mismatched.size(), mismatched);
        }
        return new IntegrityReport(campaignId, checked, mismatched, null, null);
    }
}
