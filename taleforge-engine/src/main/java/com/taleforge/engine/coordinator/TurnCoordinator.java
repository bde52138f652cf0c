package com.taleforge.engine.coordinator;

import com.taleforge.core.exception.NotFoundException;
import com.taleforge.core.exception.StateConflictException;
import com.taleforge.core.exception.TaleforgeException;
import com.taleforge.core.model.Campaign;
import com.taleforge.core.model.CampaignState;
import com.taleforge.core.model.CampaignStatus;
import com.taleforge.core.model.RollResult;
import com.taleforge.core.model.TurnEvent;
import com.taleforge.core.model.TurnPhase;
import com.taleforge.core.model.ValidationResult;
import com.taleforge.core.repository.CampaignRepository;
import com.taleforge.core.repository.TurnEventRepository;
import com.taleforge.engine.lock.CampaignLockManager;
import com.taleforge.engine.lock.CampaignLockManager.CampaignLock;
import com.taleforge.engine.logging.LoggingContext;
import com.taleforge.engine.lore.LoreSink;
import com.taleforge.engine.mechanics.CharacterStatsMapper;
import com.taleforge.engine.mechanics.MechanicsExecutor;
import com.taleforge.engine.metrics.TurnMetrics;
import com.taleforge.engine.narrator.NarratorClient;
import com.taleforge.engine.narrator.NarratorContext;
import com.taleforge.engine.parser.NarratorResponseParser;
import com.taleforge.engine.parser.ParsedResponse;
import com.taleforge.engine.service.TurnResult;
import com.taleforge.engine.service.TurnService;
import com.taleforge.engine.state.StateService;
import com.taleforge.engine.time.CalendarService;
import com.taleforge.engine.validation.NarratorOutputValidator;
import com.taleforge.engine.validation.NarratorProposal;
import com.taleforge.engine.validation.ProposalDecoder;
import com.taleforge.mechanics.dice.DiceRoller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Runs turns through the phase machine and commits them to the log.
 *
 * A turn holds its campaign's lock from context building to commit, so the
 * turn index it computes up front is still the next free index when the
 * event is appended. Nothing is written before PERSISTED: a FAILED turn
 * leaves no event, no snapshot and no lore behind.
 */
public class TurnCoordinator implements TurnService {

    private static final Logger log = LoggerFactory.getLogger(TurnCoordinator.class);

    public static final String NARRATOR_UNAVAILABLE = "NARRATOR_UNAVAILABLE";
    public static final String STATE_UNAVAILABLE = "STATE_UNAVAILABLE";
    public static final String ROLL_FAILED = "ROLL_FAILED";
    public static final String FINAL_NARRATION_FALLBACK = "FINAL_NARRATION_FALLBACK";
    public static final String FINAL_ROLLS_IGNORED = "FINAL_ROLLS_IGNORED";

    private static final String FINAL_PREFIX = "final.";
    private static final long SEED_STRIDE = 0x9E3779B97F4A7C15L;

    private final CampaignRepository campaignRepository;
    private final TurnEventRepository turnEventRepository;
    private final StateService stateService;
    private final NarratorClient narrator;
    private final NarratorResponseParser parser;
    private final ProposalDecoder decoder;
    private final NarratorOutputValidator outputValidator;
    private final MechanicsExecutor mechanicsExecutor;
    private final LoreSink loreSink;
    private final CampaignLockManager lockManager;
    private final RewindCoordinator rewindCoordinator;
    private final CalendarService calendarService;
    private final TurnMetrics metrics;
    private final int recentTurnWindow;

    public TurnCoordinator(
            CampaignRepository campaignRepository,
            TurnEventRepository turnEventRepository,
            StateService stateService,
            NarratorClient narrator,
            NarratorResponseParser parser,
            ProposalDecoder decoder,
            NarratorOutputValidator outputValidator,
            MechanicsExecutor mechanicsExecutor,
            LoreSink loreSink,
            CampaignLockManager lockManager,
            RewindCoordinator rewindCoordinator,
            CalendarService calendarService,
            TurnMetrics metrics,
            int recentTurnWindow) {
        this.campaignRepository = campaignRepository;
        this.turnEventRepository = turnEventRepository;
        this.stateService = stateService;
        this.narrator = narrator;
        this.parser = parser;
        this.decoder = decoder;
        this.outputValidator = outputValidator;
        this.mechanicsExecutor = mechanicsExecutor;
        this.loreSink = loreSink;
        this.lockManager = lockManager;
        this.rewindCoordinator = rewindCoordinator;
        this.calendarService = calendarService;
        this.metrics = metrics;
        this.recentTurnWindow = recentTurnWindow;
    }

    // ========== Campaign Lifecycle ==========

    @Override
    public Campaign registerCampaign(Campaign campaign) {
        log.info("Registering campaign {} ({})", campaign.campaignId(), campaign.name());
        if (campaignRepository.findById(campaign.campaignId()).isPresent()) {
            throw new StateConflictException(campaign.campaignId(), "campaign already exists");
        }
        campaignRepository.save(campaign);
        return campaign;
    }

    @Override
    public Campaign getCampaign(UUID campaignId) {
        return campaignRepository.findById(campaignId)
            .orElseThrow(() -> new NotFoundException("Campaign", campaignId.toString()));
    }

    @Override
    public Campaign pauseCampaign(UUID campaignId) {
        return changeStatus(campaignId, CampaignStatus.ACTIVE, CampaignStatus.PAUSED);
    }

    @Override
    public Campaign resumeCampaign(UUID campaignId) {
        return changeStatus(campaignId, CampaignStatus.PAUSED, CampaignStatus.ACTIVE);
    }

    @Override
    public Campaign endCampaign(UUID campaignId) {
        try (CampaignLock lock = lockManager.acquire(campaignId)) {
            Campaign campaign = getCampaign(campaignId);
            if (campaign.status() == CampaignStatus.ENDED) {
                return campaign;
            }
            Campaign ended = campaign.withStatus(CampaignStatus.ENDED);
            campaignRepository.save(ended);
            log.info("Campaign {} ended", campaignId);
            return ended;
        }
    }

    private Campaign changeStatus(UUID campaignId, CampaignStatus expected, CampaignStatus target) {
        try (CampaignLock lock = lockManager.acquire(campaignId)) {
            Campaign campaign = getCampaign(campaignId);
            if (campaign.status() != expected) {
                throw new StateConflictException(campaignId, String.format(
                    "cannot change status from %s to %s", campaign.status(), target));
            }
            Campaign updated = campaign.withStatus(target);
            campaignRepository.save(updated);
            log.info("Campaign {} is now {}", campaignId, target);
            return updated;
        }
    }

    // ========== Turns ==========

    @Override
    public TurnResult submitTurn(TurnRequest request) {
        UUID campaignId = request.campaignId();
        Campaign campaign = getCampaign(campaignId);
        requireActive(campaign);

        try (CampaignLock lock = lockManager.acquire(campaignId);
             LoggingContext ctx = LoggingContext.forTurn(campaignId)) {
            // status may have changed while this submission waited for the lock
            campaign = getCampaign(campaignId);
            requireActive(campaign);

            long started = System.nanoTime();
            metrics.turnStarted();
            TurnResult result;
            try {
                result = runTurn(campaign, request);
            } catch (RuntimeException e) {
                metrics.turnFailed(null, Duration.ofNanos(System.nanoTime() - started));
                throw e;
            }
            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
            if (result.succeeded()) {
                metrics.turnPersisted(elapsed);
                log.info("Turn {} persisted in {} ms with {} warnings",
                    result.turnIndex(), elapsed.toMillis(), result.warnings().size());
            } else {
                metrics.turnFailed(result.failedAt(), elapsed);
                log.info("Turn failed before {} with {} errors: {}",
                    result.failedAt(), result.errors().size(), result.errors());
            }
            return result;
        }
    }

    private TurnResult runTurn(Campaign campaign, TurnRequest request) {
        UUID campaignId = campaign.campaignId();
        TurnExecution turn = new TurnExecution(campaignId);

        // ---- CONTEXT_BUILT ----
        CampaignState state;
        List<TurnEvent> recent;
        try {
            state = stateService.getCurrentState(campaignId);
            recent = new ArrayList<>(turnEventRepository.findRecent(campaignId, recentTurnWindow));
            Collections.reverse(recent);
        } catch (TaleforgeException e) {
            log.error("Could not rebuild state for campaign {}: {}", campaignId, e.getMessage());
            return turn.fail("state", STATE_UNAVAILABLE, e.getMessage());
        }
        int turnIndex = state.turnIndex() + 1;
        LoggingContext.setTurnIndex(turnIndex);
        long seed = request.diceSeed() != null
            ? request.diceSeed()
            : deriveSeed(campaign.diceSeed(), turnIndex);
        NarratorContext context = new NarratorContext(campaign, state, turnIndex, request.playerInput(),
            calendarService.format(state.universeTime()), recent);
        log.info("Turn {} started, dice seed {}", turnIndex, seed);
        turn.advance(TurnPhase.CONTEXT_BUILT);

        // ---- PROPOSAL_RECEIVED ----
        String raw;
        try {
            raw = narrator.propose(context);
        } catch (RuntimeException e) {
            log.warn("Narrator proposal failed: {}", e.getMessage());
            return turn.fail("narrator", NARRATOR_UNAVAILABLE, describe(e));
        }
        ParsedResponse proposalResponse = parser.parse(raw);
        turn.narrative(proposalResponse.narrative());
        turn.warnAll(proposalResponse.problems());
        if (proposalResponse.hasErrors()) {
            return turn.fail(proposalResponse.problems().errors());
        }
        NarratorProposal proposal = decoder.decode(proposalResponse.payload());
        turn.advance(TurnPhase.PROPOSAL_RECEIVED);

        // ---- MECHANICS_EXECUTED ----
        DiceRoller dice = new DiceRoller(seed);
        List<RollResult> results = mechanicsExecutor.execute(
            proposal.rollRequests(), CharacterStatsMapper.fromPlayer(state.player()), dice);
        for (int i = 0; i < results.size(); i++) {
            RollResult result = results.get(i);
            if (result.hasError()) {
                metrics.rollFailed();
                turn.warn(ProposalDecoder.ROLL_REQUESTS + "[" + i + "]", ROLL_FAILED, result.error());
            } else {
                metrics.rollExecuted(result.kind());
            }
        }
        turn.rollResults(results);
        turn.advance(TurnPhase.MECHANICS_EXECUTED);

        // ---- FINAL_RESPONSE ----
        if (!results.isEmpty()) {
            proposal = narrateOutcome(turn, context, proposal, results);
        }
        turn.advance(TurnPhase.FINAL_RESPONSE);

        // ---- VALIDATED ----
        ValidationResult validation = outputValidator.validate(proposal, state);
        turn.warnAll(validation);
        if (!validation.valid()) {
            return turn.fail(validation.errors());
        }
        turn.advance(TurnPhase.VALIDATED);

        // ---- PERSISTED ----
        CampaignState next;
        TurnEvent event;
        try {
            next = stateService.applyPatch(state, proposal.patch(), turnIndex);
            event = TurnEvent.create(
                campaignId,
                turnIndex,
                request.playerInput(),
                turn.narrative(),
                proposal.rollSpec(),
                results,
                seed,
                proposal.patch(),
                stateService.computeHash(next),
                next.universeTime(),
                proposal.loreDeltas()
            );
            turnEventRepository.append(event);
        } catch (TaleforgeException e) {
            log.error("Turn {} could not be committed: {}", turnIndex, e.getMessage());
            return turn.fail("turn", e.getErrorCode(), e.getMessage());
        }
        TurnResult persisted = turn.persisted(event);

        afterCommit(next, event);
        return persisted;
    }

    /**
     * Second narrator round over the roll results. Any problem keeps the
     * proposal narrative and is reported as a warning.
     */
    private NarratorProposal narrateOutcome(TurnExecution turn, NarratorContext context,
                                            NarratorProposal proposal, List<RollResult> results) {
        String raw;
        try {
            raw = narrator.narrateOutcome(context, turn.narrative(), results);
        } catch (RuntimeException e) {
            log.warn("Final narration failed, keeping proposal narrative: {}", e.getMessage());
            turn.warn("narrator", FINAL_NARRATION_FALLBACK, describe(e));
            return proposal;
        }
        ParsedResponse response = parser.parse(raw);
        if (response.hasErrors() || response.narrative().isBlank()) {
            log.warn("Final narration unusable, keeping proposal narrative: {}", response.problems().errors());
            turn.warn("narrator", FINAL_NARRATION_FALLBACK, "final narration could not be used");
            return proposal;
        }
        turn.narrative(response.narrative());
        if (!response.hasPayload()) {
            return proposal;
        }
        NarratorProposal extra = decoder.decode(response.payload(), FINAL_PREFIX);
        if (extra.hasRolls()) {
            turn.warn(FINAL_PREFIX + ProposalDecoder.ROLL_REQUESTS, FINAL_ROLLS_IGNORED,
                "roll requests in the final narration are not executed");
        }
        return proposal
            .withAdditionalPatch(extra.patch(), extra.decodeProblems())
            .withAdditionalLore(extra.loreDeltas());
    }

    /**
     * Work after the event is durable. Failures here do not undo the turn.
     */
    private void afterCommit(CampaignState next, TurnEvent event) {
        try {
            stateService.saveSnapshot(next, false);
        } catch (RuntimeException e) {
            log.warn("Snapshot at turn {} not written: {}", event.turnIndex(), e.getMessage());
        }
        if (!event.loreDeltas().isEmpty()) {
            try {
                loreSink.publish(event.campaignId(), event.turnIndex(), event.eventId(), event.loreDeltas());
            } catch (RuntimeException e) {
                log.warn("Lore from turn {} not published: {}", event.turnIndex(), e.getMessage());
            }
        }
    }

    // ========== Rewind & State ==========

    @Override
    public RewindResult rewind(UUID campaignId, int targetTurnIndex) {
        return rewindCoordinator.rewind(campaignId, targetTurnIndex);
    }

    @Override
    public CampaignState getCurrentState(UUID campaignId) {
        return stateService.getCurrentState(campaignId);
    }

    // ========== Internal Methods ==========

    private void requireActive(Campaign campaign) {
        if (campaign.status() == CampaignStatus.ENDED) {
            throw StateConflictException.campaignEnded(campaign.campaignId());
        }
        if (campaign.status() == CampaignStatus.PAUSED) {
            throw new StateConflictException(campaign.campaignId(), "campaign is paused");
        }
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /**
     * Seed for a turn that did not ask for one. Depends only on the
     * campaign seed and the index, so replaying a turn rolls the same dice.
     */
    public static long deriveSeed(long campaignSeed, int turnIndex) {
        return campaignSeed ^ (turnIndex * SEED_STRIDE);
    }
}
