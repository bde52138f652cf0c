package com.taleforge.app.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taleforge.core.model.RollResult;
import com.taleforge.core.repository.CampaignRepository;
import com.taleforge.core.repository.SnapshotRepository;
import com.taleforge.core.repository.TurnEventRepository;
import com.taleforge.engine.config.EngineSettings;
import com.taleforge.engine.coordinator.RewindCoordinator;
import com.taleforge.engine.coordinator.TurnCoordinator;
import com.taleforge.engine.history.TurnHistoryService;
import com.taleforge.engine.lock.CampaignLockManager;
import com.taleforge.engine.lore.InMemoryLoreSink;
import com.taleforge.engine.lore.LoreSink;
import com.taleforge.engine.mechanics.MechanicsExecutor;
import com.taleforge.engine.metrics.TurnMetrics;
import com.taleforge.engine.narrator.NarratorClient;
import com.taleforge.engine.narrator.NarratorContext;
import com.taleforge.engine.parser.NarratorResponseParser;
import com.taleforge.engine.persistence.InMemoryCampaignRepository;
import com.taleforge.engine.persistence.InMemorySnapshotRepository;
import com.taleforge.engine.persistence.InMemoryTurnEventRepository;
import com.taleforge.engine.persistence.TurnRecordCodec;
import com.taleforge.engine.persistence.jdbc.JdbcCampaignRepository;
import com.taleforge.engine.persistence.jdbc.JdbcSnapshotRepository;
import com.taleforge.engine.persistence.jdbc.JdbcTurnEventRepository;
import com.taleforge.engine.service.TurnService;
import com.taleforge.engine.state.CanonicalStateHasher;
import com.taleforge.engine.state.InitialStateFactory;
import com.taleforge.engine.state.PatchApplier;
import com.taleforge.engine.state.StateService;
import com.taleforge.engine.time.CalendarService;
import com.taleforge.engine.time.TimeValidator;
import com.taleforge.engine.validation.LoreDeltaValidator;
import com.taleforge.engine.validation.NarratorOutputValidator;
import com.taleforge.engine.validation.PatchValidator;
import com.taleforge.engine.validation.ProposalDecoder;
import com.taleforge.engine.validation.RollRequestValidator;
import com.taleforge.engine.validation.StatePathPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

/**
 * Wires the turn engine from {@link TaleforgeProperties}.
 *
 * Repositories are in-memory unless {@code taleforge.persistence=jdbc}.
 * The narrator transport is supplied by the deployment; without one every
 * turn fails with NARRATOR_UNAVAILABLE.
 */
@Configuration
@EnableConfigurationProperties(TaleforgeProperties.class)
public class TaleforgeConfiguration {

    private static final Logger log = LoggerFactory.getLogger(TaleforgeConfiguration.class);

    @Bean
    public EngineSettings engineSettings(TaleforgeProperties properties) {
        EngineSettings settings = properties.toEngineSettings();
        log.info("Engine settings: snapshotInterval={}, lockWaitTimeout={}, recentTurnWindow={}, persistence={}",
            settings.snapshotInterval(), settings.lockWaitTimeout(), settings.recentTurnWindow(),
            properties.getPersistence());
        return settings;
    }

    // ========== Persistence ==========

    @Configuration
    @ConditionalOnProperty(name = "taleforge.persistence", havingValue = "memory", matchIfMissing = true)
    static class MemoryPersistence {

        @Bean
        public CampaignRepository campaignRepository() {
            return new InMemoryCampaignRepository();
        }

        @Bean
        public TurnEventRepository turnEventRepository() {
            return new InMemoryTurnEventRepository();
        }

        @Bean
        public SnapshotRepository snapshotRepository() {
            return new InMemorySnapshotRepository();
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "taleforge.persistence", havingValue = "jdbc")
    static class JdbcPersistence {

        @Bean
        public CampaignRepository campaignRepository(JdbcTemplate jdbcTemplate, TurnRecordCodec codec) {
            return new JdbcCampaignRepository(jdbcTemplate, codec);
        }

        @Bean
        public TurnEventRepository turnEventRepository(JdbcTemplate jdbcTemplate, TurnRecordCodec codec) {
            return new JdbcTurnEventRepository(jdbcTemplate, codec);
        }

        @Bean
        public SnapshotRepository snapshotRepository(JdbcTemplate jdbcTemplate, TurnRecordCodec codec) {
            return new JdbcSnapshotRepository(jdbcTemplate, codec);
        }
    }

    @Bean
    public TurnRecordCodec turnRecordCodec(ObjectMapper objectMapper, ProposalDecoder decoder) {
        return new TurnRecordCodec(objectMapper, decoder);
    }

    // ========== State & Validation ==========

    @Bean
    public CalendarService calendarService(EngineSettings settings) {
        return new CalendarService(settings.calendar());
    }

    @Bean
    public PatchApplier patchApplier(CalendarService calendarService) {
        return new PatchApplier(calendarService);
    }

    @Bean
    public StateService stateService(CampaignRepository campaignRepository,
                                     TurnEventRepository turnEventRepository,
                                     SnapshotRepository snapshotRepository,
                                     PatchApplier patchApplier,
                                     ObjectMapper objectMapper,
                                     TurnMetrics metrics,
                                     EngineSettings settings) {
        return new StateService(campaignRepository, turnEventRepository, snapshotRepository,
            new InitialStateFactory(), patchApplier, new CanonicalStateHasher(objectMapper), metrics,
            settings.snapshotInterval());
    }

    @Bean
    public ProposalDecoder proposalDecoder() {
        return new ProposalDecoder();
    }

    @Bean
    public NarratorOutputValidator narratorOutputValidator(ProposalDecoder decoder,
                                                           CalendarService calendarService,
                                                           PatchApplier patchApplier,
                                                           EngineSettings settings) {
        TimeValidator timeValidator = new TimeValidator(calendarService, settings.validation().maxTimeJumpYears());
        return new NarratorOutputValidator(
            new RollRequestValidator(decoder, settings.validation()),
            new PatchValidator(decoder, StatePathPolicy.DEFAULT, timeValidator, calendarService, patchApplier),
            new LoreDeltaValidator(decoder, settings.validation(), settings.calendar()));
    }

    // ========== Turn Processing ==========

    @Bean
    public CampaignLockManager campaignLockManager(EngineSettings settings) {
        return new CampaignLockManager(settings.lockWaitTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public LoreSink loreSink() {
        return new InMemoryLoreSink();
    }

    @Bean
    @ConditionalOnMissingBean
    public NarratorClient narratorClient() {
        log.warn("No narrator transport configured; turns will fail until one is provided");
        return new UnconfiguredNarratorClient();
    }

    @Bean
    public RewindCoordinator rewindCoordinator(CampaignRepository campaignRepository,
                                               TurnEventRepository turnEventRepository,
                                               StateService stateService,
                                               LoreSink loreSink,
                                               CampaignLockManager lockManager,
                                               TurnMetrics metrics) {
        return new RewindCoordinator(campaignRepository, turnEventRepository, stateService, loreSink,
            lockManager, metrics);
    }

    @Bean
    public TurnService turnService(CampaignRepository campaignRepository,
                                   TurnEventRepository turnEventRepository,
                                   StateService stateService,
                                   NarratorClient narratorClient,
                                   ObjectMapper objectMapper,
                                   ProposalDecoder decoder,
                                   NarratorOutputValidator validator,
                                   LoreSink loreSink,
                                   CampaignLockManager lockManager,
                                   RewindCoordinator rewindCoordinator,
                                   CalendarService calendarService,
                                   TurnMetrics metrics,
                                   EngineSettings settings) {
        return new TurnCoordinator(campaignRepository, turnEventRepository, stateService, narratorClient,
            new NarratorResponseParser(objectMapper), decoder, validator, new MechanicsExecutor(),
            loreSink, lockManager, rewindCoordinator, calendarService, metrics, settings.recentTurnWindow());
    }

    @Bean
    public TurnHistoryService turnHistoryService(TurnEventRepository turnEventRepository,
                                                 StateService stateService) {
        return new TurnHistoryService(turnEventRepository, stateService);
    }

    /**
     * Stand-in until a narrator transport bean is defined.
     */
    static class UnconfiguredNarratorClient implements NarratorClient {

        @Override
        public String propose(NarratorContext context) {
            throw new IllegalStateException("No narrator transport configured");
        }

        @Override
        public String narrateOutcome(NarratorContext context, String proposalNarrative, List<RollResult> results) {
            throw new IllegalStateException("No narrator transport configured");
        }
    }
}
