package com.taleforge.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taleforge.core.exception.PersistenceException;
import com.taleforge.core.model.Campaign;
import com.taleforge.core.model.CampaignStatus;
import com.taleforge.core.model.CanonicalCampaignState;
import com.taleforge.core.model.TurnEvent;
import com.taleforge.engine.EngineFixture;
import com.taleforge.engine.ScriptedNarratorClient;
import com.taleforge.engine.config.EngineSettings;
import com.taleforge.engine.coordinator.RewindCoordinator;
import com.taleforge.engine.coordinator.RewindResult;
import com.taleforge.engine.coordinator.TurnCoordinator;
import com.taleforge.engine.lock.CampaignLockManager;
import com.taleforge.engine.lore.InMemoryLoreSink;
import com.taleforge.engine.mechanics.MechanicsExecutor;
import com.taleforge.engine.metrics.TurnMetrics;
import com.taleforge.engine.parser.NarratorResponseParser;
import com.taleforge.engine.persistence.TurnRecordCodec;
import com.taleforge.engine.service.TurnResult;
import com.taleforge.engine.service.TurnService.TurnRequest;
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
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

/**
 * The engine running against PostgreSQL through the JDBC repositories.
 */
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class JdbcRepositoriesTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15")
        .withDatabaseName("taleforge_test")
        .withUsername("test")
        .withPassword("test");

    private final EngineSettings settings = EngineSettings.DEFAULTS.withSnapshotInterval(2);
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ProposalDecoder decoder = new ProposalDecoder();

    private JdbcTemplate jdbcTemplate;
    private JdbcCampaignRepository campaigns;
    private JdbcTurnEventRepository turns;
    private JdbcSnapshotRepository snapshots;
    private StateService stateService;
    private ScriptedNarratorClient narrator;
    private TurnCoordinator coordinator;

    @BeforeAll
    void createSchema() {
        DriverManagerDataSource dataSource = new DriverManagerDataSource(
            postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("db/schema.sql")).execute(dataSource);
        jdbcTemplate = new JdbcTemplate(dataSource);
    }

    @BeforeEach
    void wireEngine() {
        TurnRecordCodec codec = new TurnRecordCodec(objectMapper, decoder);
        campaigns = new JdbcCampaignRepository(jdbcTemplate, codec);
        turns = new JdbcTurnEventRepository(jdbcTemplate, codec);
        snapshots = new JdbcSnapshotRepository(jdbcTemplate, codec);

        TurnMetrics metrics = TurnMetrics.standalone();
        CalendarService calendar = new CalendarService(settings.calendar());
        PatchApplier patchApplier = new PatchApplier(calendar);
        stateService = new StateService(campaigns, turns, snapshots, new InitialStateFactory(), patchApplier,
            new CanonicalStateHasher(objectMapper), metrics, settings.snapshotInterval());
        NarratorOutputValidator validator = new NarratorOutputValidator(
            new RollRequestValidator(decoder, settings.validation()),
            new PatchValidator(decoder, StatePathPolicy.DEFAULT,
                new TimeValidator(calendar, settings.validation().maxTimeJumpYears()), calendar, patchApplier),
            new LoreDeltaValidator(decoder, settings.validation(), settings.calendar()));
        CampaignLockManager locks = new CampaignLockManager(settings.lockWaitTimeout());
        InMemoryLoreSink lore = new InMemoryLoreSink();
        RewindCoordinator rewinds = new RewindCoordinator(campaigns, turns, stateService, lore, locks, metrics);
        narrator = new ScriptedNarratorClient();
        coordinator = new TurnCoordinator(campaigns, turns, stateService, narrator,
            new NarratorResponseParser(objectMapper), decoder, validator, new MechanicsExecutor(),
            lore, locks, rewinds, calendar, metrics, settings.recentTurnWindow());
    }

    private UUID newCampaign() {
        Campaign campaign = new EngineFixture().newCampaign(42);
        coordinator.registerCampaign(campaign);
        return campaign.campaignId();
    }

    private TurnResult play(UUID campaignId, int gold) {
        narrator.propose(String.format("""
            DM_TEXT: You test the lock.
            DM_JSON: {"roll_requests": [{"id": "r1", "type": "ability_check", "ability": "dex", "dc": 10}],
                      "patches": [{"op": "replace", "path": "/party/player/money/gp", "value": %d},
                                  {"op": "advance_time", "value": {"minutes": 5}}],
                      "lore_deltas": [{"type": "soft_lore", "text": "The lock is old.", "tags": ["door"]}]}
            """, gold)).outcome("DM_TEXT: The lock gives.\nDM_JSON: {}");
        TurnResult result = coordinator.submitTurn(TurnRequest.of(campaignId, "pick the lock"));
        assertThat(result.succeeded()).as("turn errors: %s", result.errors()).isTrue();
        return result;
    }

    @Test
    @DisplayName("Campaigns round-trip and status updates in place")
    void campaignRoundTrip() {
        UUID campaignId = newCampaign();

        Campaign loaded = campaigns.findById(campaignId).orElseThrow();
        assertThat(loaded.name()).isEqualTo("Shadows over Millbrook");
        assertThat(loaded.initialParty().path("player").path("class").asText()).isEqualTo("rogue");
        assertThat(loaded.startUniverseTime()).isEqualTo(EngineFixture.START);

        coordinator.pauseCampaign(campaignId);
        assertThat(campaigns.findById(campaignId).orElseThrow().status()).isEqualTo(CampaignStatus.PAUSED);
    }

    @Test
    @DisplayName("Stored turns replay to their logged hashes")
    void storedTurnsReplay() {
        UUID campaignId = newCampaign();
        for (int gold = 1; gold <= 3; gold++) {
            play(campaignId, gold);
        }

        List<TurnEvent> events = turns.findByCampaign(campaignId);
        assertThat(events).extracting(TurnEvent::turnIndex).containsExactly(1, 2, 3);
        TurnEvent first = events.get(0);
        assertThat(first.rollResults()).hasSize(1);
        assertThat(first.loreDeltas().get(0).tags()).containsExactly("door");
        assertThat(first.patch().size()).isEqualTo(2);

        for (TurnEvent event : events) {
            assertThat(stateService.replayTo(campaignId, event.turnIndex(), false).stateHash())
                .isEqualTo(event.stateHash());
        }
        assertThat(turns.findRecent(campaignId, 2)).extracting(TurnEvent::turnIndex).containsExactly(3, 2);
    }

    @Test
    void duplicateTurnIndexIsRejected() {
        UUID campaignId = newCampaign();
        TurnEvent event = play(campaignId, 1).turnEvent();

        TurnEvent clash = TurnEvent.create(campaignId, 1, "again", "again", null, List.of(), 0L,
            event.patch(), event.stateHash(), event.universeTimeAfter(), List.of());

        assertThatThrownBy(() -> turns.append(clash)).isInstanceOf(PersistenceException.class);
    }

    @Test
    void snapshotsAreUpsertedAndFoundAtOrBefore() {
        UUID campaignId = newCampaign();
        for (int gold = 1; gold <= 3; gold++) {
            play(campaignId, gold);
        }

        CanonicalCampaignState atTwo = snapshots.findLatestAtOrBefore(campaignId, 3).orElseThrow();
        assertThat(atTwo.turnIndex()).isEqualTo(2);
        assertThat(atTwo.stateHash()).isEqualTo(turns.findByIndex(campaignId, 2).orElseThrow().stateHash());
        assertThat(atTwo.state().player().path("money").path("gp").asInt()).isEqualTo(2);

        stateService.saveSnapshot(atTwo.state(), true);
        assertThat(snapshots.findByCampaign(campaignId)).hasSize(1);
    }

    @Test
    @DisplayName("Rewind deletes trailing rows and the next turn reuses the index")
    void rewindOverJdbc() {
        UUID campaignId = newCampaign();
        for (int gold = 1; gold <= 4; gold++) {
            play(campaignId, gold);
        }

        RewindResult rewound = coordinator.rewind(campaignId, 1);

        assertThat(rewound.removedTurns()).containsExactly(2, 3, 4);
        assertThat(rewound.snapshotsDeleted()).isEqualTo(2);
        assertThat(turns.findLatest(campaignId)).map(TurnEvent::turnIndex).contains(1);
        assertThat(play(campaignId, 9).turnIndex()).isEqualTo(2);
    }
}
