package com.taleforge.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.taleforge.app.health.TaleforgeHealthIndicator;
import com.taleforge.core.model.Campaign;
import com.taleforge.core.model.ContentRating;
import com.taleforge.core.model.FailureStyle;
import com.taleforge.core.model.TurnPhase;
import com.taleforge.core.model.UniverseTime;
import com.taleforge.core.repository.CampaignRepository;
import com.taleforge.engine.coordinator.TurnCoordinator;
import com.taleforge.engine.config.EngineSettings;
import com.taleforge.engine.persistence.InMemoryCampaignRepository;
import com.taleforge.engine.service.TurnResult;
import com.taleforge.engine.service.TurnService;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(properties = {
    "taleforge.snapshot-interval=5",
    "taleforge.lock-wait-timeout=250ms",
    "taleforge.validation.max-dc=30"
})
class TaleforgeApplicationTest {

    @Autowired
    private EngineSettings settings;

    @Autowired
    private TurnService turnService;

    @Autowired
    private CampaignRepository campaignRepository;

    @Autowired
    private TaleforgeHealthIndicator healthIndicator;

    @Autowired
    private MeterRegistry meterRegistry;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    @DisplayName("Properties are converted into engine settings")
    void bindsSettings() {
        assertEquals(5, settings.snapshotInterval());
        assertEquals(Duration.ofMillis(250), settings.lockWaitTimeout());
        assertEquals(10, settings.recentTurnWindow());
        assertEquals(30, settings.validation().maxDifficultyClass());
        assertEquals(1, settings.validation().minDifficultyClass());
    }

    @Test
    @DisplayName("Memory persistence is the default")
    void memoryPersistenceByDefault() {
        assertThat(campaignRepository).isInstanceOf(InMemoryCampaignRepository.class);
        assertThat(turnService).isInstanceOf(TurnCoordinator.class);
    }

    @Test
    @DisplayName("Without a narrator transport turns fail and nothing is committed")
    void failsWithoutNarrator() {
        Campaign campaign = turnService.registerCampaign(newCampaign());

        TurnResult result = turnService.submitTurn(
            TurnService.TurnRequest.of(campaign.campaignId(), "I look around."));

        assertEquals(TurnPhase.FAILED, result.phase());
        assertThat(result.errors())
            .anyMatch(e -> TurnCoordinator.NARRATOR_UNAVAILABLE.equals(e.code()));
        assertEquals(0, turnService.getCurrentState(campaign.campaignId()).turnIndex());
    }

    @Test
    @DisplayName("Health reports persistence mode and held locks")
    void healthDetails() {
        Health health = healthIndicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("memory", health.getDetails().get("persistence"));
        assertEquals(0, health.getDetails().get("lockedCampaigns"));
    }

    @Test
    @DisplayName("Engine meters carry the application tag")
    void metricsTagged() {
        assertThat(meterRegistry.getMeters())
            .filteredOn(m -> m.getId().getName().startsWith("taleforge."))
            .isNotEmpty()
            .allMatch(m -> "taleforge".equals(m.getId().getTag("application")));
    }

    private Campaign newCampaign() {
        ObjectNode party = objectMapper.createObjectNode();
        ObjectNode player = party.putObject("player");
        player.put("name", "Mira");
        player.put("class", "rogue");
        player.put("level", 1);
        ObjectNode world = objectMapper.createObjectNode();
        world.put("location_id", "millbrook");
        return Campaign.create("Shadows over Millbrook", FailureStyle.FAIL_FORWARD, ContentRating.PG13,
            new UniverseTime(1492, 3, 10, 8, 0), 42L, party, world);
    }
}
