package com.taleforge.engine.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.taleforge.core.exception.PatchApplicationException;
import com.taleforge.core.model.CampaignState;
import com.taleforge.core.model.PatchOperation;
import com.taleforge.core.model.StatePatch;
import com.taleforge.core.model.TimeDelta;
import com.taleforge.core.model.UniverseTime;
import com.taleforge.engine.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Patch application")
class PatchApplierTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private PatchApplier applier;
    private CampaignState initial;

    @BeforeEach
    void setUp() {
        EngineFixture fixture = new EngineFixture();
        applier = fixture.patchApplier;
        initial = new InitialStateFactory().create(fixture.newCampaign(11));
    }

    @Test
    @DisplayName("Replace, add and advance_time produce the next state")
    void appliesOperationsInOrder() {
        StatePatch patch = StatePatch.of(
            new PatchOperation.Replace("/party/player/hp/current", IntNode.valueOf(3)),
            new PatchOperation.Add("/party/player/conditions/-", TextNode.valueOf("poisoned")),
            new PatchOperation.Replace("/world/npcs/innkeeper/attitude", TextNode.valueOf("hostile")),
            new PatchOperation.AdvanceTime(new TimeDelta(0, 0, 0, 1, 30)));

        CampaignState next = applier.apply(initial, patch, 1);

        assertEquals(1, next.turnIndex());
        assertEquals(3, next.player().path("hp").path("current").asInt());
        assertThat(next.player().path("conditions").get(0).asText()).isEqualTo("poisoned");
        assertEquals("hostile", next.world().path("npcs").path("innkeeper").path("attitude").asText());
        assertEquals(new UniverseTime(1492, 3, 10, 9, 30), next.universeTime());
    }

    @Test
    void inputStateIsNeverModified() {
        String before = initial.document().toString();

        applier.apply(initial, StatePatch.of(
            new PatchOperation.Replace("/world/location_id", TextNode.valueOf("old-mill"))), 1);

        assertEquals(before, initial.document().toString());
        assertEquals("millbrook", initial.world().path("location_id").asText());
    }

    @Test
    void replaceCreatesMissingObjects() {
        CampaignState next = applier.apply(initial, StatePatch.of(
            new PatchOperation.Replace("/world/zones/old-mill/flags/door_open", mapper.getNodeFactory().booleanNode(true))), 1);

        assertTrue(next.world().path("zones").path("old-mill").path("flags").path("door_open").asBoolean());
    }

    @Test
    void addInsertsAtIndexAndRemoveShifts() {
        CampaignState next = applier.apply(initial, StatePatch.of(
            new PatchOperation.Add("/party/player/conditions/-", TextNode.valueOf("prone")),
            new PatchOperation.Add("/party/player/conditions/0", TextNode.valueOf("blinded")),
            new PatchOperation.Remove("/party/player/conditions/1")), 1);

        assertEquals("[\"blinded\"]", next.player().path("conditions").toString());
    }

    @Test
    void replaceBeyondListEndFails() {
        PatchApplicationException e = assertThrows(PatchApplicationException.class, () ->
            applier.apply(initial, StatePatch.of(
                new PatchOperation.Replace("/party/player/conditions/0", TextNode.valueOf("prone"))), 1));

        assertThat(e.getMessage()).contains("out of range");
    }

    @Test
    void removingMissingKeyFails() {
        assertThrows(PatchApplicationException.class, () ->
            applier.apply(initial, StatePatch.of(new PatchOperation.Remove("/world/global_flags/never_set")), 1));
    }

    @Test
    void unrecognizedOperationIsNotApplied() {
        PatchOperation odd = new PatchOperation.Unrecognized("merge", "/world", mapper.createObjectNode());

        assertThrows(PatchApplicationException.class, () -> applier.apply(initial, StatePatch.of(odd), 1));
    }

    @Test
    void advanceBeyondTheClockFails() {
        PatchApplicationException e = assertThrows(PatchApplicationException.class, () ->
            applier.apply(initial, StatePatch.of(
                new PatchOperation.AdvanceTime(new TimeDelta(35_096_000_000_000L, 0, 0, 0, 0))), 1));

        assertThat(e.getMessage()).contains("time advance out of range");
    }

    @Test
    void pathMustBeAPointer() {
        assertThrows(PatchApplicationException.class, () ->
            applier.apply(initial, StatePatch.of(new PatchOperation.Replace("world/location_id", TextNode.valueOf("x"))), 1));
    }
}
