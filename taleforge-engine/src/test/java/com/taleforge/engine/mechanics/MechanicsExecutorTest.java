package com.taleforge.engine.mechanics;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.taleforge.core.model.RollKind;
import com.taleforge.core.model.RollRequest;
import com.taleforge.core.model.RollResult;
import com.taleforge.engine.EngineFixture;
import com.taleforge.engine.state.InitialStateFactory;
import com.taleforge.mechanics.check.CharacterStats;
import com.taleforge.mechanics.dice.DiceRoller;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Mechanics Executor")
class MechanicsExecutorTest {

    private final MechanicsExecutor executor = new MechanicsExecutor();
    private final CharacterStats rogue = CharacterStatsMapper.fromPlayer(
        new InitialStateFactory().create(new EngineFixture().newCampaign(42)).player());

    private static RollRequest stealth(String id, int dc) {
        return new RollRequest.AbilityCheck(id, "dex", "stealth", dc, "none", 0);
    }

    @Test
    @DisplayName("Proficient stealth with seed 42 rolls 8 and meets DC 12")
    void stealthCheckUsesPlayerStats() {
        List<RollResult> results = executor.execute(List.of(stealth("r1", 12)), rogue, new DiceRoller(42));

        RollResult result = results.get(0);
        assertEquals("r1", result.rollId());
        assertEquals(RollKind.ABILITY_CHECK, result.kind());
        assertEquals(8, result.naturalRoll());
        assertEquals(4, result.modifier());
        assertEquals(12, result.total());
        assertEquals(Boolean.TRUE, result.success());
        assertEquals(12, result.difficultyClass());
    }

    @Test
    void resultsFollowRequestOrder() {
        List<RollResult> results = executor.execute(List.of(
            stealth("a", 10),
            new RollRequest.SavingThrow("b", "wis", 10, "none", 0),
            new RollRequest.DamageRoll("c", "2d6", 1, false, null, null)), rogue, new DiceRoller(7));

        assertThat(results).extracting(RollResult::rollId).containsExactly("a", "b", "c");
    }

    @Test
    @DisplayName("A failing request reports an error and consumes no dice")
    void failedRequestDoesNotShiftLaterRolls() {
        RollRequest save = new RollRequest.SavingThrow("save", "dex", 13, "none", 0);

        List<RollResult> clean = executor.execute(List.of(stealth("a", 10), save), rogue, new DiceRoller(5));
        List<RollResult> withFailure = executor.execute(List.of(
            stealth("a", 10),
            new RollRequest.AbilityCheck("bad", "luck", null, 10, "none", 0),
            new RollRequest.Unrecognized("odd", "initiative", JsonNodeFactory.instance.objectNode()),
            save), rogue, new DiceRoller(5));

        assertTrue(withFailure.get(1).hasError());
        assertThat(withFailure.get(1).error()).contains("luck");
        assertThat(withFailure.get(2).error()).contains("initiative");
        assertEquals(0, withFailure.get(2).total());
        assertEquals(clean.get(1), withFailure.get(3));
    }

    @Test
    @DisplayName("Bonuses that overflow the total fail their own roll only")
    void overflowingBonusIsAPerRollError() {
        List<RollResult> clean = executor.execute(List.of(stealth("after", 10)), rogue, new DiceRoller(42));
        List<RollResult> results = executor.execute(List.of(
            new RollRequest.AbilityCheck("huge", "dex", "stealth", 10, "none", Integer.MAX_VALUE),
            new RollRequest.SavingThrow("huge-save", "int", 10, "none", Integer.MAX_VALUE),
            new RollRequest.AttackRoll("huge-hit", "player", "goblin", "str", 12, "none", Integer.MAX_VALUE, true),
            new RollRequest.DamageRoll("huge-dmg", "1d4", Integer.MAX_VALUE, false, null, null),
            new RollRequest.DamageRoll("deep-dmg", "1d4", Integer.MIN_VALUE, false, null, null),
            stealth("after", 10)), rogue, new DiceRoller(42));

        for (RollResult failed : results.subList(0, 5)) {
            assertTrue(failed.hasError(), failed.rollId());
            assertThat(failed.error()).contains("out of range");
            assertNull(failed.success());
            assertThat(failed.dieValues()).isEmpty();
        }
        assertEquals(clean.get(0), results.get(5));
    }

    @Test
    @DisplayName("1d4 - 10 damage floors at 1 and records the adjustment")
    void damageFloorIsInBreakdown() {
        RollResult result = executor.execute(List.of(
            new RollRequest.DamageRoll("dmg", "1d4", -10, false, null, null)), rogue, new DiceRoller(42)).get(0);

        assertThat(result.dieValues()).containsExactly(4);
        assertEquals(1, result.total());
        assertThat(result.modifierBreakdown())
            .containsEntry(MechanicsExecutor.MODIFIER, -10)
            .containsEntry(MechanicsExecutor.MINIMUM_FLOOR, 7);
    }

    @Test
    @DisplayName("Damage referencing a critical attack doubles its dice")
    void damageInheritsCriticalFromAttack() {
        // seed 0 opens with a natural 20
        List<RollResult> results = executor.execute(List.of(
            new RollRequest.AttackRoll("atk", "player", "bandit", "dex", 13, "none", 0, true),
            new RollRequest.DamageRoll("dmg", "1d6", 2, false, null, "atk")), rogue, new DiceRoller(0));

        assertTrue(results.get(0).critical());
        assertEquals(Boolean.TRUE, results.get(0).success());
        assertTrue(results.get(1).critical());
        assertEquals(2, results.get(1).dieValues().size());
        assertThat(results.get(1).modifierBreakdown()).containsEntry(MechanicsExecutor.MODIFIER, 2);
    }

    @Test
    void badDiceNotationIsAnError() {
        RollResult result = executor.execute(List.of(
            new RollRequest.DamageRoll("dmg", "2x6", 0, false, null, null)), rogue, new DiceRoller(1)).get(0);

        assertTrue(result.hasError());
        assertThat(result.dieValues()).isEmpty();
    }

    @Test
    void sameSeedSameResults() {
        List<RollRequest> batch = List.of(stealth("a", 15),
            new RollRequest.DamageRoll("b", "3d8", 0, false, 1, null));

        assertEquals(executor.execute(batch, rogue, new DiceRoller(2024)),
            executor.execute(batch, rogue, new DiceRoller(2024)));
    }
}
