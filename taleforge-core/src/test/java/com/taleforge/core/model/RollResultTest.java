package com.taleforge.core.model;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RollResultTest {

    @Test
    void totalMustEqualDicePlusModifier() {
        assertThatThrownBy(() -> new RollResult(
            "r1", RollKind.DAMAGE_ROLL, List.of(3, 4), List.of(),
            Map.of("flat", 2), 2, 10,
            null, null, AdvantageState.NONE, false, false, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("total 10");
    }

    @Test
    void modifierMustEqualBreakdownSum() {
        assertThatThrownBy(() -> new RollResult(
            "r1", RollKind.ABILITY_CHECK, List.of(8), List.of(),
            Map.of("ability", 2), 4, 12,
            12, true, AdvantageState.NONE, false, false, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void breakdownKeepsInsertionOrder() {
        Map<String, Integer> breakdown = new LinkedHashMap<>();
        breakdown.put("ability", 2);
        breakdown.put("proficiency", 2);
        breakdown.put("bonus", -1);

        RollResult result = new RollResult(
            "r1", RollKind.ABILITY_CHECK, List.of(8), List.of(5),
            breakdown, 3, 11,
            12, false, AdvantageState.ADVANTAGE, false, false, null);

        assertThat(result.modifierBreakdown().keySet()).containsExactly("ability", "proficiency", "bonus");
        assertThat(result.naturalRoll()).isEqualTo(8);
    }

    @Test
    void failedResult_carriesErrorAndZeroTotal() {
        RollResult result = RollResult.failed("dmg", RollKind.DAMAGE_ROLL, "bad dice");

        assertThat(result.hasError()).isTrue();
        assertThat(result.total()).isZero();
        assertThat(result.dieValues()).isEmpty();
        assertThat(result.naturalRoll()).isNull();
    }
}
