package com.taleforge.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Auditable record of one resolved roll. Embedded in a TurnEvent.
 *
 * Invariants:
 * - total == sum(dieValues) + modifier, exactly
 * - modifier == sum of modifierBreakdown values
 * - a result carrying an error has no dice and a zero total
 */
public record RollResult(
    String rollId,
    RollKind kind,

    // Dice
    List<Integer> dieValues,
    List<Integer> discardedValues,

    // Arithmetic
    Map<String, Integer> modifierBreakdown,
    int modifier,
    int total,

    // Outcome
    Integer difficultyClass,
    Boolean success,
    AdvantageState advantage,
    boolean critical,
    boolean fumble,

    String error
) {
    public RollResult {
        dieValues = dieValues == null ? List.of() : List.copyOf(dieValues);
        discardedValues = discardedValues == null ? List.of() : List.copyOf(discardedValues);
        modifierBreakdown = modifierBreakdown == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(modifierBreakdown));
        advantage = advantage != null ? advantage : AdvantageState.NONE;

        int breakdownSum = modifierBreakdown.values().stream().mapToInt(Integer::intValue).sum();
        if (breakdownSum != modifier) {
            throw new IllegalArgumentException(String.format(
                "Roll %s: modifier %d does not match breakdown sum %d", rollId, modifier, breakdownSum));
        }
        int diceSum = dieValues.stream().mapToInt(Integer::intValue).sum();
        if (diceSum + modifier != total) {
            throw new IllegalArgumentException(String.format(
                "Roll %s: total %d != dice %d + modifier %d", rollId, total, diceSum, modifier));
        }
    }

    /**
     * A result for a request that could not be executed.
     */
    public static RollResult failed(String rollId, RollKind kind, String error) {
        return new RollResult(
            rollId, kind, List.of(), List.of(), Map.of(), 0, 0,
            null, null, AdvantageState.NONE, false, false, error
        );
    }

    public boolean hasError() {
        return error != null;
    }

    /**
     * The kept d20 face for d20-based rolls, otherwise null.
     */
    public Integer naturalRoll() {
        if (kind == null || !kind.usesD20() || dieValues.isEmpty()) {
            return null;
        }
        return dieValues.get(0);
    }
}
