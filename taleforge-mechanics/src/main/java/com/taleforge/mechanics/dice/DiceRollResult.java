package com.taleforge.mechanics.dice;

import java.util.List;

/**
 * Outcome of rolling a dice expression.
 *
 * Invariants:
 * - total == sum(dieValues) + modifier()
 * - floorAdjustment >= 0; non-zero only when a minimum-result floor applied
 *
 * @param dieValues          kept die faces in roll order
 * @param discardedValues    faces replaced by a reroll
 * @param expressionModifier the +K/-K written in the expression
 * @param extraModifier      modifier supplied by the caller
 * @param floorAdjustment    amount added to lift the total to the floor
 */
public record DiceRollResult(
    String expression,
    List<Integer> dieValues,
    List<Integer> discardedValues,
    int expressionModifier,
    int extraModifier,
    int floorAdjustment,
    int total,
    boolean critical
) {
    public DiceRollResult {
        dieValues = List.copyOf(dieValues);
        discardedValues = discardedValues == null ? List.of() : List.copyOf(discardedValues);
    }

    public int diceSum() {
        return dieValues.stream().mapToInt(Integer::intValue).sum();
    }

    /**
     * Everything added to the dice, floor adjustment included.
     */
    public int modifier() {
        return expressionModifier + extraModifier + floorAdjustment;
    }

    public boolean floored() {
        return floorAdjustment > 0;
    }
}
