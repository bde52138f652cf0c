package com.taleforge.mechanics.check;

import com.taleforge.mechanics.dice.D20Roll;

import java.util.Map;

/**
 * Outcome of an attack roll.
 *
 * @param hit null when no armor class was given and the roll was neither
 *            a natural 1 nor a natural 20
 */
public record AttackResult(
    D20Roll roll,
    Map<String, Integer> modifierBreakdown,
    Integer targetArmorClass,
    Boolean hit
) {
    public int total() {
        return roll.total();
    }

    /**
     * A natural 20 is a critical hit.
     */
    public boolean critical() {
        return roll.critical();
    }

    public boolean fumble() {
        return roll.fumble();
    }
}
