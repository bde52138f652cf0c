package com.taleforge.mechanics.dice;

import com.taleforge.core.model.AdvantageState;

/**
 * A single d20 test, possibly drawn twice for advantage or disadvantage.
 * Critical and fumble are read off the kept face.
 */
public record D20Roll(
    int natural,
    Integer discarded,
    int modifier,
    AdvantageState advantage
) {
    public static final int CRITICAL_FACE = 20;
    public static final int FUMBLE_FACE = 1;

    public int total() {
        return Math.addExact(natural, modifier);
    }

    public boolean critical() {
        return natural == CRITICAL_FACE;
    }

    public boolean fumble() {
        return natural == FUMBLE_FACE;
    }
}
