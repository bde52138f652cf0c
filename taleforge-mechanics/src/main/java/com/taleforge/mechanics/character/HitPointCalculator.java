package com.taleforge.mechanics.character;

import com.taleforge.mechanics.dice.DiceRoller;

import java.util.Locale;
import java.util.Map;

/**
 * Hit point math for leveling.
 *
 * First level gets the hit die's maximum plus the CON modifier. Each later
 * level gains either the fixed average (die / 2 + 1) or a rolled die, plus
 * the CON modifier. All three results are floored at 1.
 */
public final class HitPointCalculator {

    public static final int DEFAULT_HIT_DIE = 8;
    public static final int MINIMUM_GAIN = 1;

    private static final Map<String, Integer> HIT_DICE = Map.ofEntries(
        Map.entry("barbarian", 12),
        Map.entry("fighter", 10),
        Map.entry("paladin", 10),
        Map.entry("ranger", 10),
        Map.entry("bard", 8),
        Map.entry("cleric", 8),
        Map.entry("druid", 8),
        Map.entry("monk", 8),
        Map.entry("rogue", 8),
        Map.entry("warlock", 8),
        Map.entry("sorcerer", 6),
        Map.entry("wizard", 6)
    );

    private HitPointCalculator() {
    }

    /**
     * Hit die size for a class name; unknown classes use d8.
     */
    public static int hitDieFor(String characterClass) {
        if (characterClass == null) {
            return DEFAULT_HIT_DIE;
        }
        return HIT_DICE.getOrDefault(characterClass.trim().toLowerCase(Locale.ROOT), DEFAULT_HIT_DIE);
    }

    public static int averageRoll(int hitDie) {
        return hitDie / 2 + 1;
    }

    public static int firstLevelHitPoints(int hitDie, int conModifier) {
        return Math.max(MINIMUM_GAIN, hitDie + conModifier);
    }

    public static int averageGain(int hitDie, int conModifier) {
        return Math.max(MINIMUM_GAIN, averageRoll(hitDie) + conModifier);
    }

    public static int rolledGain(DiceRoller dice, int hitDie, int conModifier) {
        return Math.max(MINIMUM_GAIN, dice.rollDie(hitDie) + conModifier);
    }

    /**
     * Maximum hit points at a level using fixed averages for every level after the first.
     */
    public static int maxHitPointsWithAverages(int hitDie, int conModifier, int level) {
        if (level < 1) {
            throw new IllegalArgumentException("level must be >= 1: " + level);
        }
        int total = firstLevelHitPoints(hitDie, conModifier);
        for (int l = 2; l <= level; l++) {
            total += averageGain(hitDie, conModifier);
        }
        return total;
    }
}
