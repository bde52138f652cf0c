package com.taleforge.mechanics.dice;

import com.taleforge.core.model.AdvantageState;
import org.apache.commons.rng.core.source32.MersenneTwister;

import java.util.ArrayList;
import java.util.List;

/**
 * Seeded dice engine.
 *
 * The generator is MT19937 keyed with the seed's magnitude split into
 * little-endian 32-bit words. Each primitive draw is uniform over
 * [1, 2^31 - 1] and a die of size M reads {@code draw % M + 1}. Every
 * die of every size consumes exactly one draw, so identical seeds and
 * identical call sequences reproduce identical faces. Saved campaigns
 * depend on this sequence; do not change it.
 *
 * Instances are not thread-safe. Each turn owns its own roller.
 */
public class DiceRoller {

    private static final int DRAW_BOUND = Integer.MAX_VALUE;
    private static final int D20 = 20;

    private final long seed;
    private final MersenneTwister generator;
    private int rollCount;

    public DiceRoller(long seed) {
        this.seed = seed;
        this.generator = new MersenneTwister(seedKey(seed));
    }

    public long seed() {
        return seed;
    }

    /**
     * Number of dice rolled so far.
     */
    public int rollCount() {
        return rollCount;
    }

    // ========== Primitives ==========

    /**
     * Roll one die.
     *
     * @return a value in [1, size]
     */
    public int rollDie(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("Die size must be >= 1: " + size);
        }
        rollCount++;
        return nextDraw() % size + 1;
    }

    /**
     * Draw a die twice under advantage or disadvantage; once otherwise.
     * Advantage keeps the higher face, disadvantage the lower. On a tie
     * the first draw is kept.
     */
    public D20Roll rollWithAdvantage(int size, AdvantageState state, int modifier) {
        int first = rollDie(size);
        if (state == null || state == AdvantageState.NONE) {
            return new D20Roll(first, null, modifier, AdvantageState.NONE);
        }
        int second = rollDie(size);
        boolean keepFirst = state == AdvantageState.ADVANTAGE ? first >= second : first <= second;
        return keepFirst
            ? new D20Roll(first, second, modifier, state)
            : new D20Roll(second, first, modifier, state);
    }

    public D20Roll rollD20(AdvantageState state, int modifier) {
        return rollWithAdvantage(D20, state, modifier);
    }

    // ========== Expressions ==========

    public DiceRollResult roll(String expression) {
        return roll(DiceExpression.parse(expression), 0);
    }

    /**
     * Roll an expression and add an extra modifier. No floor applies.
     */
    public DiceRollResult roll(DiceExpression expression, int extraModifier) {
        checkRange(expression.count(), expression.sides(), expression.modifier(), extraModifier);
        List<Integer> faces = rollFaces(expression.count(), expression.sides(), null, null);
        int total = Math.addExact(Math.addExact(sum(faces), expression.modifier()), extraModifier);
        return new DiceRollResult(expression.toString(), faces, List.of(),
            expression.modifier(), extraModifier, 0, total, false);
    }

    /**
     * Roll damage. A critical doubles the number of dice, not the modifier.
     * The final total is floored at 1.
     */
    public DiceRollResult rollDamage(DiceExpression expression, int extraModifier, boolean critical) {
        return rollDamage(expression, extraModifier, critical, null);
    }

    /**
     * Roll damage, rerolling once every die that shows rerollThreshold or less.
     */
    public DiceRollResult rollDamage(DiceExpression expression, int extraModifier,
                                     boolean critical, Integer rerollThreshold) {
        int count = critical ? expression.count() * 2 : expression.count();
        checkRange(count, expression.sides(), expression.modifier(), extraModifier);
        List<Integer> discarded = new ArrayList<>();
        List<Integer> faces = rollFaces(count, expression.sides(), rerollThreshold, discarded);
        return floored(expression, faces, discarded, extraModifier, critical);
    }

    /**
     * Roll healing. The final total is floored at 1.
     */
    public DiceRollResult rollHealing(DiceExpression expression, int extraModifier) {
        checkRange(expression.count(), expression.sides(), expression.modifier(), extraModifier);
        List<Integer> faces = rollFaces(expression.count(), expression.sides(), null, null);
        return floored(expression, faces, List.of(), extraModifier, false);
    }

    /**
     * Roll an expression, rerolling once each die at or below the threshold
     * and keeping the second face whatever it shows.
     */
    public DiceRollResult rollWithReroll(DiceExpression expression, int threshold) {
        checkRange(expression.count(), expression.sides(), expression.modifier(), 0);
        List<Integer> discarded = new ArrayList<>();
        List<Integer> faces = rollFaces(expression.count(), expression.sides(), threshold, discarded);
        int total = Math.addExact(sum(faces), expression.modifier());
        return new DiceRollResult(expression.toString(), faces, discarded,
            expression.modifier(), 0, 0, total, false);
    }

    // ========== Internals ==========

    private List<Integer> rollFaces(int count, int sides, Integer rerollThreshold, List<Integer> discarded) {
        List<Integer> faces = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int face = rollDie(sides);
            if (rerollThreshold != null && face <= rerollThreshold) {
                discarded.add(face);
                face = rollDie(sides);
            }
            faces.add(face);
        }
        return faces;
    }

    private DiceRollResult floored(DiceExpression expression, List<Integer> faces, List<Integer> discarded,
                                   int extraModifier, boolean critical) {
        int raw = Math.addExact(Math.addExact(sum(faces), expression.modifier()), extraModifier);
        int floorAdjustment = raw < 1 ? Math.subtractExact(1, raw) : 0;
        return new DiceRollResult(expression.toString(), faces, discarded,
            expression.modifier(), extraModifier, floorAdjustment, raw + floorAdjustment, critical);
    }

    /**
     * Throws before any die is drawn when the extreme totals would not fit in an int.
     */
    private static void checkRange(int count, int sides, int modifier, int extraModifier) {
        int modifiers = Math.addExact(modifier, extraModifier);
        Math.addExact(Math.multiplyExact(count, sides), modifiers);
        Math.subtractExact(1, Math.addExact(count, modifiers));
    }

    private int nextDraw() {
        int value;
        do {
            value = generator.nextInt() >>> 1;
        } while (value >= DRAW_BOUND);
        return value + 1;
    }

    private static int sum(List<Integer> values) {
        return values.stream().reduce(0, Math::addExact);
    }

    /**
     * Seed magnitude as little-endian 32-bit words, high zero words dropped.
     */
    static int[] seedKey(long seed) {
        // Math.abs(Long.MIN_VALUE) keeps the bit pattern of 2^63, which is what the key needs
        long magnitude = Math.abs(seed);
        int low = (int) magnitude;
        int high = (int) (magnitude >>> 32);
        return high == 0 ? new int[] {low} : new int[] {low, high};
    }
}
