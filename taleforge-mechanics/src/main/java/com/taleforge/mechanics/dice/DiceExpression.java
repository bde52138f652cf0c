package com.taleforge.mechanics.dice;

import com.taleforge.core.exception.InvalidDiceExpressionException;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed dice notation: {@code NdM}, {@code NdM+K} or {@code NdM-K}.
 *
 * Invariants:
 * - 1 <= count <= MAX_DICE
 * - sides >= 1
 */
public record DiceExpression(int count, int sides, int modifier) {

    public static final int MAX_DICE = 100;

    private static final Pattern NOTATION = Pattern.compile("^(\\d+)d(\\d+)(?:([+-])(\\d+))?$");

    public DiceExpression {
        if (count < 1 || count > MAX_DICE) {
            throw new InvalidDiceExpressionException(count + "d" + sides,
                "dice count must be between 1 and " + MAX_DICE);
        }
        if (sides < 1) {
            throw new InvalidDiceExpressionException(count + "d" + sides, "die must have at least one side");
        }
    }

    /**
     * Parse dice notation, ignoring case and surrounding whitespace.
     *
     * @throws InvalidDiceExpressionException if the text is not valid notation
     */
    public static DiceExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidDiceExpressionException(String.valueOf(expression), "expression is empty");
        }
        Matcher matcher = NOTATION.matcher(expression.trim().toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            throw new InvalidDiceExpressionException(expression, "expected a form like 2d6 or 1d8+3");
        }
        try {
            int count = Integer.parseInt(matcher.group(1));
            int sides = Integer.parseInt(matcher.group(2));
            int modifier = 0;
            if (matcher.group(3) != null) {
                modifier = Integer.parseInt(matcher.group(4));
                if ("-".equals(matcher.group(3))) {
                    modifier = -modifier;
                }
            }
            return new DiceExpression(count, sides, modifier);
        } catch (NumberFormatException e) {
            throw new InvalidDiceExpressionException(expression, "number out of range");
        }
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (InvalidDiceExpressionException e) {
            return false;
        }
    }

    @Override
    public String toString() {
        if (modifier > 0) {
            return count + "d" + sides + "+" + modifier;
        }
        if (modifier < 0) {
            return count + "d" + sides + modifier;
        }
        return count + "d" + sides;
    }
}
