package com.taleforge.engine.validation;

/**
 * Numeric bounds applied by the output validators.
 *
 * @param maxBonus largest magnitude accepted for a flat bonus or modifier
 */
public record ValidationLimits(
    int minDifficultyClass,
    int maxDifficultyClass,
    int maxLoreTextLength,
    int maxTimeJumpYears,
    int maxDiceCount,
    int maxBonus
) {
    public static final ValidationLimits DEFAULTS = new ValidationLimits(1, 40, 2000, 100, 100, 50);

    public ValidationLimits {
        if (minDifficultyClass > maxDifficultyClass) {
            throw new IllegalArgumentException("min DC above max DC");
        }
        if (maxLoreTextLength < 1) {
            throw new IllegalArgumentException("maxLoreTextLength must be positive");
        }
        if (maxTimeJumpYears < 0) {
            throw new IllegalArgumentException("maxTimeJumpYears must be >= 0");
        }
        if (maxDiceCount < 1) {
            throw new IllegalArgumentException("maxDiceCount must be positive");
        }
        if (maxBonus < 0) {
            throw new IllegalArgumentException("maxBonus must be >= 0");
        }
    }
}
