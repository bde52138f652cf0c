package com.taleforge.engine.time;

import com.taleforge.core.model.CalendarConfig;
import com.taleforge.core.model.TimeDelta;
import com.taleforge.core.model.UniverseTime;
import com.taleforge.core.model.ValidationResult;

/**
 * Checks that proposed clock changes move forward by a plausible amount.
 * Jumps beyond the configured maximum are errors; jumps over a month or a
 * year are allowed with a warning.
 */
public class TimeValidator {

    public static final String NEGATIVE_TIME_DELTA = "NEGATIVE_TIME_DELTA";
    public static final String TIME_JUMP_TOO_LARGE = "TIME_JUMP_TOO_LARGE";
    public static final String TIME_REGRESSION = "TIME_REGRESSION";
    public static final String LARGE_TIME_JUMP = "LARGE_TIME_JUMP";
    public static final String SIGNIFICANT_TIME_JUMP = "SIGNIFICANT_TIME_JUMP";
    public static final String INVALID_TIME = "INVALID_TIME";

    private static final long SIGNIFICANT_DAYS = 30;

    private final CalendarService calendarService;
    private final int maxJumpYears;

    public TimeValidator(CalendarService calendarService, int maxJumpYears) {
        this.calendarService = calendarService;
        this.maxJumpYears = maxJumpYears;
    }

    /**
     * Validate one delta in isolation.
     */
    public ValidationResult validateDelta(TimeDelta delta, String path) {
        if (delta.isNegative()) {
            return ValidationResult.error(path, NEGATIVE_TIME_DELTA,
                "Time delta fields must be non-negative: " + delta);
        }
        return ValidationResult.ok();
    }

    /**
     * Validate moving the clock from current to proposed.
     */
    public ValidationResult validateAdvance(UniverseTime current, UniverseTime proposed, String path) {
        CalendarConfig calendar = calendarService.calendar();
        if (!proposed.fitsCalendar(calendar)) {
            return ValidationResult.error(path, INVALID_TIME, "Time is not a valid calendar date: " + proposed);
        }
        long minutes = calendarService.minutesBetween(current, proposed);
        if (minutes < 0) {
            return ValidationResult.error(path, TIME_REGRESSION,
                "Time cannot move backwards from " + calendarService.format(current));
        }
        long days = minutes / CalendarConfig.MINUTES_PER_DAY;
        long maxDays = (long) maxJumpYears * calendar.daysPerYear();
        if (days > maxDays) {
            return ValidationResult.error(path, TIME_JUMP_TOO_LARGE, String.format(
                "Time jump of %d days exceeds the limit of %d years", days, maxJumpYears));
        }
        if (days > calendar.daysPerYear()) {
            return ValidationResult.warning(path, LARGE_TIME_JUMP,
                String.format("Large time jump: %d days (over a year)", days));
        }
        if (days > SIGNIFICANT_DAYS) {
            return ValidationResult.warning(path, SIGNIFICANT_TIME_JUMP,
                String.format("Significant time jump: %d days", days));
        }
        return ValidationResult.ok();
    }

    /**
     * Validate advancing the clock by a delta.
     */
    public ValidationResult validateAdvance(UniverseTime current, TimeDelta delta, String path) {
        ValidationResult deltaResult = validateDelta(delta, path);
        if (!deltaResult.valid()) {
            return deltaResult;
        }
        UniverseTime proposed;
        try {
            proposed = calendarService.advance(current, delta);
        } catch (ArithmeticException e) {
            return tooLarge(path);
        }
        return validateAdvance(current, proposed, path);
    }

    /**
     * Error for a delta whose size cannot even be represented.
     */
    public ValidationResult tooLarge(String path) {
        return ValidationResult.error(path, TIME_JUMP_TOO_LARGE,
            "Time jump exceeds the limit of " + maxJumpYears + " years");
    }
}
