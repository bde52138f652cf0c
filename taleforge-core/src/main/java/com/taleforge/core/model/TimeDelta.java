package com.taleforge.core.model;

/**
 * An amount of in-world time to advance the clock by.
 * A month counts as the calendar's average month length.
 */
public record TimeDelta(
    long years,
    long months,
    long days,
    long hours,
    long minutes
) {
    public static final TimeDelta ZERO = new TimeDelta(0, 0, 0, 0, 0);

    public static TimeDelta ofMinutes(long minutes) {
        return new TimeDelta(0, 0, 0, 0, minutes);
    }

    public static TimeDelta ofDays(long days) {
        return new TimeDelta(0, 0, days, 0, 0);
    }

    public boolean isNegative() {
        return years < 0 || months < 0 || days < 0 || hours < 0 || minutes < 0;
    }

    /**
     * @throws ArithmeticException if the total does not fit in a long
     */
    public long toTotalMinutes(CalendarConfig calendar) {
        long total = minutes;
        total = Math.addExact(total, Math.multiplyExact(hours, 60L));
        total = Math.addExact(total, Math.multiplyExact(days, (long) CalendarConfig.MINUTES_PER_DAY));
        total = Math.addExact(total, Math.multiplyExact(months, calendar.minutesPerYear()) / calendar.monthCount());
        total = Math.addExact(total, Math.multiplyExact(years, calendar.minutesPerYear()));
        return total;
    }
}
