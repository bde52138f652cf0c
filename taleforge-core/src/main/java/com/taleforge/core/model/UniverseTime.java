package com.taleforge.core.model;

/**
 * A point on the in-world clock.
 *
 * Invariants:
 * - month and day are 1-based
 * - 0 <= hour < 24, 0 <= minute < 60
 */
public record UniverseTime(
    int year,
    int month,
    int day,
    int hour,
    int minute
) {
    public static final UniverseTime EPOCH = new UniverseTime(1, 1, 1, 0, 0);

    public UniverseTime {
        if (month < 1) {
            throw new IllegalArgumentException("month must be >= 1: " + month);
        }
        if (day < 1) {
            throw new IllegalArgumentException("day must be >= 1: " + day);
        }
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("hour must be 0-23: " + hour);
        }
        if (minute < 0 || minute > 59) {
            throw new IllegalArgumentException("minute must be 0-59: " + minute);
        }
    }

    /**
     * Minutes since the start of year zero on the given calendar.
     */
    public long toTotalMinutes(CalendarConfig calendar) {
        if (month > calendar.monthCount()) {
            throw new IllegalArgumentException("month " + month + " not in calendar");
        }
        long days = (long) year * calendar.daysPerYear();
        for (int i = 1; i < month; i++) {
            days += calendar.month(i).days();
        }
        days += day - 1;
        return days * CalendarConfig.MINUTES_PER_DAY + hour * 60L + minute;
    }

    /**
     * @throws ArithmeticException if the year falls outside the int range
     */
    public static UniverseTime fromTotalMinutes(long totalMinutes, CalendarConfig calendar) {
        int minute = (int) Math.floorMod(totalMinutes, 60L);
        long totalHours = Math.floorDiv(totalMinutes, 60L);
        int hour = (int) Math.floorMod(totalHours, 24L);
        long totalDays = Math.floorDiv(totalHours, 24L);

        int year = Math.toIntExact(Math.floorDiv(totalDays, (long) calendar.daysPerYear()));
        int remaining = (int) Math.floorMod(totalDays, (long) calendar.daysPerYear());

        int month = 1;
        for (CalendarConfig.Month m : calendar.months()) {
            if (remaining < m.days()) {
                break;
            }
            remaining -= m.days();
            month++;
        }
        return new UniverseTime(year, month, remaining + 1, hour, minute);
    }

    /**
     * Whether this time lies within the given calendar (month and day in range).
     */
    public boolean fitsCalendar(CalendarConfig calendar) {
        return month <= calendar.monthCount() && day <= calendar.month(month).days();
    }
}
