package com.taleforge.core.model;

import java.util.List;

/**
 * Immutable calendar definition for a campaign universe.
 *
 * Invariants:
 * - At least one month, every month at least one day
 */
public record CalendarConfig(
    List<Month> months,
    List<String> weekdays
) {
    public static final int MINUTES_PER_DAY = 24 * 60;

    public static final CalendarConfig DEFAULT = new CalendarConfig(
        List.of(
            new Month("Deepwinter", 30),
            new Month("Clawfrost", 30),
            new Month("Thawmelt", 31),
            new Month("Greengrass", 30),
            new Month("Mirthal", 31),
            new Month("Summertide", 30),
            new Month("Highsun", 31),
            new Month("Latesummer", 31),
            new Month("Harvestglow", 30),
            new Month("Leaffall", 30),
            new Month("Frostdawn", 30),
            new Month("Winternight", 31)
        ),
        List.of("Moonday", "Towerday", "Wellday", "Thornday", "Fireday", "Starday", "Sunday")
    );

    public record Month(String name, int days) {
        public Month {
            if (days < 1) {
                throw new IllegalArgumentException("Month " + name + " must have at least one day");
            }
        }
    }

    public CalendarConfig {
        if (months == null || months.isEmpty()) {
            throw new IllegalArgumentException("Calendar needs at least one month");
        }
        months = List.copyOf(months);
        weekdays = weekdays == null ? List.of() : List.copyOf(weekdays);
    }

    public int daysPerYear() {
        return months.stream().mapToInt(Month::days).sum();
    }

    public int monthCount() {
        return months.size();
    }

    /**
     * Month by 1-based index.
     */
    public Month month(int index) {
        return months.get(index - 1);
    }

    public long minutesPerYear() {
        return (long) daysPerYear() * MINUTES_PER_DAY;
    }
}
