package com.taleforge.engine.time;

import com.taleforge.core.model.CalendarConfig;
import com.taleforge.core.model.TimeDelta;
import com.taleforge.core.model.UniverseTime;

/**
 * Clock arithmetic over a campaign calendar.
 */
public class CalendarService {

    private final CalendarConfig calendar;

    public CalendarService(CalendarConfig calendar) {
        this.calendar = calendar;
    }

    public CalendarConfig calendar() {
        return calendar;
    }

    /**
     * @throws ArithmeticException if the result is beyond the representable clock
     */
    public UniverseTime advance(UniverseTime current, TimeDelta delta) {
        long total = Math.addExact(current.toTotalMinutes(calendar), delta.toTotalMinutes(calendar));
        return UniverseTime.fromTotalMinutes(total, calendar);
    }

    /**
     * Minutes from start to end; negative when end precedes start.
     */
    public long minutesBetween(UniverseTime start, UniverseTime end) {
        return end.toTotalMinutes(calendar) - start.toTotalMinutes(calendar);
    }

    public String weekday(UniverseTime time) {
        if (calendar.weekdays().isEmpty()) {
            return "";
        }
        long totalDays = Math.floorDiv(time.toTotalMinutes(calendar), (long) CalendarConfig.MINUTES_PER_DAY);
        return calendar.weekdays().get((int) Math.floorMod(totalDays, (long) calendar.weekdays().size()));
    }

    /**
     * Human-readable form, e.g. "3 Thawmelt, Year 1023, 14:05".
     */
    public String format(UniverseTime time) {
        String monthName = time.month() <= calendar.monthCount()
            ? calendar.month(time.month()).name()
            : "Month " + time.month();
        return String.format("%d %s, Year %d, %02d:%02d",
            time.day(), monthName, time.year(), time.hour(), time.minute());
    }
}
