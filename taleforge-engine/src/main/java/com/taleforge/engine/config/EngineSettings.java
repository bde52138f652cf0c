package com.taleforge.engine.config;

import com.taleforge.core.model.CalendarConfig;
import com.taleforge.engine.validation.ValidationLimits;

import java.time.Duration;

/**
 * Immutable engine configuration, built once at startup and handed to
 * components through their constructors.
 *
 * @param snapshotInterval snapshot every N turns; 0 disables periodic snapshots
 * @param lockWaitTimeout  how long a submission waits for the campaign lock; zero rejects at once
 * @param recentTurnWindow prior turns included in narrator context
 */
public record EngineSettings(
    int snapshotInterval,
    Duration lockWaitTimeout,
    int recentTurnWindow,
    ValidationLimits validation,
    CalendarConfig calendar
) {
    public static final EngineSettings DEFAULTS = new EngineSettings(
        10, Duration.ZERO, 10, ValidationLimits.DEFAULTS, CalendarConfig.DEFAULT);

    public EngineSettings {
        if (snapshotInterval < 0) {
            throw new IllegalArgumentException("snapshotInterval must be >= 0");
        }
        if (lockWaitTimeout == null || lockWaitTimeout.isNegative()) {
            throw new IllegalArgumentException("lockWaitTimeout must be zero or positive");
        }
        if (recentTurnWindow < 0) {
            throw new IllegalArgumentException("recentTurnWindow must be >= 0");
        }
        validation = validation != null ? validation : ValidationLimits.DEFAULTS;
        calendar = calendar != null ? calendar : CalendarConfig.DEFAULT;
    }

    public EngineSettings withSnapshotInterval(int interval) {
        return new EngineSettings(interval, lockWaitTimeout, recentTurnWindow, validation, calendar);
    }

    public EngineSettings withLockWaitTimeout(Duration timeout) {
        return new EngineSettings(snapshotInterval, timeout, recentTurnWindow, validation, calendar);
    }
}
