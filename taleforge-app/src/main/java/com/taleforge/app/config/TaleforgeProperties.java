package com.taleforge.app.config;

import com.taleforge.core.model.CalendarConfig;
import com.taleforge.engine.config.EngineSettings;
import com.taleforge.engine.validation.ValidationLimits;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Engine settings bound from {@code taleforge.*}.
 * Converted once into {@link EngineSettings}; engine components never read these directly.
 */
@ConfigurationProperties(prefix = "taleforge")
public class TaleforgeProperties {

    public enum PersistenceMode {
        MEMORY,
        JDBC
    }

    /**
     * Snapshot every N turns; 0 disables periodic snapshots.
     */
    private int snapshotInterval = 10;

    /**
     * How long a submission waits for the campaign lock. Zero rejects at once.
     */
    private Duration lockWaitTimeout = Duration.ZERO;

    /**
     * Prior turns included in the narrator context.
     */
    private int recentTurnWindow = 10;

    private PersistenceMode persistence = PersistenceMode.MEMORY;

    private final Validation validation = new Validation();

    public EngineSettings toEngineSettings() {
        return new EngineSettings(
            snapshotInterval,
            lockWaitTimeout,
            recentTurnWindow,
            validation.toLimits(),
            CalendarConfig.DEFAULT
        );
    }

    public int getSnapshotInterval() {
        return snapshotInterval;
    }

    public void setSnapshotInterval(int snapshotInterval) {
        this.snapshotInterval = snapshotInterval;
    }

    public Duration getLockWaitTimeout() {
        return lockWaitTimeout;
    }

    public void setLockWaitTimeout(Duration lockWaitTimeout) {
        this.lockWaitTimeout = lockWaitTimeout;
    }

    public int getRecentTurnWindow() {
        return recentTurnWindow;
    }

    public void setRecentTurnWindow(int recentTurnWindow) {
        this.recentTurnWindow = recentTurnWindow;
    }

    public PersistenceMode getPersistence() {
        return persistence;
    }

    public void setPersistence(PersistenceMode persistence) {
        this.persistence = persistence;
    }

    public Validation getValidation() {
        return validation;
    }

    /**
     * Bounds applied to narrator output ({@code taleforge.validation.*}).
     */
    public static class Validation {

        private int minDc = ValidationLimits.DEFAULTS.minDifficultyClass();
        private int maxDc = ValidationLimits.DEFAULTS.maxDifficultyClass();
        private int maxLoreTextLength = ValidationLimits.DEFAULTS.maxLoreTextLength();
        private int maxTimeJumpYears = ValidationLimits.DEFAULTS.maxTimeJumpYears();
        private int maxDiceCount = ValidationLimits.DEFAULTS.maxDiceCount();
        private int maxBonus = ValidationLimits.DEFAULTS.maxBonus();

        ValidationLimits toLimits() {
            return new ValidationLimits(minDc, maxDc, maxLoreTextLength, maxTimeJumpYears, maxDiceCount, maxBonus);
        }

        public int getMinDc() {
            return minDc;
        }

        public void setMinDc(int minDc) {
            this.minDc = minDc;
        }

        public int getMaxDc() {
            return maxDc;
        }

        public void setMaxDc(int maxDc) {
            this.maxDc = maxDc;
        }

        public int getMaxLoreTextLength() {
            return maxLoreTextLength;
        }

        public void setMaxLoreTextLength(int maxLoreTextLength) {
            this.maxLoreTextLength = maxLoreTextLength;
        }

        public int getMaxTimeJumpYears() {
            return maxTimeJumpYears;
        }

        public void setMaxTimeJumpYears(int maxTimeJumpYears) {
            this.maxTimeJumpYears = maxTimeJumpYears;
        }

        public int getMaxDiceCount() {
            return maxDiceCount;
        }

        public void setMaxDiceCount(int maxDiceCount) {
            this.maxDiceCount = maxDiceCount;
        }

        public int getMaxBonus() {
            return maxBonus;
        }

        public void setMaxBonus(int maxBonus) {
            this.maxBonus = maxBonus;
        }
    }
}
