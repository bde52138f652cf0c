package com.taleforge.engine.metrics;

import com.taleforge.core.model.RollKind;
import com.taleforge.core.model.TurnPhase;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer metrics for turn processing.
 *
 * Metrics exposed:
 * - Turns persisted and failed (by phase), turn duration by outcome
 * - Rolls executed (by kind) and failed
 * - Rewinds, replayed turns, snapshots created
 * - Turns in flight
 */
public class TurnMetrics implements MeterBinder {

    // Metric names
    public static final String TURNS_PERSISTED = "taleforge.turns.persisted";
    public static final String TURNS_FAILED = "taleforge.turns.failed";
    public static final String TURN_DURATION = "taleforge.turn.duration";
    public static final String TURNS_IN_FLIGHT = "taleforge.turns.in_flight";

    public static final String ROLLS_EXECUTED = "taleforge.rolls.executed";
    public static final String ROLLS_FAILED = "taleforge.rolls.failed";

    public static final String REWINDS = "taleforge.rewinds";
    public static final String REWIND_TURNS_REMOVED = "taleforge.rewind.turns_removed";
    public static final String REPLAY_TURNS = "taleforge.replay.turns";
    public static final String SNAPSHOTS_CREATED = "taleforge.snapshots.created";

    private final AtomicInteger inFlight = new AtomicInteger(0);
    private volatile MeterRegistry registry;

    public TurnMetrics(MeterRegistry registry) {
        bindTo(registry);
    }

    /**
     * Metrics recorded into a private registry, for components used outside Spring.
     */
    public static TurnMetrics standalone() {
        return new TurnMetrics(new SimpleMeterRegistry());
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder(TURNS_IN_FLIGHT, inFlight, AtomicInteger::get)
            .description("Turns currently being processed")
            .register(registry);
    }

    public MeterRegistry registry() {
        return registry;
    }

    // ========== Turn Metrics ==========

    public void turnStarted() {
        inFlight.incrementAndGet();
    }

    public void turnPersisted(Duration duration) {
        inFlight.decrementAndGet();
        Counter.builder(TURNS_PERSISTED)
            .description("Turns committed to the log")
            .register(registry)
            .increment();
        recordDuration("persisted", duration);
    }

    public void turnFailed(TurnPhase phase, Duration duration) {
        inFlight.decrementAndGet();
        Counter.builder(TURNS_FAILED)
            .tag("phase", phase != null ? phase.name() : "UNKNOWN")
            .description("Turns that ended in FAILED")
            .register(registry)
            .increment();
        recordDuration("failed", duration);
    }

    private void recordDuration(String outcome, Duration duration) {
        Timer.builder(TURN_DURATION)
            .tag("outcome", outcome)
            .description("Turn processing duration")
            .register(registry)
            .record(duration);
    }

    // ========== Mechanics Metrics ==========

    public void rollExecuted(RollKind kind) {
        Counter.builder(ROLLS_EXECUTED)
            .tag("kind", kind != null ? kind.code() : "unknown")
            .description("Rolls resolved by the mechanics executor")
            .register(registry)
            .increment();
    }

    public void rollFailed() {
        Counter.builder(ROLLS_FAILED)
            .description("Roll requests that produced an error result")
            .register(registry)
            .increment();
    }

    // ========== State Metrics ==========

    public void rewound(int turnsRemoved) {
        Counter.builder(REWINDS)
            .description("Completed rewinds")
            .register(registry)
            .increment();
        DistributionSummary.builder(REWIND_TURNS_REMOVED)
            .description("Turns truncated per rewind")
            .register(registry)
            .record(turnsRemoved);
    }

    public void turnsReplayed(int count) {
        if (count <= 0) {
            return;
        }
        Counter.builder(REPLAY_TURNS)
            .description("Turn patches re-applied during replay")
            .register(registry)
            .increment(count);
    }

    public void snapshotCreated() {
        Counter.builder(SNAPSHOTS_CREATED)
            .description("State snapshots written")
            .register(registry)
            .increment();
    }

    public int turnsInFlight() {
        return inFlight.get();
    }
}
