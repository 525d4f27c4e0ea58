package com.flagship.game_economy.scheduling;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Clock for the economy's simulated time.
 *
 * In production it follows the wall clock; once {@link #freezeAt} has been
 * called it only moves when {@link #advance} is called, which lets tests step
 * through days of inactivity or discount windows without sleeping.
 */
public class SimulationClock extends Clock {

    private final Clock source;
    private final AtomicReference<Instant> frozen;

    private SimulationClock(Clock source, Instant frozenAt) {
        this.source = source;
        this.frozen = new AtomicReference<>(frozenAt);
    }

    public static SimulationClock system() {
        return new SimulationClock(Clock.systemUTC(), null);
    }

    public static SimulationClock fixed(Instant start) {
        return new SimulationClock(Clock.systemUTC(), start);
    }

    public void freezeAt(Instant instant) {
        frozen.set(instant);
    }

    /**
     * Moves simulated time forward. Only valid on a frozen clock.
     */
    public Instant advance(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("Simulated time cannot move backwards");
        }
        Instant next = frozen.updateAndGet(current -> {
            if (current == null) {
                throw new IllegalStateException("Clock follows wall time; freeze it before advancing");
            }
            return current.plus(duration);
        });
        return next;
    }

    public boolean isFrozen() {
        return frozen.get() != null;
    }

    @Override
    public Instant instant() {
        Instant current = frozen.get();
        return current != null ? current : source.instant();
    }

    @Override
    public ZoneId getZone() {
        return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return Clock.fixed(instant(), zone);
    }
}
