package com.flagship.game_economy.currency;

import lombok.Value;

import java.time.Instant;

/**
 * Directional conversion rate from one currency into another.
 *
 * Immutable: drift produces a new instance. The rate always lies within
 * {@code [minRate, maxRate]}; every factory path clamps.
 *
 * {@code cycleBaseRate} is the rate as it stood before the drift of
 * {@code lastCycle} was applied, so repeating a cycle starts from the same base.
 */
@Value
public class ExchangeRate {
    String fromCurrency;
    String toCurrency;
    double rate;
    double minRate;
    double maxRate;
    boolean active;
    Instant lastUpdated;
    long lastCycle;
    double cycleBaseRate;

    public static ExchangeRate of(String from, String to, double rate, double minRate, double maxRate,
                                  boolean active, Instant now) {
        if (minRate <= 0 || maxRate < minRate) {
            throw new IllegalArgumentException(
                String.format("Invalid clamp band [%s, %s] for %s->%s", minRate, maxRate, from, to));
        }
        double clamped = clamp(rate, minRate, maxRate);
        return new ExchangeRate(from, to, clamped, minRate, maxRate, active, now, 0L, clamped);
    }

    /**
     * Applies a relative drift for a controller cycle. Re-applying the same cycle
     * recomputes from the pre-cycle base instead of compounding.
     */
    public ExchangeRate drift(long cycle, double relativeDelta, Instant now) {
        double base = (cycle == lastCycle) ? cycleBaseRate : rate;
        double next = clamp(base * (1.0 + relativeDelta), minRate, maxRate);
        return new ExchangeRate(fromCurrency, toCurrency, next, minRate, maxRate, active, now, cycle, base);
    }

    public ExchangeRate withActive(boolean isActive, Instant now) {
        return new ExchangeRate(fromCurrency, toCurrency, rate, minRate, maxRate, isActive, now, lastCycle, cycleBaseRate);
    }

    public String key() {
        return keyOf(fromCurrency, toCurrency);
    }

    public static String keyOf(String from, String to) {
        return from + "->" + to;
    }

    static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }
}
