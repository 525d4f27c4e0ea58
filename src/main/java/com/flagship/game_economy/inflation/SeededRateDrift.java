package com.flagship.game_economy.inflation;

import com.flagship.game_economy.currency.ExchangeRate;

import java.util.SplittableRandom;

/**
 * Pseudo-random drift in {@code [-maxDrift, +maxDrift]}, derived from the seed,
 * the cycle number and the rate pair. Re-running a cycle yields the same drift.
 */
public class SeededRateDrift implements RateDrift {

    private final long seed;
    private final double maxDrift;

    public SeededRateDrift(long seed, double maxDrift) {
        if (maxDrift < 0 || maxDrift >= 1.0) {
            throw new IllegalArgumentException("Rate drift must be in [0, 1): " + maxDrift);
        }
        this.seed = seed;
        this.maxDrift = maxDrift;
    }

    @Override
    public double relativeDelta(long cycle, ExchangeRate rate) {
        if (maxDrift == 0) {
            return 0;
        }
        long mixed = seed * 31 + cycle;
        mixed = mixed * 31 + rate.key().hashCode();
        return new SplittableRandom(mixed).nextDouble(-maxDrift, maxDrift);
    }
}
