package com.flagship.game_economy.inflation;

import lombok.Value;

/**
 * Sink and source multipliers of one currency.
 *
 * {@code baseSink}/{@code baseSource} hold the values from before the
 * adjustment of {@code lastCycle}, so an adjustment repeated within the same
 * cycle is computed from the same starting point.
 */
@Value
public class MultiplierState {
    double sink;
    double source;
    long lastCycle;
    double baseSink;
    double baseSource;

    public static MultiplierState neutral() {
        return new MultiplierState(1.0, 1.0, 0L, 1.0, 1.0);
    }

    MultiplierState adjust(long cycle, double sinkFactor, double sourceFactor, double min, double max) {
        double startSink = cycle == lastCycle ? baseSink : sink;
        double startSource = cycle == lastCycle ? baseSource : source;
        return new MultiplierState(clamp(startSink * sinkFactor, min, max),
            clamp(startSource * sourceFactor, min, max), cycle, startSink, startSource);
    }

    static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return 1.0;
        }
        return Math.max(min, Math.min(max, value));
    }
}
