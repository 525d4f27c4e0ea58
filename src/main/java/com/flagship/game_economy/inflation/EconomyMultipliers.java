package com.flagship.game_economy.inflation;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-currency sink and source multipliers held by the inflation controller.
 * Updates go through {@link ConcurrentHashMap#compute}, one currency at a time.
 */
public class EconomyMultipliers {

    private final ConcurrentHashMap<String, MultiplierState> states = new ConcurrentHashMap<>();
    private final double min;
    private final double max;

    public EconomyMultipliers(double min, double max) {
        if (min <= 0 || max < min || min > 1.0 || max < 1.0) {
            throw new IllegalArgumentException(
                String.format("Multiplier band [%s, %s] must be positive and contain 1.0", min, max));
        }
        this.min = min;
        this.max = max;
    }

    public MultiplierState get(String currencyId) {
        return states.getOrDefault(currencyId, MultiplierState.neutral());
    }

    MultiplierState adjust(String currencyId, long cycle, double sinkFactor, double sourceFactor) {
        return states.compute(currencyId, (id, current) ->
            (current == null ? MultiplierState.neutral() : current).adjust(cycle, sinkFactor, sourceFactor, min, max));
    }

    public Map<String, MultiplierState> all() {
        return Map.copyOf(states);
    }

    void replaceAll(Map<String, MultiplierState> restored) {
        states.clear();
        restored.forEach((currencyId, state) -> states.put(currencyId, new MultiplierState(
            MultiplierState.clamp(state.getSink(), min, max),
            MultiplierState.clamp(state.getSource(), min, max),
            state.getLastCycle(), state.getBaseSink(), state.getBaseSource())));
    }

    public double min() {
        return min;
    }

    public double max() {
        return max;
    }
}
