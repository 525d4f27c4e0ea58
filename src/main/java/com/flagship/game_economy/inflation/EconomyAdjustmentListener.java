package com.flagship.game_economy.inflation;

/**
 * Receives the multipliers decided by the {@link InflationController}.
 *
 * Sinks (shop prices) apply the sink multiplier; sources (rewards) apply the
 * source multiplier. Values are absolute, not deltas.
 */
public interface EconomyAdjustmentListener {

    default void onSinkMultiplier(String currencyId, double multiplier) {
    }

    default void onSourceMultiplier(String currencyId, double multiplier) {
    }
}
