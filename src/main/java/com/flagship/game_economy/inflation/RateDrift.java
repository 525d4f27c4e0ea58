package com.flagship.game_economy.inflation;

import com.flagship.game_economy.currency.ExchangeRate;

/**
 * Relative change applied to an exchange rate in a controller cycle.
 * Implementations must return the same value for the same cycle and rate pair.
 */
@FunctionalInterface
public interface RateDrift {

    double relativeDelta(long cycle, ExchangeRate rate);
}
