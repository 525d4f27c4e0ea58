package com.flagship.game_economy.inflation;

import lombok.Value;

/**
 * Controller verdict for one currency in one cycle.
 */
@Value
public class CurrencyInflation {
    String currencyId;
    int sampled;
    long earned;
    long spent;
    double inflationRate;
    InflationDirection direction;
    double sinkMultiplier;
    double sourceMultiplier;
}
