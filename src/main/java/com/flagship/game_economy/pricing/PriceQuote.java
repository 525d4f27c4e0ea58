package com.flagship.game_economy.pricing;

import lombok.Value;

/**
 * Listed and charged price of one cost line. The charged amount includes the
 * current sink multiplier of the currency.
 */
@Value
public class PriceQuote {
    String currencyId;
    long originalAmount;
    long listedAmount;
    long chargedAmount;
}
