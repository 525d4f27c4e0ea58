package com.flagship.game_economy.currency;

import lombok.Builder;
import lombok.Value;

/**
 * Static definition of a currency.
 * Registered once from the catalog and never changed afterwards.
 */
@Value
@Builder
public class Currency {
    String id;
    String displayName;
    String symbol;
    boolean hardCurrency;
    boolean tradeable;
    long minAmount;
    long maxAmount;
    int decimalPlaces;

    /**
     * Clamps an amount into {@code [minAmount, maxAmount]}.
     */
    public long clamp(long amount) {
        return Math.max(minAmount, Math.min(maxAmount, amount));
    }

    public boolean isWithinBounds(long amount) {
        return amount >= minAmount && amount <= maxAmount;
    }
}
