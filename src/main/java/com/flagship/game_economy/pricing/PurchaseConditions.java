package com.flagship.game_economy.pricing;

import lombok.Value;

/**
 * Player-facing eligibility rules of a shop item. A negative
 * {@code maxPerPlayer} means unlimited.
 */
@Value
public class PurchaseConditions {
    int minLevel;
    int maxLevel;
    int maxPerPlayer;

    public static PurchaseConditions unrestricted() {
        return new PurchaseConditions(0, Integer.MAX_VALUE, -1);
    }

    boolean levelAllowed(int level) {
        return level >= minLevel && level <= maxLevel;
    }

    boolean perPlayerCapReached(long purchased) {
        return maxPerPlayer >= 0 && purchased >= maxPerPlayer;
    }
}
