package com.flagship.game_economy.pricing;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Mutable part of the shop, detached for snapshots.
 */
@Value
public class ShopItemState {
    String itemId;
    List<ShopItemCost> currentCosts;
    long currentPurchases;
    boolean available;
    DiscountWindow discount;

    /**
     * Per-player purchase counts of one player.
     */
    @Value
    public static class PlayerPurchases {
        String playerId;
        Map<String, Long> counts;
    }
}
