package com.flagship.game_economy.pricing;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Read-only presentation of a shop item with computed prices.
 */
@Value
@Builder
public class ShopItemView {
    String id;
    String name;
    String description;
    String category;
    List<PriceQuote> prices;
    List<ShopReward> rewards;
    boolean available;
    long currentPurchases;
    int maxPurchases;
    Instant availableUntil;
    Double discountPercentage;
    Instant discountEndsAt;
    int displayOrder;
    boolean popular;
    boolean recommended;
}
