package com.flagship.game_economy.pricing;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Catalog definition of a shop item, read once at startup.
 * A negative {@code maxPurchases} means unlimited; a null
 * {@code availableUntil} means the item is not time-boxed.
 */
@Value
@Builder
public class ShopItemDefinition {
    String id;
    String name;
    String description;
    String category;
    List<ShopItemCost> costs;
    List<ShopReward> rewards;
    PurchaseConditions conditions;
    boolean available;
    int maxPurchases;
    Instant availableUntil;
    int displayOrder;
    boolean popular;
    boolean recommended;
}
