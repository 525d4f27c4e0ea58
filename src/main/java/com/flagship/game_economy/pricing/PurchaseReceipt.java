package com.flagship.game_economy.pricing;

import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
public class PurchaseReceipt {
    String playerId;
    String itemId;
    List<ShopItemCost> paid;
    List<ShopReward> granted;
    boolean discounted;
    Instant purchasedAt;
}
