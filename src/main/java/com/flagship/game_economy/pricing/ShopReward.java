package com.flagship.game_economy.pricing;

import lombok.Value;

/**
 * A reward granted on purchase. For {@link RewardType#CURRENCY} the id is a
 * currency id; otherwise it names an inventory item or booster.
 */
@Value
public class ShopReward {
    RewardType type;
    String id;
    long amount;
}
