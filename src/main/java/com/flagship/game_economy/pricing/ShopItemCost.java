package com.flagship.game_economy.pricing;

import lombok.Value;

@Value
public class ShopItemCost {
    String currencyId;
    long amount;

    ShopItemCost withAmount(long newAmount) {
        return new ShopItemCost(currencyId, newAmount);
    }
}
