package com.flagship.game_economy.pricing;

import lombok.Value;

import java.util.List;

/**
 * Shop item definitions loaded from the catalog.
 */
@Value
public class ShopCatalog {
    List<ShopItemDefinition> items;
}
