package com.flagship.game_economy.catalog;

import com.flagship.game_economy.currency.Currency;
import com.flagship.game_economy.currency.ExchangeRate;
import com.flagship.game_economy.pricing.ShopItemDefinition;
import lombok.Value;

import java.util.List;

/**
 * Validated catalog, ready to seed the registry, the rate book and the shop.
 */
@Value
public class EconomyCatalog {
    List<Currency> currencies;
    List<ExchangeRate> exchangeRates;
    List<ShopItemDefinition> shopItems;
}
