package com.flagship.game_economy.catalog;

import com.flagship.game_economy.pricing.RewardType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON shape of the economy catalog.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CatalogDocument {

    private List<CurrencyEntry> currencies = new ArrayList<>();
    private List<ExchangeRateEntry> exchangeRates = new ArrayList<>();
    private List<ShopItemEntry> shopItems = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CurrencyEntry {
        private String id;
        private String displayName;
        private String symbol;
        private boolean hardCurrency;
        private boolean tradeable = true;
        private long minAmount;
        private long maxAmount = Long.MAX_VALUE;
        private int decimalPlaces;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ExchangeRateEntry {
        private String from;
        private String to;
        private double rate;
        private double minRate;
        private double maxRate;
        private boolean active = true;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ShopItemEntry {
        private String id;
        private String name;
        private String description;
        private String category;
        private List<CostEntry> costs = new ArrayList<>();
        private List<RewardEntry> rewards = new ArrayList<>();
        private ConditionsEntry conditions;
        private boolean available = true;
        private int maxPurchases = -1;
        private Instant availableUntil;
        private int displayOrder;
        private boolean popular;
        private boolean recommended;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CostEntry {
        private String currencyId;
        private long amount;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RewardEntry {
        private RewardType type;
        private String id;
        private long amount;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ConditionsEntry {
        private int minLevel;
        private int maxLevel = Integer.MAX_VALUE;
        private int maxPerPlayer = -1;
    }
}
