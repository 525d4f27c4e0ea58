package com.flagship.game_economy.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.game_economy.currency.Currency;
import com.flagship.game_economy.currency.ExchangeRate;
import com.flagship.game_economy.pricing.PurchaseConditions;
import com.flagship.game_economy.pricing.RewardType;
import com.flagship.game_economy.pricing.ShopItemCost;
import com.flagship.game_economy.pricing.ShopItemDefinition;
import com.flagship.game_economy.pricing.ShopReward;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads and validates the static economy catalog.
 *
 * Every reference is checked before anything is registered: a rate or shop item
 * naming an unknown currency aborts startup with {@link CatalogException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CatalogLoader {

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public EconomyCatalog load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.error("Economy catalog not found at {}", location);
            throw new CatalogException("Economy catalog not found at " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            EconomyCatalog catalog = parse(in);
            log.info("Loaded economy catalog from {}: {} currencies, {} exchange rates, {} shop items", location,
                catalog.getCurrencies().size(), catalog.getExchangeRates().size(), catalog.getShopItems().size());
            return catalog;
        } catch (IOException e) {
            log.error("Economy catalog at {} could not be read: {}", location, e.getMessage());
            throw new CatalogException("Economy catalog at " + location + " could not be read", e);
        }
    }

    public EconomyCatalog parse(InputStream in) throws IOException {
        CatalogDocument document = objectMapper.readValue(in, CatalogDocument.class);
        return toCatalog(document);
    }

    EconomyCatalog toCatalog(CatalogDocument document) {
        Instant now = clock.instant();
        List<Currency> currencies = new ArrayList<>();
        Set<String> currencyIds = new HashSet<>();
        for (CatalogDocument.CurrencyEntry entry : nullSafe(document.getCurrencies())) {
            requireText(entry.getId(), "currency id");
            if (!currencyIds.add(entry.getId())) {
                throw new CatalogException("Duplicate currency " + entry.getId());
            }
            if (entry.getMinAmount() < 0 || entry.getMaxAmount() < entry.getMinAmount()) {
                throw new CatalogException("Currency " + entry.getId() + " has invalid bounds ["
                    + entry.getMinAmount() + ", " + entry.getMaxAmount() + "]");
            }
            currencies.add(Currency.builder()
                .id(entry.getId())
                .displayName(entry.getDisplayName() == null ? entry.getId() : entry.getDisplayName())
                .symbol(entry.getSymbol())
                .hardCurrency(entry.isHardCurrency())
                .tradeable(entry.isTradeable())
                .minAmount(entry.getMinAmount())
                .maxAmount(entry.getMaxAmount())
                .decimalPlaces(entry.getDecimalPlaces())
                .build());
        }
        if (currencies.isEmpty()) {
            throw new CatalogException("Economy catalog defines no currencies");
        }

        List<ExchangeRate> rates = new ArrayList<>();
        for (CatalogDocument.ExchangeRateEntry entry : nullSafe(document.getExchangeRates())) {
            requireCurrency(currencyIds, entry.getFrom(), "exchange rate " + entry.getFrom() + "->" + entry.getTo());
            requireCurrency(currencyIds, entry.getTo(), "exchange rate " + entry.getFrom() + "->" + entry.getTo());
            try {
                rates.add(ExchangeRate.of(entry.getFrom(), entry.getTo(), entry.getRate(), entry.getMinRate(),
                    entry.getMaxRate(), entry.isActive(), now));
            } catch (IllegalArgumentException e) {
                throw new CatalogException(e.getMessage(), e);
            }
        }

        List<ShopItemDefinition> items = new ArrayList<>();
        Set<String> itemIds = new HashSet<>();
        for (CatalogDocument.ShopItemEntry entry : nullSafe(document.getShopItems())) {
            requireText(entry.getId(), "shop item id");
            if (!itemIds.add(entry.getId())) {
                throw new CatalogException("Duplicate shop item " + entry.getId());
            }
            items.add(toDefinition(entry, currencyIds));
        }

        return new EconomyCatalog(List.copyOf(currencies), List.copyOf(rates), List.copyOf(items));
    }

    private ShopItemDefinition toDefinition(CatalogDocument.ShopItemEntry entry, Set<String> currencyIds) {
        String owner = "shop item " + entry.getId();
        if (nullSafe(entry.getCosts()).isEmpty()) {
            throw new CatalogException(owner + " has no cost");
        }
        List<ShopItemCost> costs = new ArrayList<>();
        for (CatalogDocument.CostEntry cost : entry.getCosts()) {
            requireCurrency(currencyIds, cost.getCurrencyId(), owner);
            if (cost.getAmount() <= 0) {
                throw new CatalogException(owner + " has a non-positive cost in " + cost.getCurrencyId());
            }
            costs.add(new ShopItemCost(cost.getCurrencyId(), cost.getAmount()));
        }

        List<ShopReward> rewards = new ArrayList<>();
        for (CatalogDocument.RewardEntry reward : nullSafe(entry.getRewards())) {
            if (reward.getType() == null) {
                throw new CatalogException(owner + " has a reward without a type");
            }
            requireText(reward.getId(), owner + " reward id");
            if (reward.getType() == RewardType.CURRENCY) {
                requireCurrency(currencyIds, reward.getId(), owner);
            }
            if (reward.getAmount() <= 0) {
                throw new CatalogException(owner + " has a non-positive reward " + reward.getId());
            }
            rewards.add(new ShopReward(reward.getType(), reward.getId(), reward.getAmount()));
        }

        CatalogDocument.ConditionsEntry conditions = entry.getConditions();
        return ShopItemDefinition.builder()
            .id(entry.getId())
            .name(entry.getName() == null ? entry.getId() : entry.getName())
            .description(entry.getDescription())
            .category(entry.getCategory())
            .costs(List.copyOf(costs))
            .rewards(List.copyOf(rewards))
            .conditions(conditions == null ? PurchaseConditions.unrestricted()
                : new PurchaseConditions(conditions.getMinLevel(), conditions.getMaxLevel(), conditions.getMaxPerPlayer()))
            .available(entry.isAvailable())
            .maxPurchases(entry.getMaxPurchases())
            .availableUntil(entry.getAvailableUntil())
            .displayOrder(entry.getDisplayOrder())
            .popular(entry.isPopular())
            .recommended(entry.isRecommended())
            .build();
    }

    private static void requireCurrency(Set<String> currencyIds, String currencyId, String owner) {
        if (currencyId == null || !currencyIds.contains(currencyId)) {
            throw new CatalogException(owner + " references unknown currency " + currencyId);
        }
    }

    private static void requireText(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new CatalogException("Missing " + what);
        }
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? List.of() : list;
    }
}
