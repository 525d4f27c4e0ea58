package com.flagship.game_economy.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.game_economy.currency.Currency;
import com.flagship.game_economy.currency.CurrencyRegistry;
import com.flagship.game_economy.currency.ExchangeRate;
import com.flagship.game_economy.currency.ExchangeRateBook;
import com.flagship.game_economy.inflation.EconomyMultipliers;
import com.flagship.game_economy.inflation.InflationController;
import com.flagship.game_economy.inflation.MultiplierState;
import com.flagship.game_economy.inventory.InventoryService;
import com.flagship.game_economy.inventory.InventoryState;
import com.flagship.game_economy.ledger.CurrencyLedger;
import com.flagship.game_economy.ledger.Transaction;
import com.flagship.game_economy.ledger.WalletState;
import com.flagship.game_economy.pricing.DiscountWindow;
import com.flagship.game_economy.pricing.DynamicPricingEngine;
import com.flagship.game_economy.pricing.ShopItemCost;
import com.flagship.game_economy.pricing.ShopItemState;
import com.flagship.game_economy.profile.PlayerEconomicProfile;
import com.flagship.game_economy.profile.PlayerProfileStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Serializes the whole economy to JSON and restores it.
 *
 * A snapshot is validated completely before anything is replaced: unknown
 * currencies or items, balances outside their bounds, rates outside their band
 * and impossible counters all reject the snapshot with
 * {@link SnapshotCorruptedException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EconomySnapshotService {

    static final int CURRENT_VERSION = 1;

    private final ObjectMapper objectMapper;
    private final CurrencyRegistry registry;
    private final CurrencyLedger ledger;
    private final ExchangeRateBook rates;
    private final InflationController inflation;
    private final EconomyMultipliers multipliers;
    private final PlayerProfileStore profiles;
    private final DynamicPricingEngine pricing;
    private final InventoryService inventory;
    private final Clock clock;

    public EconomySnapshot capture() {
        return new EconomySnapshot(CURRENT_VERSION, clock.instant(),
            ledger.exportWallets(),
            profiles.exportProfiles(),
            rates.all(),
            inflation.allMultipliers(),
            pricing.exportItemStates(),
            pricing.exportPurchaseHistories(),
            inventory.exportInventories());
    }

    public String serialize() {
        EconomySnapshot snapshot = capture();
        try {
            String json = objectMapper.writeValueAsString(snapshot);
            log.info("Serialized economy snapshot: {} wallets, {} profiles", snapshot.getWallets().size(),
                snapshot.getProfiles().size());
            return json;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize economy snapshot", e);
        }
    }

    public void deserialize(String json) {
        if (json == null || json.isBlank()) {
            throw new SnapshotCorruptedException("Snapshot is empty");
        }
        EconomySnapshot snapshot;
        try {
            snapshot = objectMapper.readValue(json, EconomySnapshot.class);
        } catch (JsonProcessingException e) {
            log.error("Snapshot could not be parsed: {}", e.getOriginalMessage());
            throw new SnapshotCorruptedException("Snapshot could not be parsed: " + e.getOriginalMessage(), e);
        }
        restore(snapshot);
    }

    public void restore(EconomySnapshot snapshot) {
        try {
            validate(snapshot);
        } catch (SnapshotCorruptedException e) {
            log.error("Rejected corrupted snapshot: {}", e.getMessage());
            throw e;
        }

        ledger.restoreWallets(snapshot.getWallets());
        profiles.restoreProfiles(snapshot.getProfiles());
        rates.replaceAll(snapshot.getExchangeRates());
        inflation.restoreMultipliers(snapshot.getMultipliers());
        pricing.restore(snapshot.getShopItems(), snapshot.getPurchaseHistories());
        inventory.restoreInventories(snapshot.getInventories());
        log.info("Restored economy snapshot v{} taken at {}", snapshot.getVersion(), snapshot.getCreatedAt());
    }

    void validate(EconomySnapshot snapshot) {
        if (snapshot == null) {
            throw new SnapshotCorruptedException("Snapshot is empty");
        }
        if (snapshot.getVersion() != CURRENT_VERSION) {
            throw new SnapshotCorruptedException("Unsupported snapshot version " + snapshot.getVersion());
        }
        check(snapshot.getWallets() != null && snapshot.getProfiles() != null && snapshot.getExchangeRates() != null
                && snapshot.getMultipliers() != null && snapshot.getShopItems() != null
                && snapshot.getPurchaseHistories() != null && snapshot.getInventories() != null,
            "Snapshot is missing a section");

        snapshot.getWallets().forEach(this::validateWallet);
        snapshot.getProfiles().forEach(this::validateProfile);
        snapshot.getExchangeRates().forEach(this::validateRate);
        snapshot.getMultipliers().forEach(this::validateMultiplier);
        snapshot.getShopItems().forEach(this::validateShopItem);
        for (ShopItemState.PlayerPurchases history : snapshot.getPurchaseHistories()) {
            requireId(history.getPlayerId(), "purchase history");
            check(history.getCounts() != null, "Purchase history of %s has no counts", history.getPlayerId());
            history.getCounts().forEach((itemId, count) -> {
                check(pricing.containsItem(itemId), "Purchase history references unknown item %s", itemId);
                check(count != null && count >= 0, "Negative purchase count for %s", itemId);
            });
        }
        for (InventoryState state : snapshot.getInventories()) {
            requireId(state.getPlayerId(), "inventory");
            check(state.getItems() != null && state.getBoosters() != null, "Inventory of %s is incomplete",
                state.getPlayerId());
            state.getItems().values().forEach(q -> check(q != null && q > 0, "Invalid item quantity %s", q));
            state.getBoosters().values().forEach(q -> check(q != null && q > 0, "Invalid booster quantity %s", q));
        }
    }

    private void validateWallet(WalletState wallet) {
        requireId(wallet.getPlayerId(), "wallet");
        check(wallet.getBalances() != null && wallet.getHistories() != null
            && wallet.getTotalEarned() != null && wallet.getTotalSpent() != null,
            "Wallet of %s is incomplete", wallet.getPlayerId());

        wallet.getBalances().forEach((currencyId, balance) -> {
            Currency currency = currency(currencyId, "wallet " + wallet.getPlayerId());
            check(balance != null && currency.isWithinBounds(balance),
                "Balance %s %s of %s is outside [%d, %d]", balance, currencyId, wallet.getPlayerId(),
                currency.getMinAmount(), currency.getMaxAmount());
        });
        wallet.getHistories().forEach((currencyId, entries) -> {
            Currency currency = currency(currencyId, "history of " + wallet.getPlayerId());
            check(entries != null, "History of %s for %s is null", currencyId, wallet.getPlayerId());
            for (Transaction transaction : entries) {
                check(transaction != null && transaction.getType() != null, "Malformed transaction in %s", currencyId);
                check(currency.isWithinBounds(transaction.getBalanceAfter()),
                    "Transaction %s leaves %s outside its bounds", transaction.getId(), currencyId);
            }
        });
        wallet.getTotalEarned().forEach((currencyId, total) -> check(total != null && total >= 0,
            "Negative lifetime earn for %s", currencyId));
        wallet.getTotalSpent().forEach((currencyId, total) -> check(total != null && total >= 0,
            "Negative lifetime spend for %s", currencyId));
    }

    private void validateProfile(PlayerEconomicProfile profile) {
        requireId(profile.getPlayerId(), "profile");
        check(profile.getSegment() != null && profile.getSpendByCategory() != null,
            "Profile of %s is incomplete", profile.getPlayerId());
        check(inPercentRange(profile.getEngagementScore()) && inPercentRange(profile.getChurnRisk()),
            "Profile of %s has scores outside [0, 100]", profile.getPlayerId());
        check(profile.getTotalSpent() >= 0 && profile.getTotalEarned() >= 0 && profile.getPurchaseCount() >= 0
            && profile.getRewardsClaimed() >= 0, "Profile of %s has negative counters", profile.getPlayerId());
    }

    private void validateRate(ExchangeRate rate) {
        currency(rate.getFromCurrency(), "exchange rate");
        currency(rate.getToCurrency(), "exchange rate");
        check(rate.getMinRate() > 0 && rate.getMaxRate() >= rate.getMinRate(),
            "Rate %s has an invalid band", rate.key());
        check(rate.getRate() >= rate.getMinRate() && rate.getRate() <= rate.getMaxRate(),
            "Rate %s = %s is outside [%s, %s]", rate.key(), rate.getRate(), rate.getMinRate(), rate.getMaxRate());
    }

    private void validateMultiplier(String currencyId, MultiplierState state) {
        currency(currencyId, "multipliers");
        check(state != null, "Multipliers of %s are null", currencyId);
        check(withinMultiplierBand(state.getSink()) && withinMultiplierBand(state.getSource()),
            "Multipliers of %s are outside [%s, %s]", currencyId, multipliers.min(), multipliers.max());
    }

    private void validateShopItem(ShopItemState state) {
        check(pricing.containsItem(state.getItemId()), "Snapshot references unknown shop item %s", state.getItemId());
        check(state.getCurrentCosts() != null && !state.getCurrentCosts().isEmpty(),
            "Shop item %s has no costs", state.getItemId());
        check(state.getCurrentPurchases() >= 0, "Shop item %s has a negative purchase counter", state.getItemId());
        validateCosts(state.getItemId(), state.getCurrentCosts());

        DiscountWindow discount = state.getDiscount();
        if (discount != null) {
            check(discount.getPercentage() > 0 && discount.getPercentage() < 100,
                "Discount on %s has percentage %s", state.getItemId(), discount.getPercentage());
            check(discount.getStartsAt() != null && discount.getEndsAt() != null,
                "Discount on %s has no window", state.getItemId());
            check(discount.getOriginalCosts() != null
                    && discount.getOriginalCosts().size() == state.getCurrentCosts().size(),
                "Discount on %s does not match its costs", state.getItemId());
            validateCosts(state.getItemId(), discount.getOriginalCosts());
        }
    }

    private void validateCosts(String itemId, List<ShopItemCost> costs) {
        for (ShopItemCost cost : costs) {
            check(cost != null && cost.getAmount() >= 1, "Shop item %s has a cost below one unit", itemId);
            currency(cost.getCurrencyId(), "shop item " + itemId);
        }
    }

    private Currency currency(String currencyId, String owner) {
        Optional<Currency> currency = registry.find(currencyId);
        check(currency.isPresent(), "%s references unknown currency %s", owner, currencyId);
        return currency.get();
    }

    private boolean withinMultiplierBand(double value) {
        return value >= multipliers.min() && value <= multipliers.max();
    }

    private static boolean inPercentRange(double value) {
        return value >= 0 && value <= 100;
    }

    private static void requireId(String id, String what) {
        check(id != null && !id.isBlank(), "A %s has no player id", what);
    }

    private static void check(boolean condition, String message, Object... args) {
        if (!condition) {
            throw new SnapshotCorruptedException(String.format(message, args));
        }
    }
}
