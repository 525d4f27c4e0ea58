package com.flagship.game_economy.pricing;

import com.flagship.game_economy.common.EconomyError;
import com.flagship.game_economy.common.EconomyResult;
import com.flagship.game_economy.currency.Currency;
import com.flagship.game_economy.currency.CurrencyRegistry;
import com.flagship.game_economy.event.DiscountEndedEvent;
import com.flagship.game_economy.event.DiscountStartedEvent;
import com.flagship.game_economy.event.EconomyEvent;
import com.flagship.game_economy.event.ItemPurchasedEvent;
import com.flagship.game_economy.eventbus.EconomyEventBus;
import com.flagship.game_economy.inflation.EconomyAdjustmentListener;
import com.flagship.game_economy.inventory.InventoryKind;
import com.flagship.game_economy.inventory.InventoryService;
import com.flagship.game_economy.ledger.CurrencyLedger;
import com.flagship.game_economy.observability.EconomyMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Holds the shop, decides eligibility and executes purchases and timed discounts.
 *
 * Purchases are all-or-nothing: costs are paid through the {@link CurrencyLedger}
 * one by one, and if any cost fails every cost already paid for the call is
 * refunded before the rejection is returned. The purchase runs as one ledger
 * operation, so a refunded purchase publishes no spend events and leaves no
 * inflation flow. Counters only move after every cost is paid and every reward
 * granted.
 *
 * A discount window whose end time has passed is closed by the first purchase,
 * listing or export that touches the item, so its price never outlives it.
 *
 * Lock order is player wallet, then shop item. The discount-expiry sweep only
 * takes item locks.
 *
 * Prices charged include the sink multiplier pushed by the inflation controller:
 * {@code max(1, round(listed * multiplier))}.
 */
@Service
@Slf4j
public class DynamicPricingEngine implements EconomyAdjustmentListener {

    static final int MAX_DISCOUNT_HOURS = 24 * 365;

    private final Map<String, ShopItem> items;
    private final ConcurrentHashMap<String, Double> sinkMultipliers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Map<String, Long>> purchasesByPlayer = new ConcurrentHashMap<>();
    private final Set<String> hardCurrencies = new HashSet<>();
    private final CurrencyLedger ledger;
    private final InventoryService inventory;
    private final PlayerLevelProvider levels;
    private final EconomyEventBus eventBus;
    private final EconomyMetrics metrics;
    private final Clock clock;

    public DynamicPricingEngine(ShopCatalog catalog,
                                CurrencyRegistry registry,
                                CurrencyLedger ledger,
                                InventoryService inventory,
                                PlayerLevelProvider levels,
                                EconomyEventBus eventBus,
                                EconomyMetrics metrics,
                                Clock clock) {
        Map<String, ShopItem> byId = new LinkedHashMap<>();
        for (ShopItemDefinition definition : catalog.getItems()) {
            validate(definition, registry);
            if (byId.putIfAbsent(definition.getId(), new ShopItem(definition)) != null) {
                throw new IllegalArgumentException("Duplicate shop item id: " + definition.getId());
            }
        }
        this.items = byId;
        registry.all().stream().filter(Currency::isHardCurrency).forEach(c -> hardCurrencies.add(c.getId()));
        this.ledger = ledger;
        this.inventory = inventory;
        this.levels = levels;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.clock = clock;
        log.info("Shop initialized with {} items", items.size());
    }

    // ==================== Eligibility ====================

    public boolean canPurchase(String itemId, String playerId) {
        return checkEligibility(itemId, playerId).isSuccess();
    }

    /**
     * Availability, level range, total cap, per-player cap and time box.
     * Affordability is checked by {@link #purchase}.
     */
    public EconomyResult<Void> checkEligibility(String itemId, String playerId) {
        requirePlayer(playerId);
        ShopItem item = items.get(itemId);
        if (item == null) {
            return EconomyResult.rejected(EconomyError.ITEM_UNKNOWN, "Shop item %s does not exist", itemId);
        }
        return inItemLock(item, () -> eligibility(item, playerId, clock.instant()));
    }

    // ==================== Purchase ====================

    public EconomyResult<PurchaseReceipt> purchase(String itemId, String playerId) {
        requirePlayer(playerId);
        ShopItem item = items.get(itemId);
        if (item == null) {
            metrics.recordPurchase(itemId, "item_unknown");
            return EconomyResult.rejected(EconomyError.ITEM_UNKNOWN, "Shop item %s does not exist", itemId);
        }

        EconomyResult<PurchaseReceipt> result = ledger.atomically(playerId,
            () -> inItemLock(item, () -> purchaseLocked(item, playerId)));

        if (result.isSuccess()) {
            metrics.recordPurchase(itemId, "success");
            log.info("Player {} purchased {}", playerId, itemId);
        } else {
            metrics.recordPurchase(itemId, result.getError().name().toLowerCase());
            log.debug("Purchase of {} by {} rejected: {} - {}", itemId, playerId, result.getError(),
                result.getMessage());
        }
        return result;
    }

    private EconomyResult<PurchaseReceipt> purchaseLocked(ShopItem item, String playerId) {
        Instant now = clock.instant();
        closeIfExpired(item, now);
        EconomyResult<Void> eligible = eligibility(item, playerId, now);
        if (eligible.isRejected()) {
            return eligible.asRejection();
        }

        List<ShopItemCost> charged = chargedCosts(item.currentCosts());
        Map<String, Long> required = new LinkedHashMap<>();
        for (ShopItemCost cost : charged) {
            required.merge(cost.getCurrencyId(), cost.getAmount(), Long::sum);
        }
        for (Map.Entry<String, Long> need : required.entrySet()) {
            if (!ledger.canAfford(playerId, need.getKey(), need.getValue())) {
                return EconomyResult.rejected(EconomyError.INSUFFICIENT_FUNDS, "Need %d %s for %s, have %d",
                    need.getValue(), need.getKey(), item.id(), ledger.getBalance(playerId, need.getKey()));
            }
        }

        String reason = "purchase_" + item.id();
        List<ShopItemCost> paid = new ArrayList<>();
        for (ShopItemCost cost : charged) {
            EconomyResult<Long> spent = ledger.spend(playerId, cost.getCurrencyId(), cost.getAmount(), reason);
            if (spent.isRejected()) {
                for (ShopItemCost refund : paid) {
                    ledger.compensate(playerId, refund.getCurrencyId(), refund.getAmount(), reason);
                }
                return EconomyResult.rejected(EconomyError.PURCHASE_COST_FAILURE,
                    "Paying %d %s for %s failed (%s); %d earlier costs refunded",
                    cost.getAmount(), cost.getCurrencyId(), item.id(), spent.getError(), paid.size());
            }
            paid.add(cost);
        }

        for (ShopReward reward : item.definition().getRewards()) {
            grant(playerId, reward, reason);
        }

        boolean discounted = item.discount() != null;
        item.recordPurchase();
        purchasesByPlayer.computeIfAbsent(playerId, id -> new ConcurrentHashMap<>())
            .merge(item.id(), 1L, Long::sum);

        Map<String, Long> costs = new LinkedHashMap<>();
        long hardSpent = 0;
        for (ShopItemCost cost : paid) {
            costs.merge(cost.getCurrencyId(), cost.getAmount(), Long::sum);
            if (hardCurrencies.contains(cost.getCurrencyId())) {
                hardSpent += cost.getAmount();
            }
        }
        ledger.publish(ItemPurchasedEvent.of(playerId, item.id(), item.definition().getCategory(), costs,
            hardSpent, discounted, now));

        if (discounted && item.discount().capReached()) {
            endDiscount(item, DiscountEndedEvent.REASON_CAP_REACHED, now, ledger::publish);
        }

        return EconomyResult.ok(new PurchaseReceipt(playerId, item.id(), List.copyOf(paid),
            item.definition().getRewards(), discounted, now));
    }

    private void grant(String playerId, ShopReward reward, String reason) {
        switch (reward.getType()) {
            case CURRENCY -> {
                EconomyResult<Long> earned = ledger.earn(playerId, reward.getId(), reward.getAmount(), reason);
                if (earned.isRejectedWith(EconomyError.BALANCE_AT_MAXIMUM)) {
                    log.debug("Reward {} {} discarded, player {} already at maximum",
                        reward.getAmount(), reward.getId(), playerId);
                } else if (earned.isRejected()) {
                    throw new IllegalStateException("Reward " + reward.getId() + " could not be granted: "
                        + earned.getMessage());
                }
            }
            case ITEM -> inventory.grant(playerId, InventoryKind.ITEM, reward.getId(), reward.getAmount());
            case BOOSTER -> inventory.grant(playerId, InventoryKind.BOOSTER, reward.getId(), reward.getAmount());
        }
    }

    // ==================== Discounts ====================

    /**
     * Opens a discount window on an item. An active window is closed first and
     * its original costs restored, so the new discount is taken from the true
     * original rather than from an already discounted price.
     *
     * @param maxPurchases purchases allowed at the discounted price, 0 or negative for no cap
     */
    public EconomyResult<DiscountWindow> applyTimedDiscount(String itemId, double percent, int durationHours,
                                                           int maxPurchases) {
        ShopItem item = items.get(itemId);
        if (item == null) {
            return EconomyResult.rejected(EconomyError.ITEM_UNKNOWN, "Shop item %s does not exist", itemId);
        }
        if (!(percent > 0 && percent < 100) || durationHours <= 0 || durationHours > MAX_DISCOUNT_HOURS) {
            return EconomyResult.rejected(EconomyError.INVALID_AMOUNT,
                "Discount of %s%% for %d hours is out of range", percent, durationHours);
        }

        return inItemLock(item, () -> {
            Instant now = clock.instant();
            if (item.discount() != null) {
                endDiscount(item, DiscountEndedEvent.REASON_REPLACED, now);
            }
            DiscountWindow window = new DiscountWindow(percent, now, now.plus(Duration.ofHours(durationHours)),
                maxPurchases, 0, item.currentCosts());
            item.openDiscount(window);
            eventBus.publish(DiscountStartedEvent.of(item.id(), percent, window.getEndsAt(), maxPurchases, now));
            metrics.recordDiscount(item.id(), "started");
            log.info("Discount of {}% on {} until {}", percent, item.id(), window.getEndsAt());
            return EconomyResult.ok(window);
        });
    }

    /**
     * Closes every window whose end time has passed.
     *
     * @return number of windows closed
     */
    public int expireDiscounts() {
        Instant now = clock.instant();
        int expired = 0;
        for (ShopItem item : items.values()) {
            boolean closed = inItemLock(item, () -> closeIfExpired(item, now));
            if (closed) {
                expired++;
            }
        }
        return expired;
    }

    /**
     * Restores the original costs when the item's window has ended. Caller holds the item lock.
     */
    private boolean closeIfExpired(ShopItem item, Instant now) {
        DiscountWindow window = item.discount();
        if (window != null && window.expiredAt(now)) {
            endDiscount(item, DiscountEndedEvent.REASON_EXPIRED, now);
            return true;
        }
        return false;
    }

    private void endDiscount(ShopItem item, String reason, Instant now) {
        endDiscount(item, reason, now, eventBus::publish);
    }

    private void endDiscount(ShopItem item, String reason, Instant now, Consumer<EconomyEvent> publisher) {
        DiscountWindow closed = item.closeDiscount();
        if (closed == null) {
            return;
        }
        publisher.accept(DiscountEndedEvent.of(item.id(), reason, now));
        metrics.recordDiscount(item.id(), reason);
        log.info("Discount on {} ended ({}), original costs restored", item.id(), reason);
    }

    // ==================== Views ====================

    /**
     * Items the player can buy right now, recommended first, then popular, then
     * by display order.
     */
    public List<ShopItemView> availableItems(String playerId) {
        requirePlayer(playerId);
        List<ShopItemView> result = new ArrayList<>();
        for (ShopItem item : items.values()) {
            if (canPurchase(item.id(), playerId)) {
                result.add(view(item));
            }
        }
        result.sort(Comparator.comparing(ShopItemView::isRecommended).reversed()
            .thenComparing(Comparator.comparing(ShopItemView::isPopular).reversed())
            .thenComparingInt(ShopItemView::getDisplayOrder));
        return result;
    }

    public List<ShopItemView> itemsByCategory(String category) {
        List<ShopItemView> result = new ArrayList<>();
        for (ShopItem item : items.values()) {
            if (item.definition().getCategory() != null && item.definition().getCategory().equalsIgnoreCase(category)) {
                result.add(view(item));
            }
        }
        result.sort(Comparator.comparingInt(ShopItemView::getDisplayOrder));
        return result;
    }

    public List<ShopItemView> allItems() {
        List<ShopItemView> result = new ArrayList<>();
        items.values().forEach(item -> result.add(view(item)));
        return result;
    }

    public Optional<ShopItemView> item(String itemId) {
        ShopItem item = itemId == null ? null : items.get(itemId);
        return item == null ? Optional.empty() : Optional.of(view(item));
    }

    public Optional<ShopItemDefinition> definition(String itemId) {
        ShopItem item = itemId == null ? null : items.get(itemId);
        return item == null ? Optional.empty() : Optional.of(item.definition());
    }

    public long purchaseCount(String playerId, String itemId) {
        Map<String, Long> counts = purchasesByPlayer.get(playerId);
        return counts == null ? 0L : counts.getOrDefault(itemId, 0L);
    }

    public double sinkMultiplier(String currencyId) {
        return sinkMultipliers.getOrDefault(currencyId, 1.0);
    }

    @Override
    public void onSinkMultiplier(String currencyId, double multiplier) {
        sinkMultipliers.put(currencyId, multiplier);
    }

    // ==================== Snapshots ====================

    public List<ShopItemState> exportItemStates() {
        Instant now = clock.instant();
        List<ShopItemState> states = new ArrayList<>();
        for (ShopItem item : items.values()) {
            states.add(inItemLock(item, () -> {
                closeIfExpired(item, now);
                return new ShopItemState(item.id(), item.currentCosts(), item.currentPurchases(), item.available(),
                    item.discount());
            }));
        }
        return states;
    }

    public List<ShopItemState.PlayerPurchases> exportPurchaseHistories() {
        List<ShopItemState.PlayerPurchases> result = new ArrayList<>();
        purchasesByPlayer.forEach((playerId, counts) ->
            result.add(new ShopItemState.PlayerPurchases(playerId, Map.copyOf(counts))));
        return result;
    }

    /**
     * Restores shop state. Items absent from the snapshot keep their catalog state;
     * states for items no longer in the catalog are ignored.
     */
    public void restore(Collection<ShopItemState> states, Collection<ShopItemState.PlayerPurchases> histories) {
        for (ShopItemState state : states) {
            ShopItem item = items.get(state.getItemId());
            if (item == null) {
                log.warn("Snapshot references unknown shop item {}, skipping", state.getItemId());
                continue;
            }
            inItemLock(item, () -> {
                item.restore(state.getCurrentCosts(), state.getCurrentPurchases(), state.isAvailable(),
                    state.getDiscount());
                return null;
            });
        }
        purchasesByPlayer.clear();
        for (ShopItemState.PlayerPurchases history : histories) {
            purchasesByPlayer.put(history.getPlayerId(), new ConcurrentHashMap<>(history.getCounts()));
        }
    }

    public boolean containsItem(String itemId) {
        return itemId != null && items.containsKey(itemId);
    }

    // ==================== Internals ====================

    private EconomyResult<Void> eligibility(ShopItem item, String playerId, Instant now) {
        ShopItemDefinition definition = item.definition();
        if (!item.available()) {
            return unavailable(item, "is not available");
        }
        if (item.expiredAt(now)) {
            return unavailable(item, "offer has ended");
        }
        if (item.totalCapReached()) {
            return unavailable(item, "is sold out");
        }
        int level = levels.levelOf(playerId);
        if (!definition.getConditions().levelAllowed(level)) {
            return unavailable(item, "requires level " + definition.getConditions().getMinLevel() + "-"
                + definition.getConditions().getMaxLevel() + ", player is " + level);
        }
        if (definition.getConditions().perPlayerCapReached(purchaseCount(playerId, item.id()))) {
            return unavailable(item, "per-player limit reached");
        }
        return EconomyResult.ok(null);
    }

    private static EconomyResult<Void> unavailable(ShopItem item, String why) {
        return EconomyResult.rejected(EconomyError.ITEM_UNAVAILABLE, "Shop item %s %s", item.id(), why);
    }

    private List<ShopItemCost> chargedCosts(List<ShopItemCost> listed) {
        List<ShopItemCost> charged = new ArrayList<>(listed.size());
        for (ShopItemCost cost : listed) {
            charged.add(cost.withAmount(charged(cost)));
        }
        return charged;
    }

    private long charged(ShopItemCost cost) {
        return Math.max(1L, Math.round(cost.getAmount() * sinkMultiplier(cost.getCurrencyId())));
    }

    private ShopItemView view(ShopItem item) {
        Instant now = clock.instant();
        return inItemLock(item, () -> {
            closeIfExpired(item, now);
            ShopItemDefinition definition = item.definition();
            DiscountWindow discount = item.discount();
            List<ShopItemCost> originals = discount == null ? item.currentCosts() : discount.getOriginalCosts();
            List<PriceQuote> prices = new ArrayList<>();
            for (int i = 0; i < item.currentCosts().size(); i++) {
                ShopItemCost listed = item.currentCosts().get(i);
                prices.add(new PriceQuote(listed.getCurrencyId(), originals.get(i).getAmount(),
                    listed.getAmount(), charged(listed)));
            }
            return ShopItemView.builder()
                .id(definition.getId())
                .name(definition.getName())
                .description(definition.getDescription())
                .category(definition.getCategory())
                .prices(prices)
                .rewards(definition.getRewards())
                .available(item.available())
                .currentPurchases(item.currentPurchases())
                .maxPurchases(definition.getMaxPurchases())
                .availableUntil(definition.getAvailableUntil())
                .discountPercentage(discount == null ? null : discount.getPercentage())
                .discountEndsAt(discount == null ? null : discount.getEndsAt())
                .displayOrder(definition.getDisplayOrder())
                .popular(definition.isPopular())
                .recommended(definition.isRecommended())
                .build();
        });
    }

    private static <T> T inItemLock(ShopItem item, Supplier<T> action) {
        item.lock().lock();
        try {
            return action.get();
        } finally {
            item.lock().unlock();
        }
    }

    private static void validate(ShopItemDefinition definition, CurrencyRegistry registry) {
        if (definition.getId() == null || definition.getId().isBlank()) {
            throw new IllegalArgumentException("Shop item id is required");
        }
        if (definition.getCosts() == null || definition.getCosts().isEmpty()) {
            throw new IllegalArgumentException("Shop item " + definition.getId() + " has no cost");
        }
        for (ShopItemCost cost : definition.getCosts()) {
            if (!registry.contains(cost.getCurrencyId()) || cost.getAmount() <= 0) {
                throw new IllegalArgumentException("Shop item " + definition.getId() + " has invalid cost "
                    + cost.getAmount() + " " + cost.getCurrencyId());
            }
        }
        if (definition.getRewards() == null || definition.getConditions() == null) {
            throw new IllegalArgumentException("Shop item " + definition.getId() + " needs rewards and conditions");
        }
        for (ShopReward reward : definition.getRewards()) {
            if (reward.getAmount() <= 0
                || (reward.getType() == RewardType.CURRENCY && !registry.contains(reward.getId()))) {
                throw new IllegalArgumentException("Shop item " + definition.getId() + " has invalid reward "
                    + reward.getAmount() + " " + reward.getId());
            }
        }
    }

    private static void requirePlayer(String playerId) {
        if (playerId == null || playerId.isBlank()) {
            throw new IllegalArgumentException("playerId is required");
        }
    }
}
