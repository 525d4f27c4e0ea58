package com.flagship.game_economy.pricing;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runtime state of a shop item. Only costs, the purchase counter, availability
 * and the discount window ever change; every change happens under {@link #lock}.
 */
class ShopItem {

    private final ShopItemDefinition definition;
    private final ReentrantLock lock = new ReentrantLock();
    private List<ShopItemCost> currentCosts;
    private long currentPurchases;
    private boolean available;
    private DiscountWindow discount;

    ShopItem(ShopItemDefinition definition) {
        this.definition = definition;
        this.currentCosts = List.copyOf(definition.getCosts());
        this.available = definition.isAvailable();
    }

    ShopItemDefinition definition() {
        return definition;
    }

    String id() {
        return definition.getId();
    }

    ReentrantLock lock() {
        return lock;
    }

    List<ShopItemCost> currentCosts() {
        return currentCosts;
    }

    long currentPurchases() {
        return currentPurchases;
    }

    boolean available() {
        return available;
    }

    DiscountWindow discount() {
        return discount;
    }

    boolean totalCapReached() {
        return definition.getMaxPurchases() >= 0 && currentPurchases >= definition.getMaxPurchases();
    }

    boolean expiredAt(Instant now) {
        return definition.getAvailableUntil() != null && !now.isBefore(definition.getAvailableUntil());
    }

    void recordPurchase() {
        currentPurchases++;
        if (discount != null) {
            discount = discount.withPurchase();
        }
    }

    void openDiscount(DiscountWindow window) {
        List<ShopItemCost> discounted = new ArrayList<>();
        for (ShopItemCost cost : window.getOriginalCosts()) {
            discounted.add(cost.withAmount(DiscountWindow.discounted(cost.getAmount(), window.getPercentage())));
        }
        this.currentCosts = List.copyOf(discounted);
        this.discount = window;
    }

    /**
     * Restores the costs captured when the window opened.
     *
     * @return the closed window, or null if none was active
     */
    DiscountWindow closeDiscount() {
        DiscountWindow closed = discount;
        if (closed != null) {
            currentCosts = closed.getOriginalCosts();
            discount = null;
        }
        return closed;
    }

    void restore(List<ShopItemCost> costs, long purchases, boolean isAvailable, DiscountWindow window) {
        this.currentCosts = List.copyOf(costs);
        this.currentPurchases = purchases;
        this.available = isAvailable;
        this.discount = window;
    }
}
