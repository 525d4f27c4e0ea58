package com.flagship.game_economy.pricing;

import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * An active timed discount. {@code originalCosts} are the costs captured when
 * the window opened; reverting restores them as-is.
 */
@Value
public class DiscountWindow {
    double percentage;
    Instant startsAt;
    Instant endsAt;
    /** Purchases allowed at the discounted price, 0 or negative for no cap. */
    int maxPurchases;
    int purchasesDuring;
    List<ShopItemCost> originalCosts;

    DiscountWindow withPurchase() {
        return new DiscountWindow(percentage, startsAt, endsAt, maxPurchases, purchasesDuring + 1, originalCosts);
    }

    boolean capReached() {
        return maxPurchases > 0 && purchasesDuring >= maxPurchases;
    }

    boolean expiredAt(Instant now) {
        return !now.isBefore(endsAt);
    }

    /**
     * {@code round(original * (1 - pct/100))}, never below one unit.
     */
    static long discounted(long original, double percentage) {
        return Math.max(1L, Math.round(original * (1.0 - percentage / 100.0)));
    }
}
