package com.flagship.game_economy.consumer;

import com.flagship.game_economy.event.CurrencyEarnedEvent;
import com.flagship.game_economy.event.CurrencyExchangedEvent;
import com.flagship.game_economy.event.CurrencySpentEvent;
import com.flagship.game_economy.event.EconomyEvent;
import com.flagship.game_economy.event.ItemPurchasedEvent;
import com.flagship.game_economy.eventbus.EconomyEventSubscriber;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Economy-wide flow statistics per currency and sales statistics per shop item.
 */
@Component
@Order(2)
@Slf4j
public class EconomyAnalyticsConsumer implements EconomyEventSubscriber {

    static final String CONSUMER_GROUP = "economy-analytics";

    private final Map<String, CurrencyFlow> flows = new TreeMap<>();
    private final Map<String, ItemSales> sales = new TreeMap<>();

    @Override
    public String consumerGroup() {
        return CONSUMER_GROUP;
    }

    @Override
    public synchronized void onEvent(EconomyEvent event) {
        switch (event.getEventType()) {
            case CurrencyEarnedEvent.EVENT_TYPE -> {
                CurrencyEarnedEvent earned = (CurrencyEarnedEvent) event;
                flow(earned.getCurrencyId(), earned.getOccurredAt()).earn(earned.getAmount(), earned.getOccurredAt());
            }
            case CurrencySpentEvent.EVENT_TYPE -> {
                CurrencySpentEvent spent = (CurrencySpentEvent) event;
                flow(spent.getCurrencyId(), spent.getOccurredAt()).spend(spent.getAmount(), spent.getOccurredAt());
            }
            case CurrencyExchangedEvent.EVENT_TYPE -> {
                CurrencyExchangedEvent exchanged = (CurrencyExchangedEvent) event;
                flow(exchanged.getFromCurrency(), exchanged.getOccurredAt()).exchangedOut += exchanged.getAmount();
                flow(exchanged.getToCurrency(), exchanged.getOccurredAt()).exchangedIn += exchanged.getConvertedAmount();
            }
            case ItemPurchasedEvent.EVENT_TYPE -> {
                ItemPurchasedEvent purchased = (ItemPurchasedEvent) event;
                ItemSales itemSales = sales.computeIfAbsent(purchased.getItemId(), id -> new ItemSales());
                itemSales.purchases++;
                if (purchased.isDiscounted()) {
                    itemSales.discountedPurchases++;
                }
                purchased.getCosts().forEach((currencyId, amount) -> itemSales.revenue.merge(currencyId, amount, Long::sum));
            }
            default -> {
                // not tracked
            }
        }
    }

    public synchronized List<CurrencyStats> currencyStats() {
        List<CurrencyStats> result = new ArrayList<>();
        flows.forEach((currencyId, flow) -> result.add(flow.stats(currencyId)));
        return result;
    }

    public synchronized List<ItemStats> itemStats() {
        List<ItemStats> result = new ArrayList<>();
        sales.forEach((itemId, itemSales) -> result.add(new ItemStats(itemId, itemSales.purchases,
            itemSales.discountedPurchases, Map.copyOf(itemSales.revenue))));
        result.sort(Comparator.comparingLong(ItemStats::getPurchases).reversed());
        return result;
    }

    /**
     * Plain-text summary for operators.
     */
    public String generateReport() {
        StringBuilder report = new StringBuilder("=== Economy Report ===\n");
        for (CurrencyStats stats : currencyStats()) {
            report.append(String.format("%s: earned=%d spent=%d net=%d exchangedIn=%d exchangedOut=%d "
                    + "transactions=%d velocity=%.2f/h%n",
                stats.getCurrencyId(), stats.getEarned(), stats.getSpent(), stats.getEarned() - stats.getSpent(),
                stats.getExchangedIn(), stats.getExchangedOut(), stats.getTransactions(), stats.getVelocityPerHour()));
        }
        List<ItemStats> items = itemStats();
        if (!items.isEmpty()) {
            report.append("--- Top items ---\n");
            for (ItemStats item : items.subList(0, Math.min(5, items.size()))) {
                report.append(String.format("%s: purchases=%d (discounted %d) revenue=%s%n",
                    item.getItemId(), item.getPurchases(), item.getDiscountedPurchases(), new TreeMap<>(item.getRevenue())));
            }
        }
        return report.toString();
    }

    private CurrencyFlow flow(String currencyId, Instant at) {
        return flows.computeIfAbsent(currencyId, id -> new CurrencyFlow(at));
    }

    @Value
    public static class CurrencyStats {
        String currencyId;
        long earned;
        long spent;
        long exchangedIn;
        long exchangedOut;
        long transactions;
        /** Earn and spend transactions per hour since the currency was first seen. */
        double velocityPerHour;
    }

    @Value
    public static class ItemStats {
        String itemId;
        long purchases;
        long discountedPurchases;
        Map<String, Long> revenue;
    }

    private static final class CurrencyFlow {
        private final Instant firstSeen;
        private Instant lastSeen;
        private long earned;
        private long spent;
        private long exchangedIn;
        private long exchangedOut;
        private long transactions;

        private CurrencyFlow(Instant firstSeen) {
            this.firstSeen = firstSeen;
            this.lastSeen = firstSeen;
        }

        void earn(long amount, Instant at) {
            earned += amount;
            touch(at);
        }

        void spend(long amount, Instant at) {
            spent += amount;
            touch(at);
        }

        private void touch(Instant at) {
            transactions++;
            if (at.isAfter(lastSeen)) {
                lastSeen = at;
            }
        }

        CurrencyStats stats(String currencyId) {
            double hours = Math.max(1.0, Duration.between(firstSeen, lastSeen).toMinutes() / 60.0);
            return new CurrencyStats(currencyId, earned, spent, exchangedIn, exchangedOut, transactions,
                transactions / hours);
        }
    }

    private static final class ItemSales {
        private long purchases;
        private long discountedPurchases;
        private final Map<String, Long> revenue = new HashMap<>();
    }
}
