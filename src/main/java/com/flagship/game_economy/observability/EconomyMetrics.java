package com.flagship.game_economy.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Centralized metrics for economy operations.
 *
 * Metrics exposed:
 * - economy.ledger.operations: earn/spend/exchange outcomes, tagged by operation, currency and result
 * - economy.ledger.refunds: compensating refunds, tagged by reason
 * - economy.shop.purchases: purchase outcomes, tagged by item and result
 * - economy.shop.discounts: discount windows started/ended
 * - economy.inflation.adjustments: controller decisions, tagged by currency and direction
 * - economy.events.*: dispatcher delivery counters and backlog gauges
 */
@Component
public class EconomyMetrics {

    private final MeterRegistry registry;
    private final Counter eventsDelivered;
    private final Counter eventsDeadLettered;

    public EconomyMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.eventsDelivered = Counter.builder("economy.events.delivered")
                .description("Number of event deliveries to subscribers")
                .register(registry);

        this.eventsDeadLettered = Counter.builder("economy.events.dead_lettered")
                .description("Number of events that exceeded the retry budget")
                .register(registry);
    }

    // ==================== Ledger ====================

    public void recordLedgerOperation(String operation, String currencyId, String result) {
        registry.counter("economy.ledger.operations",
                "operation", sanitizeTag(operation),
                "currency", sanitizeTag(currencyId),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordRefund(String reason) {
        registry.counter("economy.ledger.refunds", "reason", sanitizeTag(reason)).increment();
    }

    // ==================== Shop ====================

    public void recordPurchase(String itemId, String result) {
        registry.counter("economy.shop.purchases",
                "item", sanitizeTag(itemId),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordDiscount(String itemId, String transition) {
        registry.counter("economy.shop.discounts",
                "item", sanitizeTag(itemId),
                "transition", sanitizeTag(transition)
        ).increment();
    }

    // ==================== Inflation ====================

    public void recordInflationAdjustment(String currencyId, String direction) {
        registry.counter("economy.inflation.adjustments",
                "currency", sanitizeTag(currencyId),
                "direction", sanitizeTag(direction)
        ).increment();
    }

    // ==================== Events ====================

    public void recordEventDelivered() {
        eventsDelivered.increment();
    }

    public void recordEventDeliveryFailure(String eventType) {
        registry.counter("economy.events.delivery.failure", "event_type", sanitizeTag(eventType)).increment();
    }

    public void recordEventDeadLettered() {
        eventsDeadLettered.increment();
    }

    public void registerEventBacklogGauge(Supplier<Number> pending, Supplier<Number> deadLettered) {
        Gauge.builder("economy.events.backlog.size", pending, s -> s.get().doubleValue())
                .description("Number of events waiting for delivery")
                .register(registry);
        Gauge.builder("economy.events.dead_letter.size", deadLettered, s -> s.get().doubleValue())
                .description("Number of events parked after exhausting retries")
                .register(registry);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
