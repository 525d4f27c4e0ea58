package com.flagship.game_economy.event;

import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Emitted only after every cost was deducted and every reward granted.
 *
 * {@code costs} maps currency id to the amount actually charged;
 * {@code hardCurrencySpent} is the part of it paid in hard currencies.
 */
@Value
public class ItemPurchasedEvent implements EconomyEvent {
    UUID eventId;
    String playerId;
    String itemId;
    String category;
    Map<String, Long> costs;
    long hardCurrencySpent;
    boolean discounted;
    Instant occurredAt;

    public static final String EVENT_TYPE = "ItemPurchased";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static ItemPurchasedEvent of(String playerId, String itemId, String category, Map<String, Long> costs,
                                        long hardCurrencySpent, boolean discounted, Instant now) {
        return new ItemPurchasedEvent(UUID.randomUUID(), playerId, itemId, category, Map.copyOf(costs),
            hardCurrencySpent, discounted, now);
    }
}
