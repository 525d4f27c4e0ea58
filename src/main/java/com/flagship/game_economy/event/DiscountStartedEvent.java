package com.flagship.game_economy.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class DiscountStartedEvent implements EconomyEvent {
    UUID eventId;
    String itemId;
    double discountPercentage;
    Instant endsAt;
    int maxPurchases;
    Instant occurredAt;

    public static final String EVENT_TYPE = "DiscountStarted";

    @Override
    public String getPlayerId() {
        return null;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static DiscountStartedEvent of(String itemId, double percent, Instant endsAt, int maxPurchases,
                                          Instant now) {
        return new DiscountStartedEvent(UUID.randomUUID(), itemId, percent, endsAt, maxPurchases, now);
    }
}
