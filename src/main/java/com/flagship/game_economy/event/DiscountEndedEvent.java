package com.flagship.game_economy.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class DiscountEndedEvent implements EconomyEvent {
    UUID eventId;
    String itemId;
    String reason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "DiscountEnded";

    public static final String REASON_EXPIRED = "expired";
    public static final String REASON_CAP_REACHED = "cap_reached";
    public static final String REASON_REPLACED = "replaced";

    @Override
    public String getPlayerId() {
        return null;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static DiscountEndedEvent of(String itemId, String reason, Instant now) {
        return new DiscountEndedEvent(UUID.randomUUID(), itemId, reason, now);
    }
}
