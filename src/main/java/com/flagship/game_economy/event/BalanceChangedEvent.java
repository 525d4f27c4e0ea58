package com.flagship.game_economy.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Emitted for every balance mutation, including exchange legs and refunds.
 */
@Value
public class BalanceChangedEvent implements EconomyEvent {
    UUID eventId;
    String playerId;
    String currencyId;
    long oldBalance;
    long newBalance;
    Instant occurredAt;

    public static final String EVENT_TYPE = "BalanceChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static BalanceChangedEvent of(String playerId, String currencyId, long oldBalance, long newBalance,
                                         Instant now) {
        return new BalanceChangedEvent(UUID.randomUUID(), playerId, currencyId, oldBalance, newBalance, now);
    }
}
