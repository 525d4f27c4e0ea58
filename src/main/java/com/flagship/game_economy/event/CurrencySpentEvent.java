package com.flagship.game_economy.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class CurrencySpentEvent implements EconomyEvent {
    UUID eventId;
    String playerId;
    String currencyId;
    long amount;
    String reason;
    boolean hardCurrency;
    Instant occurredAt;

    public static final String EVENT_TYPE = "CurrencySpent";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static CurrencySpentEvent of(String playerId, String currencyId, long amount, String reason,
                                        boolean hardCurrency, Instant now) {
        return new CurrencySpentEvent(UUID.randomUUID(), playerId, currencyId, amount, reason, hardCurrency, now);
    }
}
