package com.flagship.game_economy.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Emitted when an earn credits a balance.
 * {@code amount} is what was actually credited after the ceiling clamp.
 */
@Value
public class CurrencyEarnedEvent implements EconomyEvent {
    UUID eventId;
    String playerId;
    String currencyId;
    long amount;
    String source;
    boolean hardCurrency;
    Instant occurredAt;

    public static final String EVENT_TYPE = "CurrencyEarned";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static CurrencyEarnedEvent of(String playerId, String currencyId, long amount, String source,
                                         boolean hardCurrency, Instant now) {
        return new CurrencyEarnedEvent(UUID.randomUUID(), playerId, currencyId, amount, source, hardCurrency, now);
    }
}
