package com.flagship.game_economy.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class CurrencyExchangedEvent implements EconomyEvent {
    UUID eventId;
    String playerId;
    String fromCurrency;
    String toCurrency;
    long amount;
    long convertedAmount;
    double rate;
    Instant occurredAt;

    public static final String EVENT_TYPE = "CurrencyExchanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static CurrencyExchangedEvent of(String playerId, String from, String to, long amount,
                                            long converted, double rate, Instant now) {
        return new CurrencyExchangedEvent(UUID.randomUUID(), playerId, from, to, amount, converted, rate, now);
    }
}
