package com.flagship.game_economy.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class RewardClaimedEvent implements EconomyEvent {
    UUID eventId;
    String playerId;
    String source;
    String currencyId;
    long baseAmount;
    long grantedAmount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "RewardClaimed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static RewardClaimedEvent of(String playerId, String source, String currencyId, long baseAmount,
                                        long grantedAmount, Instant now) {
        return new RewardClaimedEvent(UUID.randomUUID(), playerId, source, currencyId, baseAmount, grantedAmount, now);
    }
}
