package com.flagship.game_economy.profile;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Lifetime economic metrics of one player.
 *
 * The raw counters are only changed by recorded events. {@code engagementScore},
 * {@code churnRisk} and {@code segment} are derived from them by
 * {@link ProfileScoring} and refreshed on every event and every sweep.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PlayerEconomicProfile {
    String playerId;

    /** Hard currency spent over the player's lifetime. */
    long totalSpent;
    long totalEarned;
    long purchaseCount;
    /** Sum of all currency costs paid for shop purchases. */
    long purchaseValue;
    long rewardsClaimed;
    Map<String, Long> spendByCategory;

    Instant firstSeenAt;
    Instant firstPurchaseAt;
    Instant lastPurchaseAt;
    Instant lastActiveAt;

    double engagementScore;
    double churnRisk;
    PlayerSegment segment;
    Instant evaluatedAt;

    public static PlayerEconomicProfile newcomer(String playerId, Instant now) {
        return PlayerEconomicProfile.builder()
            .playerId(playerId)
            .spendByCategory(Map.of())
            .firstSeenAt(now)
            .lastActiveAt(now)
            .segment(PlayerSegment.NEW)
            .evaluatedAt(now)
            .build();
    }
}
