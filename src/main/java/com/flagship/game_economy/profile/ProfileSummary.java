package com.flagship.game_economy.profile;

import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only view of a profile with analytics derived at read time.
 */
@Value
public class ProfileSummary {
    String playerId;
    PlayerSegment segment;
    double engagementScore;
    double churnRisk;
    long totalSpent;
    long totalEarned;
    long purchaseCount;
    double averagePurchaseValue;
    double purchasesPerDay;
    long lifetimeValue;
    Map<String, Long> spendByCategory;
    Instant lastActiveAt;
    Instant lastPurchaseAt;

    static ProfileSummary of(PlayerEconomicProfile profile, Instant now) {
        return new ProfileSummary(profile.getPlayerId(), profile.getSegment(), profile.getEngagementScore(),
            profile.getChurnRisk(), profile.getTotalSpent(), profile.getTotalEarned(), profile.getPurchaseCount(),
            ProfileScoring.averagePurchaseValue(profile), ProfileScoring.purchaseFrequency(profile, now),
            profile.getTotalSpent(), profile.getSpendByCategory(), profile.getLastActiveAt(),
            profile.getLastPurchaseAt());
    }
}
