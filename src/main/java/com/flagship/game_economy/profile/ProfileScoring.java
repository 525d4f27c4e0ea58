package com.flagship.game_economy.profile;

import java.time.Duration;
import java.time.Instant;

/**
 * Pure scoring functions over a profile's raw counters and the current time.
 */
public final class ProfileScoring {

    static final long CASUAL_SPEND_LIMIT = 10;
    static final long REGULAR_SPEND_LIMIT = 100;

    private ProfileScoring() {
    }

    public static PlayerEconomicProfile evaluate(PlayerEconomicProfile profile, Instant now, int churnInactiveDays) {
        double engagement = engagementScore(profile, now);
        return profile.toBuilder()
            .engagementScore(engagement)
            .churnRisk(churnRisk(profile, engagement, now, churnInactiveDays))
            .segment(segment(profile, now, churnInactiveDays))
            .evaluatedAt(now)
            .build();
    }

    /**
     * Purchases (up to 50), rewards claimed (up to 20), recency (up to 20) and a
     * bonus of 10 for buying more than once a day; clamped to [0, 100].
     */
    public static double engagementScore(PlayerEconomicProfile profile, Instant now) {
        double score = Math.min(profile.getPurchaseCount() * 10.0, 50.0);
        score += Math.min(profile.getRewardsClaimed() * 2.0, 20.0);

        double inactiveDays = daysBetween(profile.getLastActiveAt(), now);
        if (inactiveDays < 1) {
            score += 20;
        } else if (inactiveDays < 7) {
            score += 10;
        }

        if (purchaseFrequency(profile, now) > 1.0) {
            score += 10;
        }
        return clamp(score);
    }

    public static double churnRisk(PlayerEconomicProfile profile, double engagementScore, Instant now,
                                   int churnInactiveDays) {
        double risk = 0;
        double inactiveDays = daysBetween(profile.getLastActiveAt(), now);
        if (inactiveDays > churnInactiveDays) {
            risk += 50;
        } else if (inactiveDays > 14) {
            risk += 30;
        } else if (inactiveDays > 7) {
            risk += 15;
        }
        if (engagementScore < 20) {
            risk += 30;
        }
        if (profile.getTotalSpent() < 5) {
            risk += 20;
        }
        return clamp(risk);
    }

    public static PlayerSegment segment(PlayerEconomicProfile profile, Instant now, int churnInactiveDays) {
        if (daysBetween(profile.getLastActiveAt(), now) > churnInactiveDays) {
            return PlayerSegment.CHURNED;
        }
        long spent = profile.getTotalSpent();
        if (spent <= 0) {
            return PlayerSegment.NEW;
        }
        if (spent < CASUAL_SPEND_LIMIT) {
            return PlayerSegment.CASUAL;
        }
        if (spent < REGULAR_SPEND_LIMIT) {
            return PlayerSegment.REGULAR;
        }
        return PlayerSegment.WHALE;
    }

    /**
     * Purchases per day since the player was first seen, counting at least one day.
     */
    public static double purchaseFrequency(PlayerEconomicProfile profile, Instant now) {
        if (profile.getPurchaseCount() == 0) {
            return 0;
        }
        double days = Math.max(1.0, daysBetween(profile.getFirstSeenAt(), now));
        return profile.getPurchaseCount() / days;
    }

    public static double averagePurchaseValue(PlayerEconomicProfile profile) {
        return profile.getPurchaseCount() == 0 ? 0 : (double) profile.getPurchaseValue() / profile.getPurchaseCount();
    }

    static double daysBetween(Instant from, Instant to) {
        if (from == null || to == null || to.isBefore(from)) {
            return 0;
        }
        return Duration.between(from, to).toMillis() / (double) Duration.ofDays(1).toMillis();
    }

    private static double clamp(double score) {
        return Math.max(0, Math.min(100, score));
    }
}
