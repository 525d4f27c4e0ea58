package com.flagship.game_economy.profile;

import com.flagship.game_economy.config.EconomyProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps one {@link PlayerEconomicProfile} per player.
 *
 * Each profile is replaced atomically through {@link ConcurrentHashMap#compute},
 * which serializes updates for the same player while leaving other players
 * independent. Derived fields are re-evaluated on every event and on every
 * {@link #sweep()}, so a silent player still decays towards churned.
 */
@Service
@Slf4j
public class PlayerProfileStore {

    public static final String TAG_CATEGORY = "category";
    public static final String TAG_HARD_CURRENCY = "hardCurrency";

    private final ConcurrentHashMap<String, PlayerEconomicProfile> profiles = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int churnInactiveDays;

    public PlayerProfileStore(Clock clock, EconomyProperties properties) {
        this.clock = clock;
        this.churnInactiveDays = properties.getProfile().getChurnInactiveDays();
    }

    public PlayerEconomicProfile recordEvent(String playerId, ProfileEventType type, long value,
                                             Map<String, String> tags) {
        return recordEvent(playerId, type, value, tags, clock.instant());
    }

    /**
     * Applies one event to the player's profile, creating the profile on first
     * reference, and re-evaluates the derived fields.
     */
    public PlayerEconomicProfile recordEvent(String playerId, ProfileEventType type, long value,
                                             Map<String, String> tags, Instant occurredAt) {
        if (playerId == null || playerId.isBlank()) {
            throw new IllegalArgumentException("playerId is required");
        }
        if (type == null) {
            throw new IllegalArgumentException("Event type is required");
        }
        Map<String, String> safeTags = tags == null ? Map.of() : tags;
        Instant now = clock.instant();
        Instant at = occurredAt == null ? now : occurredAt;

        PlayerEconomicProfile updated = profiles.compute(playerId, (id, current) -> {
            PlayerEconomicProfile base = current == null ? PlayerEconomicProfile.newcomer(id, at) : current;
            PlayerEconomicProfile applied = apply(base, type, Math.max(0, value), safeTags, at);
            return ProfileScoring.evaluate(applied, now, churnInactiveDays);
        });

        log.debug("Profile event {} for player {}: value={}, segment={}", type, playerId, value, updated.getSegment());
        return updated;
    }

    public Optional<PlayerEconomicProfile> get(String playerId) {
        if (playerId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(profiles.get(playerId));
    }

    public Optional<ProfileSummary> summary(String playerId) {
        Instant now = clock.instant();
        return get(playerId).map(profile -> ProfileSummary.of(profile, now));
    }

    /**
     * Re-evaluates every profile against the current time.
     *
     * @return number of players whose segment changed
     */
    public int sweep() {
        Instant now = clock.instant();
        int changed = 0;
        for (String playerId : profiles.keySet()) {
            PlayerSegment[] before = new PlayerSegment[1];
            PlayerEconomicProfile after = profiles.computeIfPresent(playerId, (id, current) -> {
                before[0] = current.getSegment();
                return ProfileScoring.evaluate(current, now, churnInactiveDays);
            });
            if (after != null && after.getSegment() != before[0]) {
                changed++;
                log.info("Player {} moved from {} to {}", playerId, before[0], after.getSegment());
            }
        }
        return changed;
    }

    public List<String> playersBySegment(PlayerSegment segment) {
        List<String> result = new ArrayList<>();
        profiles.forEach((playerId, profile) -> {
            if (profile.getSegment() == segment) {
                result.add(playerId);
            }
        });
        result.sort(null);
        return result;
    }

    public Map<PlayerSegment, Long> segmentDistribution() {
        Map<PlayerSegment, Long> distribution = new EnumMap<>(PlayerSegment.class);
        for (PlayerSegment segment : PlayerSegment.values()) {
            distribution.put(segment, 0L);
        }
        profiles.values().forEach(profile -> distribution.merge(profile.getSegment(), 1L, Long::sum));
        return distribution;
    }

    public int size() {
        return profiles.size();
    }

    public List<PlayerEconomicProfile> exportProfiles() {
        return new ArrayList<>(profiles.values());
    }

    public void restoreProfiles(Collection<PlayerEconomicProfile> restored) {
        Map<String, PlayerEconomicProfile> byId = new HashMap<>();
        for (PlayerEconomicProfile profile : restored) {
            byId.put(profile.getPlayerId(), profile);
        }
        profiles.clear();
        profiles.putAll(byId);
        log.info("Restored {} player profiles", byId.size());
    }

    private PlayerEconomicProfile apply(PlayerEconomicProfile profile, ProfileEventType type, long value,
                                        Map<String, String> tags, Instant at) {
        PlayerEconomicProfile.PlayerEconomicProfileBuilder builder = profile.toBuilder();
        if (profile.getLastActiveAt() == null || at.isAfter(profile.getLastActiveAt())) {
            builder.lastActiveAt(at);
        }

        switch (type) {
            case CURRENCY_EARNED -> builder.totalEarned(profile.getTotalEarned() + value);
            case CURRENCY_SPENT -> {
                if (Boolean.parseBoolean(tags.get(TAG_HARD_CURRENCY))) {
                    builder.totalSpent(profile.getTotalSpent() + value);
                }
            }
            case ITEM_PURCHASED -> {
                builder.purchaseCount(profile.getPurchaseCount() + 1)
                    .purchaseValue(profile.getPurchaseValue() + value)
                    .lastPurchaseAt(at);
                if (profile.getFirstPurchaseAt() == null) {
                    builder.firstPurchaseAt(at);
                }
                String category = tags.getOrDefault(TAG_CATEGORY, "uncategorized");
                Map<String, Long> byCategory = profile.getSpendByCategory() == null
                    ? new HashMap<>() : new HashMap<>(profile.getSpendByCategory());
                byCategory.merge(category, value, Long::sum);
                builder.spendByCategory(Map.copyOf(byCategory));
            }
            case REWARD_CLAIMED -> builder.rewardsClaimed(profile.getRewardsClaimed() + 1);
            case ACTIVITY -> {
                // recency only
            }
        }
        return builder.build();
    }
}
