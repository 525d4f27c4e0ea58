package com.flagship.game_economy.consumer;

import com.flagship.game_economy.event.BalanceChangedEvent;
import com.flagship.game_economy.event.CurrencyEarnedEvent;
import com.flagship.game_economy.event.CurrencyExchangedEvent;
import com.flagship.game_economy.event.CurrencySpentEvent;
import com.flagship.game_economy.event.DiscountEndedEvent;
import com.flagship.game_economy.event.DiscountStartedEvent;
import com.flagship.game_economy.event.EconomyEvent;
import com.flagship.game_economy.event.ItemPurchasedEvent;
import com.flagship.game_economy.event.RewardClaimedEvent;
import com.flagship.game_economy.eventbus.EconomyEventSubscriber;
import com.flagship.game_economy.profile.PlayerProfileStore;
import com.flagship.game_economy.profile.ProfileEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Feeds ledger and shop events into the {@link PlayerProfileStore}.
 */
@Component
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class ProfileEventConsumer implements EconomyEventSubscriber {

    static final String CONSUMER_GROUP = "player-profiles";

    private final PlayerProfileStore profiles;

    @Override
    public String consumerGroup() {
        return CONSUMER_GROUP;
    }

    @Override
    public void onEvent(EconomyEvent event) {
        switch (event.getEventType()) {
            case CurrencyEarnedEvent.EVENT_TYPE -> {
                CurrencyEarnedEvent earned = (CurrencyEarnedEvent) event;
                profiles.recordEvent(earned.getPlayerId(), ProfileEventType.CURRENCY_EARNED, earned.getAmount(),
                    Map.of(PlayerProfileStore.TAG_HARD_CURRENCY, String.valueOf(earned.isHardCurrency())),
                    earned.getOccurredAt());
            }
            case CurrencySpentEvent.EVENT_TYPE -> {
                CurrencySpentEvent spent = (CurrencySpentEvent) event;
                profiles.recordEvent(spent.getPlayerId(), ProfileEventType.CURRENCY_SPENT, spent.getAmount(),
                    Map.of(PlayerProfileStore.TAG_HARD_CURRENCY, String.valueOf(spent.isHardCurrency())),
                    spent.getOccurredAt());
            }
            case ItemPurchasedEvent.EVENT_TYPE -> {
                ItemPurchasedEvent purchased = (ItemPurchasedEvent) event;
                long value = purchased.getCosts().values().stream().mapToLong(Long::longValue).sum();
                String category = purchased.getCategory() == null ? "uncategorized" : purchased.getCategory();
                profiles.recordEvent(purchased.getPlayerId(), ProfileEventType.ITEM_PURCHASED, value,
                    Map.of(PlayerProfileStore.TAG_CATEGORY, category), purchased.getOccurredAt());
            }
            case RewardClaimedEvent.EVENT_TYPE -> {
                RewardClaimedEvent reward = (RewardClaimedEvent) event;
                profiles.recordEvent(reward.getPlayerId(), ProfileEventType.REWARD_CLAIMED, reward.getGrantedAmount(),
                    Map.of(), reward.getOccurredAt());
            }
            case CurrencyExchangedEvent.EVENT_TYPE ->
                profiles.recordEvent(event.getPlayerId(), ProfileEventType.ACTIVITY, 0, Map.of(), event.getOccurredAt());
            case BalanceChangedEvent.EVENT_TYPE, DiscountStartedEvent.EVENT_TYPE, DiscountEndedEvent.EVENT_TYPE ->
                log.trace("Profile consumer ignores {}", event.getEventType());
            default -> log.debug("Unknown event type: {}, skipping", event.getEventType());
        }
    }
}
