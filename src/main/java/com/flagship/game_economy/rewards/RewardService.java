package com.flagship.game_economy.rewards;

import com.flagship.game_economy.common.EconomyError;
import com.flagship.game_economy.common.EconomyResult;
import com.flagship.game_economy.event.RewardClaimedEvent;
import com.flagship.game_economy.eventbus.EconomyEventBus;
import com.flagship.game_economy.inflation.EconomyAdjustmentListener;
import com.flagship.game_economy.ledger.CurrencyLedger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Gameplay rewards, the main currency source.
 *
 * The granted amount is the base amount scaled by the source multiplier the
 * inflation controller last pushed for the currency, never less than one unit.
 */
@Service
@Slf4j
public class RewardService implements EconomyAdjustmentListener {

    private final ConcurrentHashMap<String, Double> sourceMultipliers = new ConcurrentHashMap<>();
    private final CurrencyLedger ledger;
    private final EconomyEventBus eventBus;
    private final Clock clock;

    public RewardService(CurrencyLedger ledger, EconomyEventBus eventBus, Clock clock) {
        this.ledger = ledger;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public EconomyResult<RewardGrant> grantReward(String playerId, String currencyId, long baseAmount, String source) {
        if (baseAmount <= 0) {
            return EconomyResult.rejected(EconomyError.INVALID_AMOUNT, "Reward amount must be positive: %d", baseAmount);
        }
        double multiplier = sourceMultiplier(currencyId);
        long scaled = Math.max(1L, Math.round(baseAmount * multiplier));
        String tag = source == null || source.isBlank() ? "reward" : source;

        return ledger.withPlayerLock(playerId, () -> {
            long before = ledger.getBalance(playerId, currencyId);
            EconomyResult<Long> earned = ledger.earn(playerId, currencyId, scaled, tag);
            if (earned.isRejected()) {
                return earned.asRejection();
            }
            long granted = earned.getValue() - before;
            eventBus.publish(RewardClaimedEvent.of(playerId, tag, currencyId, baseAmount, granted, clock.instant()));
            log.debug("Reward {} for player {}: {} {} (base {}, x{})", tag, playerId, granted, currencyId,
                baseAmount, multiplier);
            return EconomyResult.ok(new RewardGrant(playerId, currencyId, tag, baseAmount, granted, multiplier,
                earned.getValue()));
        });
    }

    public double sourceMultiplier(String currencyId) {
        return sourceMultipliers.getOrDefault(currencyId, 1.0);
    }

    @Override
    public void onSourceMultiplier(String currencyId, double multiplier) {
        sourceMultipliers.put(currencyId, multiplier);
    }
}
