package com.flagship.game_economy.rewards;

import lombok.Value;

@Value
public class RewardGrant {
    String playerId;
    String currencyId;
    String source;
    long baseAmount;
    long grantedAmount;
    double sourceMultiplier;
    long newBalance;
}
