package com.flagship.game_economy.pricing;

/**
 * What a shop reward grants. Every handler switches over all values.
 */
public enum RewardType {
    CURRENCY,
    ITEM,
    BOOSTER
}
