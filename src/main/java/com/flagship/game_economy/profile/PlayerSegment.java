package com.flagship.game_economy.profile;

/**
 * Coarse player classification used to target offers.
 */
public enum PlayerSegment {
    NEW,
    CASUAL,
    REGULAR,
    WHALE,
    CHURNED
}
