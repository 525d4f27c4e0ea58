package com.flagship.game_economy.profile;

public enum ProfileEventType {
    CURRENCY_EARNED,
    CURRENCY_SPENT,
    ITEM_PURCHASED,
    REWARD_CLAIMED,
    /** Any other sign of life, such as a session start. */
    ACTIVITY
}
