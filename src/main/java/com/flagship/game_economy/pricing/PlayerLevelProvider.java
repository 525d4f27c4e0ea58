package com.flagship.game_economy.pricing;

/**
 * Source of player levels for level-gated shop items.
 */
public interface PlayerLevelProvider {

    int levelOf(String playerId);
}
