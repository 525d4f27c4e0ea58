package com.flagship.game_economy.pricing;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Player levels reported by the game session. Unknown players are level 1.
 */
public class InMemoryPlayerLevels implements PlayerLevelProvider {

    static final int DEFAULT_LEVEL = 1;

    private final ConcurrentHashMap<String, Integer> levels = new ConcurrentHashMap<>();

    @Override
    public int levelOf(String playerId) {
        return levels.getOrDefault(playerId, DEFAULT_LEVEL);
    }

    public void setLevel(String playerId, int level) {
        if (level < 0) {
            throw new IllegalArgumentException("Level cannot be negative: " + level);
        }
        levels.put(playerId, level);
    }
}
