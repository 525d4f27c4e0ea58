package com.flagship.game_economy.inventory;

import lombok.Value;

import java.util.Map;

/**
 * Detached copy of a player's inventory, used for snapshots and views.
 */
@Value
public class InventoryState {
    String playerId;
    Map<String, Long> items;
    Map<String, Long> boosters;
}
