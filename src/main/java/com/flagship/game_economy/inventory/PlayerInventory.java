package com.flagship.game_economy.inventory;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Non-currency holdings of one player. Guarded by its own monitor.
 */
class PlayerInventory {

    private final String playerId;
    private final Map<InventoryKind, Map<String, Long>> holdings = new EnumMap<>(InventoryKind.class);

    PlayerInventory(String playerId) {
        this.playerId = playerId;
        for (InventoryKind kind : InventoryKind.values()) {
            holdings.put(kind, new LinkedHashMap<>());
        }
    }

    synchronized long add(InventoryKind kind, String id, long amount) {
        long sum = holdings.get(kind).getOrDefault(id, 0L);
        long updated = amount > Long.MAX_VALUE - sum ? Long.MAX_VALUE : sum + amount;
        holdings.get(kind).put(id, updated);
        return updated;
    }

    /**
     * @return the remaining quantity, or -1 if there was not enough
     */
    synchronized long remove(InventoryKind kind, String id, long amount) {
        long held = holdings.get(kind).getOrDefault(id, 0L);
        if (held < amount) {
            return -1;
        }
        long remaining = held - amount;
        if (remaining == 0) {
            holdings.get(kind).remove(id);
        } else {
            holdings.get(kind).put(id, remaining);
        }
        return remaining;
    }

    synchronized long quantity(InventoryKind kind, String id) {
        return holdings.get(kind).getOrDefault(id, 0L);
    }

    synchronized InventoryState state() {
        return new InventoryState(playerId, Map.copyOf(holdings.get(InventoryKind.ITEM)),
            Map.copyOf(holdings.get(InventoryKind.BOOSTER)));
    }
}
