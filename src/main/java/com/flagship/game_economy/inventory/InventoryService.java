package com.flagship.game_economy.inventory;

import com.flagship.game_economy.common.EconomyError;
import com.flagship.game_economy.common.EconomyResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Items and boosters granted by shop purchases and rewards.
 */
@Service
@Slf4j
public class InventoryService {

    private final ConcurrentHashMap<String, PlayerInventory> inventories = new ConcurrentHashMap<>();

    /**
     * @return the new quantity held
     */
    public long grant(String playerId, InventoryKind kind, String id, long amount) {
        requireIds(playerId, id);
        if (amount <= 0) {
            throw new IllegalArgumentException("Grant amount must be positive: " + amount);
        }
        long quantity = inventory(playerId).add(kind, id, amount);
        log.debug("Granted {} x{} {} to player {}", id, amount, kind, playerId);
        return quantity;
    }

    /**
     * Removes {@code amount} units, or nothing if the player holds fewer.
     *
     * @return the remaining quantity
     */
    public EconomyResult<Long> consume(String playerId, InventoryKind kind, String id, long amount) {
        requireIds(playerId, id);
        if (amount <= 0) {
            return EconomyResult.rejected(EconomyError.INVALID_AMOUNT, "Consume amount must be positive: %d", amount);
        }
        PlayerInventory inventory = inventories.get(playerId);
        long remaining = inventory == null ? -1 : inventory.remove(kind, id, amount);
        if (remaining < 0) {
            return EconomyResult.rejected(EconomyError.INSUFFICIENT_INVENTORY,
                "Player %s holds fewer than %d of %s", playerId, amount, id);
        }
        return EconomyResult.ok(remaining);
    }

    public long quantity(String playerId, InventoryKind kind, String id) {
        PlayerInventory inventory = inventories.get(playerId);
        return inventory == null ? 0L : inventory.quantity(kind, id);
    }

    public InventoryState contents(String playerId) {
        PlayerInventory inventory = inventories.get(playerId);
        return inventory == null ? new InventoryState(playerId, Map.of(), Map.of()) : inventory.state();
    }

    public List<InventoryState> exportInventories() {
        List<InventoryState> states = new ArrayList<>();
        inventories.values().forEach(inventory -> states.add(inventory.state()));
        return states;
    }

    public void restoreInventories(Collection<InventoryState> states) {
        inventories.clear();
        for (InventoryState state : states) {
            PlayerInventory inventory = inventory(state.getPlayerId());
            state.getItems().forEach((id, amount) -> inventory.add(InventoryKind.ITEM, id, amount));
            state.getBoosters().forEach((id, amount) -> inventory.add(InventoryKind.BOOSTER, id, amount));
        }
    }

    private PlayerInventory inventory(String playerId) {
        return inventories.computeIfAbsent(playerId, PlayerInventory::new);
    }

    private static void requireIds(String playerId, String id) {
        if (playerId == null || playerId.isBlank() || id == null || id.isBlank()) {
            throw new IllegalArgumentException("playerId and inventory id are required");
        }
    }
}
