package com.flagship.game_economy.ledger;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Detached copy of one player's ledger state, used for snapshots.
 */
@Value
public class WalletState {
    String playerId;
    Map<String, Long> balances;
    Map<String, List<Transaction>> histories;
    Map<String, Long> totalEarned;
    Map<String, Long> totalSpent;
}
