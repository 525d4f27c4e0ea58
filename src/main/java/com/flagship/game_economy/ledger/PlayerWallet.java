package com.flagship.game_economy.ledger;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable per-player ledger state. Every field is guarded by {@link #lock}.
 */
class PlayerWallet {

    private final String playerId;
    private final int historyCapacity;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Long> balances = new LinkedHashMap<>();
    private final Map<String, TransactionHistory> histories = new HashMap<>();
    private final Map<String, Long> totalEarned = new HashMap<>();
    private final Map<String, Long> totalSpent = new HashMap<>();

    PlayerWallet(String playerId, int historyCapacity) {
        this.playerId = playerId;
        this.historyCapacity = historyCapacity;
    }

    String playerId() {
        return playerId;
    }

    ReentrantLock lock() {
        return lock;
    }

    /**
     * Balance for the currency, or {@code initial} if it was never touched.
     */
    long balance(String currencyId, long initial) {
        return balances.getOrDefault(currencyId, initial);
    }

    void setBalance(String currencyId, long amount) {
        balances.put(currencyId, amount);
    }

    Map<String, Long> balances() {
        return new LinkedHashMap<>(balances);
    }

    TransactionHistory history(String currencyId) {
        return histories.computeIfAbsent(currencyId, id -> new TransactionHistory(historyCapacity));
    }

    Map<String, TransactionHistory> histories() {
        return histories;
    }

    void addEarned(String currencyId, long amount) {
        totalEarned.merge(currencyId, amount, Long::sum);
    }

    void addSpent(String currencyId, long amount) {
        totalSpent.merge(currencyId, amount, Long::sum);
    }

    /**
     * Takes back spend that a compensating refund undid.
     */
    void reduceSpent(String currencyId, long amount) {
        totalSpent.computeIfPresent(currencyId, (id, spent) -> Math.max(0L, spent - amount));
    }

    long totalEarned(String currencyId) {
        return totalEarned.getOrDefault(currencyId, 0L);
    }

    long totalSpent(String currencyId) {
        return totalSpent.getOrDefault(currencyId, 0L);
    }

    Map<String, Long> totalsEarned() {
        return new HashMap<>(totalEarned);
    }

    Map<String, Long> totalsSpent() {
        return new HashMap<>(totalSpent);
    }
}
