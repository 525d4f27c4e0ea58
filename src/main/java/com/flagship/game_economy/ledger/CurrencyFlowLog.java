package com.flagship.game_economy.ledger;

import com.flagship.game_economy.config.EconomyProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Economy-wide window of earn and spend transactions per currency.
 *
 * This is what the inflation controller samples. Exchanges and compensating
 * refunds are not recorded: they move value between currencies or undo an
 * aborted operation rather than add or remove currency.
 *
 * Each currency's ring is guarded by its own monitor, which is always taken
 * after any player lock.
 */
@Component
public class CurrencyFlowLog {

    private final ConcurrentHashMap<String, TransactionHistory> flows = new ConcurrentHashMap<>();
    private final int capacity;

    public CurrencyFlowLog(EconomyProperties properties) {
        this.capacity = properties.getLedger().getFlowWindowCapacity();
    }

    void record(Transaction transaction) {
        if (transaction.isCompensation() || transaction.getType() == TransactionType.EXCHANGE) {
            return;
        }
        TransactionHistory history = flows.computeIfAbsent(transaction.getCurrencyId(),
            id -> new TransactionHistory(capacity));
        synchronized (history) {
            history.append(transaction);
        }
    }

    /**
     * The most recent {@code count} flow transactions for a currency, oldest first.
     */
    public List<Transaction> recent(String currencyId, int count) {
        TransactionHistory history = flows.get(currencyId);
        if (history == null) {
            return List.of();
        }
        synchronized (history) {
            return history.recent(count);
        }
    }

    public int size(String currencyId) {
        TransactionHistory history = flows.get(currencyId);
        if (history == null) {
            return 0;
        }
        synchronized (history) {
            return history.size();
        }
    }

    public void clear() {
        flows.clear();
    }
}
