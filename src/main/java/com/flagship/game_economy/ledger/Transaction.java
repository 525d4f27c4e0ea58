package com.flagship.game_economy.ledger;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Immutable record of a single balance mutation.
 *
 * {@code amount} is signed: positive for credits, negative for debits.
 * {@code balanceAfter} always equals the balance right after this mutation.
 * {@code compensation} marks refunds injected to undo part of a failed operation;
 * those are excluded from inflation and lifetime statistics.
 */
@Value
public class Transaction {
    UUID id;
    String playerId;
    String currencyId;
    TransactionType type;
    long amount;
    String tag;
    Instant timestamp;
    long balanceAfter;
    boolean compensation;

    static Transaction of(String playerId, String currencyId, TransactionType type, long amount,
                          String tag, Instant timestamp, long balanceAfter, boolean compensation) {
        return new Transaction(UUID.randomUUID(), playerId, currencyId, type, amount, tag, timestamp,
            balanceAfter, compensation);
    }

    @JsonIgnore
    public boolean isCredit() {
        return amount > 0;
    }
}
