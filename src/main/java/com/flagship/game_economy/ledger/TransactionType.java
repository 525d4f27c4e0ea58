package com.flagship.game_economy.ledger;

/**
 * Kind of balance mutation recorded in a {@link Transaction}.
 */
public enum TransactionType {
    EARN,
    SPEND,
    EXCHANGE
}
