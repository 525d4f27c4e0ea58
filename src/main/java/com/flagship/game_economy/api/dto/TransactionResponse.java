package com.flagship.game_economy.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.game_economy.ledger.Transaction;
import com.flagship.game_economy.ledger.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("currency_id")
    String currencyId;

    @JsonProperty("type")
    TransactionType type;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("tag")
    String tag;

    @JsonProperty("balance_after")
    long balanceAfter;

    @JsonProperty("compensation")
    boolean compensation;

    @JsonProperty("timestamp")
    Instant timestamp;

    public static TransactionResponse from(Transaction transaction) {
        return TransactionResponse.builder()
            .id(transaction.getId())
            .currencyId(transaction.getCurrencyId())
            .type(transaction.getType())
            .amount(transaction.getAmount())
            .tag(transaction.getTag())
            .balanceAfter(transaction.getBalanceAfter())
            .compensation(transaction.isCompensation())
            .timestamp(transaction.getTimestamp())
            .build();
    }
}
