package com.flagship.game_economy.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Balances of a player after a read or a mutation.
 */
@Value
@Builder
public class BalanceResponse {

    @JsonProperty("player_id")
    String playerId;

    @JsonProperty("balances")
    Map<String, Long> balances;

    /** Amount credited to the target currency by an exchange. */
    @JsonProperty("converted_amount")
    Long convertedAmount;
}
