package com.flagship.game_economy.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

@Value
public class RewardRequest {

    @NotBlank(message = "Currency is required")
    @JsonProperty("currency_id")
    String currencyId;

    @NotNull(message = "Base amount is required")
    @Positive(message = "Base amount must be greater than 0")
    @JsonProperty("base_amount")
    Long baseAmount;

    @JsonProperty("source")
    String source;
}
