package com.flagship.game_economy.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

@Value
public class ExchangeRequest {

    @NotBlank(message = "Source currency is required")
    @JsonProperty("from_currency")
    String fromCurrency;

    @NotBlank(message = "Target currency is required")
    @JsonProperty("to_currency")
    String toCurrency;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be greater than 0")
    @JsonProperty("amount")
    Long amount;
}
