package com.flagship.game_economy.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

/**
 * Request DTO for earn and spend.
 */
@Value
public class CurrencyAmountRequest {

    @NotBlank(message = "Currency is required")
    @JsonProperty("currency_id")
    String currencyId;

    @NotNull(message = "Amount is required")
    @Positive(message = "Amount must be greater than 0")
    @JsonProperty("amount")
    Long amount;

    /** Source of an earn or reason of a spend. */
    @JsonProperty("tag")
    String tag;
}
