package com.flagship.game_economy.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

@Value
public class DiscountRequest {

    @NotNull(message = "Percentage is required")
    @Positive(message = "Percentage must be greater than 0")
    @JsonProperty("percentage")
    Double percentage;

    @NotNull(message = "Duration is required")
    @Positive(message = "Duration must be greater than 0")
    @JsonProperty("duration_hours")
    Integer durationHours;

    /** Purchases allowed at the discounted price; absent or 0 means no cap. */
    @JsonProperty("max_purchases")
    Integer maxPurchases;
}
