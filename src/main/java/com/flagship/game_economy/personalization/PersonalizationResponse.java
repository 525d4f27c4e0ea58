package com.flagship.game_economy.personalization;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Suggestion returned by the personalization service. Both fields are optional.
 * A {@code priceFactor} of 0.8 means "offer at 80% of the price".
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PersonalizationResponse {
    private Double priceFactor;
    private String offerType;
}
