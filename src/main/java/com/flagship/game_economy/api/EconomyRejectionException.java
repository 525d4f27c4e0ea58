package com.flagship.game_economy.api;

import com.flagship.game_economy.common.EconomyError;
import com.flagship.game_economy.common.EconomyResult;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Carries a typed economy rejection to the HTTP boundary.
 */
@Getter
public class EconomyRejectionException extends RuntimeException {

    private final EconomyError error;

    public EconomyRejectionException(EconomyError error, String message) {
        super(message);
        this.error = error;
    }

    /**
     * Payload of a successful result, or throws the rejection.
     */
    public static <T> T unwrap(EconomyResult<T> result) {
        if (result.isRejected()) {
            throw new EconomyRejectionException(result.getError(), result.getMessage());
        }
        return result.getValue();
    }

    public HttpStatus status() {
        return switch (error) {
            case CURRENCY_UNKNOWN, ITEM_UNKNOWN -> HttpStatus.NOT_FOUND;
            case INVALID_AMOUNT -> HttpStatus.BAD_REQUEST;
            case BALANCE_AT_MAXIMUM, INSUFFICIENT_FUNDS, INSUFFICIENT_INVENTORY, EXCHANGE_UNAVAILABLE,
                 EXCHANGE_TOO_SMALL, ITEM_UNAVAILABLE, PURCHASE_COST_FAILURE -> HttpStatus.CONFLICT;
        };
    }
}
