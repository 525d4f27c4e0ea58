package com.flagship.game_economy.common;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Typed outcome of an economy operation.
 *
 * @param <T> payload carried on success (resulting balance, converted amount...)
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EconomyResult<T> {
    boolean success;
    EconomyError error;
    String message;
    T value;

    public static <T> EconomyResult<T> ok(T value) {
        return new EconomyResult<>(true, null, null, value);
    }

    public static <T> EconomyResult<T> rejected(EconomyError error, String message, Object... args) {
        return new EconomyResult<>(false, error, String.format(message, args), null);
    }

    /**
     * Re-types a rejection so it can be returned from an operation with a different payload.
     */
    public <U> EconomyResult<U> asRejection() {
        if (success) {
            throw new IllegalStateException("Cannot convert a successful result into a rejection");
        }
        return new EconomyResult<>(false, error, message, null);
    }

    public boolean isRejected() {
        return !success;
    }

    public boolean isRejectedWith(EconomyError expected) {
        return !success && error == expected;
    }
}
