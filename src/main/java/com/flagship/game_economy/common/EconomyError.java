package com.flagship.game_economy.common;

/**
 * Reasons an economy operation was denied.
 *
 * Every value here is an expected, recoverable outcome. A denied operation
 * never leaves a partial change behind: balances, counters and histories are
 * exactly as they were before the call.
 */
public enum EconomyError {
    /** Currency id is not in the registry. */
    CURRENCY_UNKNOWN,

    /** Amount was zero or negative. */
    INVALID_AMOUNT,

    /** Credit could not change the balance because it already sits at the currency maximum. */
    BALANCE_AT_MAXIMUM,

    /** Balance is lower than the requested debit. */
    INSUFFICIENT_FUNDS,

    /** Player does not hold enough of an inventory item. */
    INSUFFICIENT_INVENTORY,

    /** No exchange rate for the pair, or the rate is inactive. */
    EXCHANGE_UNAVAILABLE,

    /** Converted amount rounded to zero; the source currency was refunded. */
    EXCHANGE_TOO_SMALL,

    /** Shop item id is not in the catalog. */
    ITEM_UNKNOWN,

    /** Eligibility, time window or purchase cap check failed. */
    ITEM_UNAVAILABLE,

    /** A cost failed part-way through a purchase; earlier costs were refunded. */
    PURCHASE_COST_FAILURE
}
