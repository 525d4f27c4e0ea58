package com.flagship.game_economy.inflation;

public enum InflationDirection {
    /** Earned outpaces spent beyond the threshold: raise sinks, shrink sources. */
    INFLATION,
    /** Spent outpaces earned beyond the threshold: lower sinks, grow sources. */
    DEFLATION,
    STABLE,
    /** Too few transactions in the window to judge. */
    INSUFFICIENT_DATA
}
