package com.flagship.game_economy.inflation;

import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
public class InflationReport {
    long cycle;
    Instant ranAt;
    List<CurrencyInflation> currencies;
}
