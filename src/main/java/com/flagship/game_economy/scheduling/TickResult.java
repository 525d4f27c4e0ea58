package com.flagship.game_economy.scheduling;

import com.flagship.game_economy.inflation.InflationReport;
import lombok.Value;

import java.util.Optional;

/**
 * What one tick did.
 */
@Value
public class TickResult {
    int eventsDispatched;
    int discountsExpired;
    InflationReport inflationReport;
    int segmentChanges;

    public Optional<InflationReport> inflationCycle() {
        return Optional.ofNullable(inflationReport);
    }
}
