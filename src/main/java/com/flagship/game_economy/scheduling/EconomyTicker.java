package com.flagship.game_economy.scheduling;

import com.flagship.game_economy.eventbus.EventDispatcher;
import com.flagship.game_economy.inflation.InflationController;
import com.flagship.game_economy.inflation.InflationReport;
import com.flagship.game_economy.pricing.DynamicPricingEngine;
import com.flagship.game_economy.profile.PlayerProfileStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * One bounded unit of background work.
 *
 * Each tick dispatches one event batch and closes expired discount windows.
 * When simulated time has entered a new inflation cycle it also runs the
 * controller and the profile decay sweep. Tests drive this directly after
 * advancing the {@link SimulationClock}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EconomyTicker {

    private final EventDispatcher dispatcher;
    private final DynamicPricingEngine pricing;
    private final InflationController inflation;
    private final PlayerProfileStore profiles;

    public synchronized TickResult tick() {
        int dispatched = dispatcher.dispatchPending();
        int expired = pricing.expireDiscounts();

        Optional<InflationReport> report = inflation.runDueCycle();
        int segmentChanges = 0;
        if (report.isPresent()) {
            // profile events still queued must land before the decay sweep
            dispatched += dispatcher.dispatchAll();
            segmentChanges = profiles.sweep();
        }

        if (dispatched > 0 || expired > 0 || report.isPresent()) {
            log.debug("Tick: dispatched={}, discountsExpired={}, inflationCycle={}, segmentChanges={}",
                dispatched, expired, report.map(InflationReport::getCycle).orElse(null), segmentChanges);
        }
        return new TickResult(dispatched, expired, report.orElse(null), segmentChanges);
    }
}
