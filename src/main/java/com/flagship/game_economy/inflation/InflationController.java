package com.flagship.game_economy.inflation;

import com.flagship.game_economy.config.EconomyProperties;
import com.flagship.game_economy.currency.Currency;
import com.flagship.game_economy.currency.CurrencyRegistry;
import com.flagship.game_economy.currency.ExchangeRateBook;
import com.flagship.game_economy.ledger.CurrencyFlowLog;
import com.flagship.game_economy.ledger.Transaction;
import com.flagship.game_economy.observability.EconomyMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Discrete-time feedback loop that keeps each currency's inflow and outflow in balance.
 *
 * Per cycle and per currency with enough recent flow:
 * 1. inflationRate = (earned - spent) / spent over the last {@code sampleSize}
 *    earn/spend transactions; 0 when nothing was spent
 * 2. outside the {@code threshold} band, sink and source multipliers are moved
 *    in opposite directions by at most {@code maxStep}
 * 3. multipliers stay within {@code [minMultiplier, maxMultiplier]}
 *
 * Independently, every exchange rate drifts by a bounded amount and is
 * re-clamped to its band.
 *
 * Cycles are numbered by simulated time. Re-running a cycle recomputes from the
 * values the cycle started with, so repeated calls do not compound.
 */
@Service
@Slf4j
public class InflationController {

    private final CurrencyRegistry registry;
    private final ExchangeRateBook rates;
    private final CurrencyFlowLog flowLog;
    private final EconomyMultipliers multipliers;
    private final RateDrift rateDrift;
    private final List<EconomyAdjustmentListener> listeners;
    private final EconomyMetrics metrics;
    private final Clock clock;
    private final EconomyProperties.Inflation settings;
    private final AtomicLong lastCompletedCycle = new AtomicLong(Long.MIN_VALUE);
    private final AtomicReference<InflationReport> lastReport = new AtomicReference<>();

    public InflationController(CurrencyRegistry registry,
                               ExchangeRateBook rates,
                               CurrencyFlowLog flowLog,
                               EconomyMultipliers multipliers,
                               RateDrift rateDrift,
                               List<EconomyAdjustmentListener> listeners,
                               EconomyMetrics metrics,
                               Clock clock,
                               EconomyProperties properties) {
        this.registry = registry;
        this.rates = rates;
        this.flowLog = flowLog;
        this.multipliers = multipliers;
        this.rateDrift = rateDrift;
        this.listeners = List.copyOf(listeners);
        this.metrics = metrics;
        this.clock = clock;
        this.settings = properties.getInflation();
        if (settings.getInterval().isZero() || settings.getInterval().isNegative()) {
            throw new IllegalArgumentException("economy.inflation.interval must be positive");
        }
    }

    /**
     * Cycle number for the current simulated time.
     */
    public long currentCycle() {
        return clock.millis() / settings.getInterval().toMillis();
    }

    /**
     * Runs the current cycle if it has not completed yet.
     */
    public Optional<InflationReport> runDueCycle() {
        long cycle = currentCycle();
        if (cycle <= lastCompletedCycle.get()) {
            return Optional.empty();
        }
        return Optional.of(runCycle(cycle));
    }

    public synchronized InflationReport runCycle(long cycle) {
        Instant now = clock.instant();
        List<CurrencyInflation> verdicts = new ArrayList<>();

        for (Currency currency : registry.all()) {
            verdicts.add(evaluate(currency.getId(), cycle));
        }

        rates.driftAll(cycle, rate -> rateDrift.relativeDelta(cycle, rate), now);

        lastCompletedCycle.accumulateAndGet(cycle, Math::max);
        InflationReport report = new InflationReport(cycle, now, List.copyOf(verdicts));
        lastReport.set(report);
        log.debug("Inflation cycle {} evaluated {} currencies", cycle, verdicts.size());
        return report;
    }

    public Optional<InflationReport> lastReport() {
        return Optional.ofNullable(lastReport.get());
    }

    public MultiplierState multipliers(String currencyId) {
        return multipliers.get(currencyId);
    }

    public Map<String, MultiplierState> allMultipliers() {
        return multipliers.all();
    }

    /**
     * Replaces the multipliers from a snapshot and pushes them to the listeners.
     */
    public void restoreMultipliers(Map<String, MultiplierState> restored) {
        multipliers.replaceAll(restored);
        multipliers.all().forEach(this::notifyListeners);
    }

    private CurrencyInflation evaluate(String currencyId, long cycle) {
        MultiplierState current = multipliers.get(currencyId);
        if (flowLog.size(currencyId) < settings.getMinTransactions()) {
            return new CurrencyInflation(currencyId, flowLog.size(currencyId), 0, 0, 0.0,
                InflationDirection.INSUFFICIENT_DATA, current.getSink(), current.getSource());
        }

        List<Transaction> window = flowLog.recent(currencyId, settings.getSampleSize());
        long earned = 0;
        long spent = 0;
        for (Transaction transaction : window) {
            if (transaction.isCredit()) {
                earned += transaction.getAmount();
            } else {
                spent += -transaction.getAmount();
            }
        }

        double inflationRate = spent == 0 ? 0.0 : (double) (earned - spent) / spent;
        InflationDirection direction = classify(inflationRate);
        if (direction == InflationDirection.STABLE) {
            return new CurrencyInflation(currencyId, window.size(), earned, spent, inflationRate,
                direction, current.getSink(), current.getSource());
        }

        double step = Math.min(Math.abs(inflationRate) * settings.getGain(), settings.getMaxStep());
        double sinkFactor = direction == InflationDirection.INFLATION ? 1.0 + step : 1.0 - step;
        double sourceFactor = direction == InflationDirection.INFLATION ? 1.0 - step : 1.0 + step;

        MultiplierState adjusted = multipliers.adjust(currencyId, cycle, sinkFactor, sourceFactor);
        notifyListeners(currencyId, adjusted);
        metrics.recordInflationAdjustment(currencyId, direction.name().toLowerCase());

        log.info("{} detected for {}: rate={}, sink={}, source={}", direction, currencyId,
            String.format("%.3f", inflationRate), String.format("%.3f", adjusted.getSink()),
            String.format("%.3f", adjusted.getSource()));

        return new CurrencyInflation(currencyId, window.size(), earned, spent, inflationRate,
            direction, adjusted.getSink(), adjusted.getSource());
    }

    private InflationDirection classify(double inflationRate) {
        if (inflationRate > settings.getThreshold()) {
            return InflationDirection.INFLATION;
        }
        if (inflationRate < -settings.getThreshold()) {
            return InflationDirection.DEFLATION;
        }
        return InflationDirection.STABLE;
    }

    private void notifyListeners(String currencyId, MultiplierState state) {
        for (EconomyAdjustmentListener listener : listeners) {
            listener.onSinkMultiplier(currencyId, state.getSink());
            listener.onSourceMultiplier(currencyId, state.getSource());
        }
    }
}
