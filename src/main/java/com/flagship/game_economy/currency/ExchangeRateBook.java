package com.flagship.game_economy.currency;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.ToDoubleFunction;

/**
 * Holds the live exchange rates.
 *
 * Each rate is swapped atomically per key through {@link ConcurrentHashMap#compute},
 * which is the per-entity lock the inflation sweep shares with readers.
 */
public class ExchangeRateBook {

    private final ConcurrentHashMap<String, ExchangeRate> rates = new ConcurrentHashMap<>();

    public ExchangeRateBook(Collection<ExchangeRate> initial) {
        for (ExchangeRate rate : initial) {
            if (rates.putIfAbsent(rate.key(), rate) != null) {
                throw new IllegalArgumentException("Duplicate exchange rate: " + rate.key());
            }
        }
    }

    public Optional<ExchangeRate> find(String from, String to) {
        if (from == null || to == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(rates.get(ExchangeRate.keyOf(from, to)));
    }

    /**
     * Rate value for the pair, or 0 when the pair is not listed.
     */
    public double rateOf(String from, String to) {
        return find(from, to).map(ExchangeRate::getRate).orElse(0.0);
    }

    public List<ExchangeRate> all() {
        return new ArrayList<>(rates.values());
    }

    public boolean setActive(String from, String to, boolean active, Instant now) {
        return rates.computeIfPresent(ExchangeRate.keyOf(from, to),
            (key, current) -> current.withActive(active, now)) != null;
    }

    /**
     * Drifts every rate for the given cycle. The delta function must return a
     * bounded relative change; the result is clamped by {@link ExchangeRate#drift}.
     */
    public void driftAll(long cycle, ToDoubleFunction<ExchangeRate> relativeDelta, Instant now) {
        for (String key : rates.keySet()) {
            rates.computeIfPresent(key, (k, current) -> current.drift(cycle, relativeDelta.applyAsDouble(current), now));
        }
    }

    /**
     * Replaces all rates, used when restoring a snapshot.
     */
    public void replaceAll(Collection<ExchangeRate> restored) {
        rates.clear();
        for (ExchangeRate rate : restored) {
            rates.put(rate.key(), rate);
        }
    }
}
