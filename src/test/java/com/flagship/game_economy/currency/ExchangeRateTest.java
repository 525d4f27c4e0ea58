package com.flagship.game_economy.currency;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExchangeRateTest {

    private static final Instant NOW = Instant.parse("2026-01-05T00:00:00Z");

    @Test
    @DisplayName("construction clamps the rate into its band")
    void clampsOnConstruction() {
        assertEquals(0.02, ExchangeRate.of("coins", "gems", 0.5, 0.005, 0.02, true, NOW).getRate(), 1e-12);
        assertEquals(0.005, ExchangeRate.of("coins", "gems", 0.0001, 0.005, 0.02, true, NOW).getRate(), 1e-12);
        assertThrows(IllegalArgumentException.class,
            () -> ExchangeRate.of("coins", "gems", 0.01, 0.02, 0.005, true, NOW));
        assertThrows(IllegalArgumentException.class,
            () -> ExchangeRate.of("coins", "gems", 0.01, 0, 0.02, true, NOW));
    }

    @Test
    @DisplayName("re-applying the drift of a cycle does not compound")
    void driftIsIdempotentPerCycle() {
        ExchangeRate rate = ExchangeRate.of("gems", "coins", 100, 50, 200, true, NOW);

        ExchangeRate once = rate.drift(7, 0.04, NOW);
        ExchangeRate twice = once.drift(7, 0.04, NOW);
        ExchangeRate next = twice.drift(8, 0.04, NOW);

        assertEquals(104.0, once.getRate(), 1e-9);
        assertEquals(104.0, twice.getRate(), 1e-9);
        assertEquals(108.16, next.getRate(), 1e-9);
    }

    @Test
    @DisplayName("drift never leaves the band")
    void driftStaysInBand() {
        ExchangeRate rate = ExchangeRate.of("stars", "coins", 10, 5, 20, true, NOW);
        for (long cycle = 1; cycle <= 100; cycle++) {
            rate = rate.drift(cycle, cycle % 2 == 0 ? 0.5 : 0.3, NOW);
        }
        assertEquals(20.0, rate.getRate(), 1e-12);
        assertEquals(5.0, rate.drift(101, Double.NaN, NOW).getRate(), 1e-12);
    }

    @Test
    @DisplayName("the rate book drifts every pair within bounds and ignores inactive flags")
    void bookDriftsEveryPair() {
        ExchangeRateBook book = new ExchangeRateBook(List.of(
            ExchangeRate.of("coins", "gems", 0.01, 0.005, 0.02, true, NOW),
            ExchangeRate.of("gems", "coins", 100, 50, 200, false, NOW)));

        book.driftAll(1, rate -> -0.9, NOW);

        assertEquals(0.005, book.rateOf("coins", "gems"), 1e-12);
        assertEquals(50.0, book.rateOf("gems", "coins"), 1e-12);
        assertFalse(book.find("gems", "coins").orElseThrow().isActive());
        assertEquals(0.0, book.rateOf("stars", "coins"));
    }

    @Test
    @DisplayName("the registry rejects duplicate ids and inverted bounds")
    void registryValidatesDefinitions() {
        Currency coins = Currency.builder().id("coins").minAmount(0).maxAmount(10).tradeable(true).build();
        Currency inverted = Currency.builder().id("gems").minAmount(10).maxAmount(5).build();

        assertThrows(IllegalArgumentException.class, () -> new CurrencyRegistry(List.of(coins, coins)));
        assertThrows(IllegalArgumentException.class, () -> new CurrencyRegistry(List.of(inverted)));
        CurrencyRegistry registry = new CurrencyRegistry(List.of(coins));
        assertTrue(registry.find(null).isEmpty());
        assertEquals(10L, coins.clamp(25));
        assertEquals(List.of(coins), registry.tradeable());
    }
}
