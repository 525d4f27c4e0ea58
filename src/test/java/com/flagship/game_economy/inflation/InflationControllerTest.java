package com.flagship.game_economy.inflation;

import com.flagship.game_economy.EconomyTestFixture;
import com.flagship.game_economy.currency.ExchangeRate;
import com.flagship.game_economy.ledger.CurrencyLedger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the controller cycle by cycle against a hand-made flow window.
 */
class InflationControllerTest {

    private static final String PLAYER = "player-1";

    private EconomyTestFixture economy;
    private InflationController controller;
    private CurrencyLedger ledger;

    @BeforeEach
    void setUp() {
        economy = new EconomyTestFixture();
        controller = economy.inflation;
        ledger = economy.ledger;
    }

    @Test
    @DisplayName("net earning raises the sink and lowers the source multiplier")
    void inflationAdjustsMultipliers() {
        inflationaryWindow();

        InflationReport report = controller.runCycle(1);

        CurrencyInflation coins = verdict(report, "coins");
        assertEquals(InflationDirection.INFLATION, coins.getDirection());
        assertEquals(800L, coins.getEarned());
        assertEquals(200L, coins.getSpent());
        assertEquals(3.0, coins.getInflationRate(), 1e-9);
        assertEquals(1.3, controller.multipliers("coins").getSink(), 1e-9);
        assertEquals(0.7, controller.multipliers("coins").getSource(), 1e-9);
        assertEquals(1.3, economy.pricing.sinkMultiplier("coins"), 1e-9);
        assertEquals(0.7, economy.rewards.sourceMultiplier("coins"), 1e-9);
    }

    @Test
    @DisplayName("net spending lowers the sink and raises the source multiplier")
    void deflationAdjustsMultipliers() {
        for (int i = 0; i < 10; i++) {
            ledger.earn(PLAYER, "coins", 100, "quest");
        }
        for (int i = 0; i < 10; i++) {
            ledger.spend(PLAYER, "coins", 100, "shop");
        }

        InflationReport report = controller.runCycle(1);

        assertEquals(InflationDirection.DEFLATION, verdict(report, "coins").getDirection());
        assertEquals(0.7, controller.multipliers("coins").getSink(), 1e-9);
        assertEquals(1.3, controller.multipliers("coins").getSource(), 1e-9);
    }

    @Test
    @DisplayName("too few transactions leave the multipliers untouched")
    void insufficientData() {
        for (int i = 0; i < 9; i++) {
            ledger.earn(PLAYER, "gems", 5, "login");
        }

        InflationReport report = controller.runCycle(1);

        assertEquals(InflationDirection.INSUFFICIENT_DATA, verdict(report, "gems").getDirection());
        assertEquals(9, verdict(report, "gems").getSampled());
        assertEquals(MultiplierState.neutral(), controller.multipliers("gems"));
    }

    @Test
    @DisplayName("a small imbalance inside the threshold is stable")
    void stableWithinThreshold() {
        for (int i = 0; i < 10; i++) {
            ledger.earn(PLAYER, "stars", 100, "level");
        }
        for (int i = 0; i < 5; i++) {
            ledger.earn(PLAYER, "stars", 105, "level");
            ledger.spend(PLAYER, "stars", 100, "unlock");
        }

        InflationReport report = controller.runCycle(1);

        assertEquals(InflationDirection.STABLE, verdict(report, "stars").getDirection());
        assertEquals(1.0, controller.multipliers("stars").getSink(), 1e-12);
    }

    @Test
    @DisplayName("repeating a cycle does not compound, the next cycle does, and the band holds")
    void cyclesAreIdempotentAndBounded() {
        inflationaryWindow();

        controller.runCycle(1);
        controller.runCycle(1);
        assertEquals(1.3, controller.multipliers("coins").getSink(), 1e-9);

        controller.runCycle(2);
        assertEquals(1.69, controller.multipliers("coins").getSink(), 1e-9);
        assertEquals(0.5, controller.multipliers("coins").getSource(), 1e-9);

        controller.runCycle(3);
        assertEquals(2.0, controller.multipliers("coins").getSink(), 1e-9);
        assertEquals(0.5, controller.multipliers("coins").getSource(), 1e-9);
    }

    @Test
    @DisplayName("exchange rates drift every cycle but stay within their bands")
    void ratesStayInBand() {
        for (long cycle = 1; cycle <= 300; cycle++) {
            controller.runCycle(cycle);
        }

        for (ExchangeRate rate : economy.rates.all()) {
            assertTrue(rate.getRate() >= rate.getMinRate() && rate.getRate() <= rate.getMaxRate(),
                () -> rate.key() + " left its band: " + rate.getRate());
        }
        assertNotEquals(0.01, economy.rates.rateOf("coins", "gems"));
    }

    @Test
    @DisplayName("a cycle runs once per simulated interval")
    void runsOncePerInterval() {
        Optional<InflationReport> first = controller.runDueCycle();
        Optional<InflationReport> again = controller.runDueCycle();
        economy.clock.advance(Duration.ofSeconds(60));
        Optional<InflationReport> next = controller.runDueCycle();

        assertTrue(first.isPresent());
        assertTrue(again.isEmpty());
        assertTrue(next.isPresent());
        assertEquals(first.get().getCycle() + 1, next.get().getCycle());
        assertEquals(next, controller.lastReport());
    }

    @Test
    @DisplayName("the multiplier band must contain 1.0")
    void rejectsBandWithoutNeutral() {
        assertThrows(IllegalArgumentException.class, () -> new EconomyMultipliers(1.2, 2.0));
        assertThrows(IllegalArgumentException.class, () -> new EconomyMultipliers(0.5, 0.9));
    }

    private void inflationaryWindow() {
        for (int i = 0; i < 8; i++) {
            ledger.earn(PLAYER, "coins", 100, "quest");
        }
        ledger.spend(PLAYER, "coins", 100, "shop");
        ledger.spend(PLAYER, "coins", 100, "shop");
    }

    private static CurrencyInflation verdict(InflationReport report, String currencyId) {
        return report.getCurrencies().stream()
            .filter(c -> c.getCurrencyId().equals(currencyId))
            .findFirst()
            .orElseThrow();
    }
}
