package com.flagship.game_economy.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Tuning knobs for the economy, bound from {@code economy.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "economy")
public class EconomyProperties {

    private Ledger ledger = new Ledger();
    private Inflation inflation = new Inflation();
    private Profile profile = new Profile();
    private Pricing pricing = new Pricing();

    @Getter
    @Setter
    public static class Ledger {
        /** Transactions kept per player and currency. */
        private int historyCapacity = 100;
        /** Economy-wide transactions kept per currency for the inflation window. */
        private int flowWindowCapacity = 1000;
    }

    @Getter
    @Setter
    public static class Inflation {
        /** Simulated time between controller cycles. */
        private Duration interval = Duration.ofSeconds(60);
        private int sampleSize = 10;
        private int minTransactions = 10;
        /** Dead band around zero inside which no adjustment is made. */
        private double threshold = 0.1;
        private double gain = 0.5;
        /** Largest relative change of a multiplier in a single cycle. */
        private double maxStep = 0.3;
        private double minMultiplier = 0.5;
        private double maxMultiplier = 2.0;
        /** Largest relative exchange rate drift per cycle. */
        private double maxRateDrift = 0.05;
        private long driftSeed = 42L;
    }

    @Getter
    @Setter
    public static class Profile {
        private int churnInactiveDays = 30;
    }

    @Getter
    @Setter
    public static class Pricing {
        private double maxPersonalizedDiscountPercent = 50.0;
        private Duration personalizationTimeout = Duration.ofSeconds(2);
        private int personalizedOfferHours = 24;
    }
}
