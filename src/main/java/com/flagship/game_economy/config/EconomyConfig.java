package com.flagship.game_economy.config;

import com.flagship.game_economy.catalog.CatalogLoader;
import com.flagship.game_economy.catalog.EconomyCatalog;
import com.flagship.game_economy.currency.CurrencyRegistry;
import com.flagship.game_economy.currency.ExchangeRateBook;
import com.flagship.game_economy.inflation.EconomyMultipliers;
import com.flagship.game_economy.inflation.RateDrift;
import com.flagship.game_economy.inflation.SeededRateDrift;
import com.flagship.game_economy.personalization.NoOpPersonalizationClient;
import com.flagship.game_economy.personalization.PersonalizationClient;
import com.flagship.game_economy.personalization.RestPersonalizationClient;
import com.flagship.game_economy.pricing.InMemoryPlayerLevels;
import com.flagship.game_economy.pricing.ShopCatalog;
import com.flagship.game_economy.scheduling.SimulationClock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the economy components that are built from the catalog and the
 * {@code economy.*} properties rather than discovered by component scan.
 */
@Configuration
@Slf4j
public class EconomyConfig {

    @Bean
    public SimulationClock simulationClock() {
        return SimulationClock.system();
    }

    @Bean
    public EconomyCatalog economyCatalog(CatalogLoader loader,
                                         @Value("${economy.catalog.location:classpath:economy-catalog.json}") String location) {
        return loader.load(location);
    }

    @Bean
    public CurrencyRegistry currencyRegistry(EconomyCatalog catalog) {
        return new CurrencyRegistry(catalog.getCurrencies());
    }

    @Bean
    public ExchangeRateBook exchangeRateBook(EconomyCatalog catalog) {
        return new ExchangeRateBook(catalog.getExchangeRates());
    }

    @Bean
    public ShopCatalog shopCatalog(EconomyCatalog catalog) {
        return new ShopCatalog(catalog.getShopItems());
    }

    @Bean
    public EconomyMultipliers economyMultipliers(EconomyProperties properties) {
        return new EconomyMultipliers(properties.getInflation().getMinMultiplier(),
            properties.getInflation().getMaxMultiplier());
    }

    @Bean
    public RateDrift rateDrift(EconomyProperties properties) {
        return new SeededRateDrift(properties.getInflation().getDriftSeed(),
            properties.getInflation().getMaxRateDrift());
    }

    @Bean
    public InMemoryPlayerLevels playerLevels() {
        return new InMemoryPlayerLevels();
    }

    @Bean
    public PersonalizationClient personalizationClient(RestTemplateBuilder builder,
                                                       EconomyProperties properties,
                                                       @Value("${economy.personalization.url:}") String url) {
        if (url == null || url.isBlank()) {
            log.info("No personalization service configured, personalized offers disabled");
            return new NoOpPersonalizationClient();
        }
        log.info("Personalization service at {}", url);
        return new RestPersonalizationClient(builder
            .setConnectTimeout(properties.getPricing().getPersonalizationTimeout())
            .setReadTimeout(properties.getPricing().getPersonalizationTimeout())
            .build(), url);
    }
}
