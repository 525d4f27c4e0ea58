package com.flagship.game_economy.catalog;

import com.flagship.game_economy.EconomyTestFixture;
import com.flagship.game_economy.config.JacksonConfig;
import com.flagship.game_economy.currency.Currency;
import com.flagship.game_economy.pricing.ShopItemDefinition;
import com.flagship.game_economy.scheduling.SimulationClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class CatalogLoaderTest {

    private CatalogLoader loader;

    @BeforeEach
    void setUp() {
        loader = new CatalogLoader(new DefaultResourceLoader(), new JacksonConfig().objectMapper(),
            SimulationClock.fixed(EconomyTestFixture.START));
    }

    @Test
    @DisplayName("the bundled catalog defines the default currencies, rates and shop")
    void loadsBundledCatalog() {
        EconomyCatalog catalog = loader.load("classpath:economy-catalog.json");

        assertEquals(4, catalog.getCurrencies().size());
        Currency gems = catalog.getCurrencies().stream().filter(c -> c.getId().equals("gems")).findFirst().orElseThrow();
        assertTrue(gems.isHardCurrency());
        assertEquals(99_999L, gems.getMaxAmount());
        Currency energy = catalog.getCurrencies().stream().filter(c -> c.getId().equals("energy")).findFirst().orElseThrow();
        assertFalse(energy.isTradeable());
        assertEquals(3, catalog.getExchangeRates().size());
        assertEquals(5, catalog.getShopItems().size());
        ShopItemDefinition starter = catalog.getShopItems().stream()
            .filter(i -> i.getId().equals("starter_pack")).findFirst().orElseThrow();
        assertEquals(1, starter.getConditions().getMaxPerPlayer());
        assertEquals(-1, starter.getMaxPurchases());
    }

    @Test
    @DisplayName("a missing catalog aborts startup")
    void missingCatalog() {
        assertThrows(CatalogException.class, () -> loader.load("classpath:no-such-catalog.json"));
    }

    @Test
    @DisplayName("a shop item priced in an unknown currency is rejected")
    void unknownCostCurrency() {
        String json = """
            {
              "currencies": [ { "id": "coins", "maxAmount": 1000 } ],
              "shopItems": [ { "id": "sword", "costs": [ { "currencyId": "gold", "amount": 5 } ] } ]
            }
            """;

        CatalogException error = assertThrows(CatalogException.class, () -> loader.parse(stream(json)));
        assertTrue(error.getMessage().contains("gold"));
    }

    @Test
    @DisplayName("an exchange rate between unknown currencies is rejected")
    void unknownRateCurrency() {
        String json = """
            {
              "currencies": [ { "id": "coins" } ],
              "exchangeRates": [ { "from": "coins", "to": "gems", "rate": 0.01, "minRate": 0.005, "maxRate": 0.02 } ]
            }
            """;

        assertThrows(CatalogException.class, () -> loader.parse(stream(json)));
    }

    @Test
    @DisplayName("duplicate ids, inverted bounds and non-positive costs are rejected")
    void invalidDefinitions() {
        assertThrows(CatalogException.class, () -> loader.parse(stream(
            "{\"currencies\": [ {\"id\": \"coins\"}, {\"id\": \"coins\"} ]}")));
        assertThrows(CatalogException.class, () -> loader.parse(stream(
            "{\"currencies\": [ {\"id\": \"coins\", \"minAmount\": 10, \"maxAmount\": 5} ]}")));
        assertThrows(CatalogException.class, () -> loader.parse(stream(
            "{\"currencies\": [ {\"id\": \"coins\"} ], "
                + "\"shopItems\": [ {\"id\": \"x\", \"costs\": [ {\"currencyId\": \"coins\", \"amount\": 0} ]} ]}")));
        assertThrows(CatalogException.class, () -> loader.parse(stream("{\"currencies\": []}")));
    }

    @Test
    @DisplayName("defaults apply to omitted fields")
    void defaults() throws Exception {
        EconomyCatalog catalog = loader.parse(stream("""
            {
              "currencies": [ { "id": "coins" } ],
              "shopItems": [ { "id": "x", "costs": [ { "currencyId": "coins", "amount": 3 } ] } ]
            }
            """));

        Currency coins = catalog.getCurrencies().get(0);
        assertTrue(coins.isTradeable());
        assertEquals(0L, coins.getMinAmount());
        assertEquals(Long.MAX_VALUE, coins.getMaxAmount());
        ShopItemDefinition item = catalog.getShopItems().get(0);
        assertTrue(item.isAvailable());
        assertEquals(-1, item.getMaxPurchases());
        assertTrue(item.getRewards().isEmpty());
    }

    private static InputStream stream(String json) {
        return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
    }
}
