package com.flagship.game_economy;

import com.flagship.game_economy.config.EconomyProperties;
import com.flagship.game_economy.consumer.EconomyAnalyticsConsumer;
import com.flagship.game_economy.consumer.IdempotentEventProcessor;
import com.flagship.game_economy.consumer.ProfileEventConsumer;
import com.flagship.game_economy.currency.Currency;
import com.flagship.game_economy.currency.CurrencyRegistry;
import com.flagship.game_economy.currency.ExchangeRate;
import com.flagship.game_economy.currency.ExchangeRateBook;
import com.flagship.game_economy.eventbus.EconomyEventBus;
import com.flagship.game_economy.eventbus.EventDispatcher;
import com.flagship.game_economy.inflation.EconomyMultipliers;
import com.flagship.game_economy.inflation.InflationController;
import com.flagship.game_economy.inflation.SeededRateDrift;
import com.flagship.game_economy.inventory.InventoryService;
import com.flagship.game_economy.ledger.CurrencyFlowLog;
import com.flagship.game_economy.ledger.CurrencyLedger;
import com.flagship.game_economy.observability.EconomyMetrics;
import com.flagship.game_economy.pricing.DynamicPricingEngine;
import com.flagship.game_economy.pricing.InMemoryPlayerLevels;
import com.flagship.game_economy.pricing.PurchaseConditions;
import com.flagship.game_economy.pricing.RewardType;
import com.flagship.game_economy.pricing.ShopCatalog;
import com.flagship.game_economy.pricing.ShopItemCost;
import com.flagship.game_economy.pricing.ShopItemDefinition;
import com.flagship.game_economy.pricing.ShopReward;
import com.flagship.game_economy.profile.PlayerProfileStore;
import com.flagship.game_economy.rewards.RewardService;
import com.flagship.game_economy.scheduling.EconomyTicker;
import com.flagship.game_economy.scheduling.SimulationClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Instant;
import java.util.List;

/**
 * Wires the economy by hand on a frozen simulation clock, the same way the
 * Spring context does, so unit tests can drive every component directly.
 */
public class EconomyTestFixture {

    public static final Instant START = Instant.parse("2026-01-05T00:00:00Z");

    public final SimulationClock clock = SimulationClock.fixed(START);
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final EconomyMetrics metrics = new EconomyMetrics(meterRegistry);
    public final EconomyProperties properties;
    public final CurrencyRegistry registry;
    public final ExchangeRateBook rates;
    public final CurrencyFlowLog flowLog;
    public final EconomyEventBus eventBus;
    public final CurrencyLedger ledger;
    public final InventoryService inventory = new InventoryService();
    public final InMemoryPlayerLevels levels = new InMemoryPlayerLevels();
    public final DynamicPricingEngine pricing;
    public final RewardService rewards;
    public final EconomyMultipliers multipliers;
    public final InflationController inflation;
    public final PlayerProfileStore profiles;
    public final EconomyAnalyticsConsumer analytics = new EconomyAnalyticsConsumer();
    public final IdempotentEventProcessor processor = new IdempotentEventProcessor();
    public final EventDispatcher dispatcher;
    public final EconomyTicker ticker;

    public EconomyTestFixture(ShopItemDefinition... items) {
        this(new EconomyProperties(), items);
    }

    public EconomyTestFixture(EconomyProperties properties, ShopItemDefinition... items) {
        this.properties = properties;
        this.registry = new CurrencyRegistry(defaultCurrencies());
        this.rates = new ExchangeRateBook(defaultRates());
        this.flowLog = new CurrencyFlowLog(properties);
        this.eventBus = new EconomyEventBus(clock);
        this.ledger = new CurrencyLedger(registry, rates, flowLog, eventBus, metrics, clock, properties);
        this.pricing = new DynamicPricingEngine(new ShopCatalog(List.of(items)), registry, ledger, inventory, levels,
            eventBus, metrics, clock);
        this.rewards = new RewardService(ledger, eventBus, clock);
        this.multipliers = new EconomyMultipliers(properties.getInflation().getMinMultiplier(),
            properties.getInflation().getMaxMultiplier());
        this.inflation = new InflationController(registry, rates, flowLog, multipliers,
            new SeededRateDrift(properties.getInflation().getDriftSeed(), properties.getInflation().getMaxRateDrift()),
            List.of(pricing, rewards), metrics, clock, properties);
        this.profiles = new PlayerProfileStore(clock, properties);
        this.dispatcher = new EventDispatcher(eventBus, List.of(new ProfileEventConsumer(profiles), analytics),
            processor, metrics, 500, 5);
        this.ticker = new EconomyTicker(dispatcher, pricing, inflation, profiles);
    }

    public static List<Currency> defaultCurrencies() {
        return List.of(
            currency("coins", false, true, 999_999),
            currency("gems", true, true, 99_999),
            currency("energy", false, false, 30),
            currency("stars", false, true, 9_999));
    }

    public static List<ExchangeRate> defaultRates() {
        return List.of(
            ExchangeRate.of("coins", "gems", 0.01, 0.005, 0.02, true, START),
            ExchangeRate.of("gems", "coins", 100, 50, 200, true, START),
            ExchangeRate.of("stars", "coins", 10, 5, 20, true, START));
    }

    /**
     * An available, uncapped item with a single cost that grants one unit of itself.
     */
    public static ShopItemDefinition.ShopItemDefinitionBuilder item(String id, String currencyId, long amount) {
        return ShopItemDefinition.builder()
            .id(id)
            .name(id)
            .description("test item " + id)
            .category("test")
            .costs(List.of(new ShopItemCost(currencyId, amount)))
            .rewards(List.of(new ShopReward(RewardType.ITEM, id, 1)))
            .conditions(PurchaseConditions.unrestricted())
            .available(true)
            .maxPurchases(-1);
    }

    private static Currency currency(String id, boolean hard, boolean tradeable, long max) {
        return Currency.builder()
            .id(id)
            .displayName(id)
            .symbol(id.substring(0, 1).toUpperCase())
            .hardCurrency(hard)
            .tradeable(tradeable)
            .minAmount(0)
            .maxAmount(max)
            .build();
    }
}
