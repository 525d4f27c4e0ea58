package com.flagship.game_economy.snapshot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flagship.game_economy.EconomyTestFixture;
import com.flagship.game_economy.config.JacksonConfig;
import com.flagship.game_economy.inventory.InventoryKind;
import com.flagship.game_economy.pricing.ShopItemDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashSet;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Save and load of the whole economy: a restored economy must be
 * indistinguishable from the one that was saved, and a damaged snapshot
 * must be rejected without touching live state.
 */
class EconomySnapshotServiceTest {

    private static final String PLAYER = "player-1";

    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();

    private EconomyTestFixture source;
    private EconomySnapshotService sourceSnapshots;
    private EconomyTestFixture target;
    private EconomySnapshotService targetSnapshots;

    @BeforeEach
    void setUp() {
        source = new EconomyTestFixture(sword());
        sourceSnapshots = snapshots(source);
        target = new EconomyTestFixture(sword());
        targetSnapshots = snapshots(target);

        for (int i = 0; i < 8; i++) {
            source.ledger.earn(PLAYER, "coins", 250, "quest");
        }
        source.ledger.earn(PLAYER, "gems", 50, "gift");
        source.ledger.spend(PLAYER, "gems", 30, "skip_timer");
        source.ledger.exchange(PLAYER, "coins", "gems", 500);
        source.pricing.purchase("sword", PLAYER);
        source.ledger.spend(PLAYER, "coins", 100, "repair");
        source.inflation.runCycle(1);
        source.pricing.applyTimedDiscount("sword", 50, 6, 5);
        source.dispatcher.dispatchAll();
    }

    @Test
    @DisplayName("a restored economy matches the saved one")
    void roundTrip() {
        String json = sourceSnapshots.serialize();

        targetSnapshots.deserialize(json);

        assertEquals(source.ledger.balances(PLAYER), target.ledger.balances(PLAYER));
        assertEquals(source.ledger.history(PLAYER, "coins", 100), target.ledger.history(PLAYER, "coins", 100));
        assertEquals(source.ledger.history(PLAYER, "gems", 100), target.ledger.history(PLAYER, "gems", 100));
        assertEquals(source.ledger.totalSpent(PLAYER, "gems"), target.ledger.totalSpent(PLAYER, "gems"));
        assertEquals(source.profiles.get(PLAYER), target.profiles.get(PLAYER));
        assertEquals(new HashSet<>(source.rates.all()), new HashSet<>(target.rates.all()));
        assertEquals(source.inflation.allMultipliers(), target.inflation.allMultipliers());
        assertEquals(source.pricing.sinkMultiplier("coins"), target.pricing.sinkMultiplier("coins"));
        assertEquals(source.pricing.item("sword"), target.pricing.item("sword"));
        assertEquals(1L, target.pricing.purchaseCount(PLAYER, "sword"));
        assertEquals(1L, target.inventory.quantity(PLAYER, InventoryKind.ITEM, "sword"));
    }

    @Test
    @DisplayName("a discount restored from a snapshot still reverts to the original cost")
    void restoredDiscountReverts() {
        targetSnapshots.deserialize(sourceSnapshots.serialize());
        assertEquals(50L, target.pricing.item("sword").orElseThrow().getPrices().get(0).getListedAmount());

        target.clock.advance(Duration.ofHours(6));
        target.pricing.expireDiscounts();

        assertEquals(100L, target.pricing.item("sword").orElseThrow().getPrices().get(0).getListedAmount());
    }

    @Test
    @DisplayName("the snapshot is versioned JSON with ISO-8601 instants")
    void snapshotFormat() throws Exception {
        ObjectNode root = (ObjectNode) objectMapper.readTree(sourceSnapshots.serialize());

        assertEquals(EconomySnapshotService.CURRENT_VERSION, root.get("version").asInt());
        assertEquals(EconomyTestFixture.START.toString(), root.get("createdAt").asText());
        assertEquals(1, root.get("wallets").size());
    }

    @Nested
    @DisplayName("corrupted snapshots")
    class Corrupted {

        @BeforeEach
        void seedTarget() {
            target.ledger.earn("resident", "coins", 42, "quest");
        }

        @Test
        @DisplayName("empty or unparseable input is rejected")
        void unparseable() {
            assertThrows(SnapshotCorruptedException.class, () -> targetSnapshots.deserialize(""));
            assertThrows(SnapshotCorruptedException.class, () -> targetSnapshots.deserialize("{\"version\": "));
            assertThrows(SnapshotCorruptedException.class, () -> targetSnapshots.deserialize("[1, 2, 3]"));
            assertUntouched();
        }

        @Test
        @DisplayName("an unsupported version is rejected")
        void unsupportedVersion() {
            assertRejected(root -> root.put("version", 99));
        }

        @Test
        @DisplayName("a missing section is rejected")
        void missingSection() {
            assertRejected(root -> root.putNull("wallets"));
        }

        @Test
        @DisplayName("a balance above the currency maximum is rejected")
        void balanceOutOfBounds() {
            assertRejected(root -> ((ObjectNode) wallet(root).get("balances")).put("energy", 31));
        }

        @Test
        @DisplayName("an unregistered currency is rejected")
        void unknownCurrency() {
            assertRejected(root -> ((ObjectNode) wallet(root).get("balances")).put("doubloons", 5));
        }

        @Test
        @DisplayName("an exchange rate outside its band is rejected")
        void rateOutOfBand() {
            assertRejected(root -> ((ObjectNode) root.get("exchangeRates").get(0)).put("rate", 1000.0));
        }

        @Test
        @DisplayName("a multiplier outside the band is rejected")
        void multiplierOutOfBand() {
            assertRejected(root -> ((ObjectNode) root.get("multipliers").get("coins")).put("sink", 5.0));
        }

        @Test
        @DisplayName("state for a shop item missing from the catalog is rejected")
        void unknownShopItem() {
            assertRejected(root -> ((ObjectNode) root.get("shopItems").get(0)).put("itemId", "dragon"));
        }

        private void assertRejected(Consumer<ObjectNode> damage) {
            String json;
            try {
                ObjectNode root = (ObjectNode) objectMapper.readTree(sourceSnapshots.serialize());
                damage.accept(root);
                json = objectMapper.writeValueAsString(root);
            } catch (Exception e) {
                throw new AssertionError("could not prepare damaged snapshot", e);
            }

            assertThrows(SnapshotCorruptedException.class, () -> targetSnapshots.deserialize(json));
            assertUntouched();
        }

        private void assertUntouched() {
            assertEquals(42L, target.ledger.getBalance("resident", "coins"));
            assertEquals(0L, target.ledger.getBalance(PLAYER, "coins"));
            assertEquals(100L, target.pricing.item("sword").orElseThrow().getPrices().get(0).getListedAmount());
        }

        private ObjectNode wallet(ObjectNode root) {
            ArrayNode wallets = (ArrayNode) root.get("wallets");
            return (ObjectNode) wallets.get(0);
        }
    }

    private EconomySnapshotService snapshots(EconomyTestFixture economy) {
        return new EconomySnapshotService(objectMapper, economy.registry, economy.ledger, economy.rates,
            economy.inflation, economy.multipliers, economy.profiles, economy.pricing, economy.inventory,
            economy.clock);
    }

    private static ShopItemDefinition sword() {
        return EconomyTestFixture.item("sword", "coins", 100).build();
    }
}
