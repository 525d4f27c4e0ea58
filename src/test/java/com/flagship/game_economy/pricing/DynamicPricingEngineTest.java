package com.flagship.game_economy.pricing;

import com.flagship.game_economy.EconomyTestFixture;
import com.flagship.game_economy.RecordingSubscriber;
import com.flagship.game_economy.common.EconomyError;
import com.flagship.game_economy.common.EconomyResult;
import com.flagship.game_economy.consumer.IdempotentEventProcessor;
import com.flagship.game_economy.event.CurrencySpentEvent;
import com.flagship.game_economy.event.DiscountEndedEvent;
import com.flagship.game_economy.event.ItemPurchasedEvent;
import com.flagship.game_economy.eventbus.EventDispatcher;
import com.flagship.game_economy.inventory.InventoryKind;
import com.flagship.game_economy.ledger.CurrencyLedger;
import com.flagship.game_economy.ledger.Transaction;
import com.flagship.game_economy.profile.PlayerEconomicProfile;
import com.flagship.game_economy.profile.PlayerSegment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.spy;

/**
 * Purchases are all-or-nothing and discounts always revert to the exact
 * original price.
 */
class DynamicPricingEngineTest {

    private static final String PLAYER = "player-1";

    private EconomyTestFixture economy;
    private DynamicPricingEngine shop;

    @BeforeEach
    void setUp() {
        economy = new EconomyTestFixture(
            EconomyTestFixture.item("gem_pack", "gems", 20)
                .category("bundles")
                .rewards(List.of(new ShopReward(RewardType.CURRENCY, "coins", 500),
                    new ShopReward(RewardType.BOOSTER, "double_xp", 1)))
                .build(),
            EconomyTestFixture.item("sword", "coins", 100).displayOrder(3).build(),
            EconomyTestFixture.item("shield", "coins", 80).displayOrder(2).popular(true).build(),
            EconomyTestFixture.item("helmet", "coins", 60).displayOrder(9).recommended(true).build(),
            EconomyTestFixture.item("crown", "coins", 100)
                .costs(List.of(new ShopItemCost("coins", 100), new ShopItemCost("stars", 10)))
                .build(),
            EconomyTestFixture.item("twin_gems", "gems", 10)
                .costs(List.of(new ShopItemCost("gems", 10), new ShopItemCost("gems", 10)))
                .build(),
            EconomyTestFixture.item("veteran_pack", "coins", 10)
                .conditions(new PurchaseConditions(5, 10, 1))
                .build(),
            EconomyTestFixture.item("limited", "coins", 10).maxPurchases(1).build(),
            EconomyTestFixture.item("retired", "coins", 10).available(false).build(),
            EconomyTestFixture.item("flash_sale", "coins", 10)
                .availableUntil(EconomyTestFixture.START.plus(Duration.ofHours(1)))
                .build());
        shop = economy.pricing;
    }

    @Nested
    @DisplayName("purchase")
    class Purchase {

        @Test
        @DisplayName("an unaffordable purchase changes nothing")
        void insufficientFundsChangesNothing() {
            economy.ledger.earn(PLAYER, "gems", 15, "gift");
            int pendingBefore = economy.eventBus.pendingCount();

            EconomyResult<PurchaseReceipt> result = shop.purchase("gem_pack", PLAYER);

            assertTrue(result.isRejectedWith(EconomyError.INSUFFICIENT_FUNDS));
            assertEquals(15L, economy.ledger.getBalance(PLAYER, "gems"));
            assertEquals(0L, economy.ledger.getBalance(PLAYER, "coins"));
            assertEquals(0L, shop.purchaseCount(PLAYER, "gem_pack"));
            assertEquals(0L, shop.item("gem_pack").orElseThrow().getCurrentPurchases());
            assertEquals(0L, economy.inventory.quantity(PLAYER, InventoryKind.BOOSTER, "double_xp"));
            assertEquals(pendingBefore, economy.eventBus.pendingCount());
        }

        @Test
        @DisplayName("a successful purchase pays every cost and grants every reward")
        void successfulPurchase() {
            economy.ledger.earn(PLAYER, "gems", 25, "gift");

            EconomyResult<PurchaseReceipt> result = shop.purchase("gem_pack", PLAYER);

            assertTrue(result.isSuccess());
            assertEquals(List.of(new ShopItemCost("gems", 20)), result.getValue().getPaid());
            assertFalse(result.getValue().isDiscounted());
            assertEquals(5L, economy.ledger.getBalance(PLAYER, "gems"));
            assertEquals(500L, economy.ledger.getBalance(PLAYER, "coins"));
            assertEquals(1L, economy.inventory.quantity(PLAYER, InventoryKind.BOOSTER, "double_xp"));
            assertEquals(1L, shop.purchaseCount(PLAYER, "gem_pack"));

            RecordingSubscriber recorder = dispatchToRecorder();
            ItemPurchasedEvent purchased = recorder.received().stream()
                .filter(e -> e.getEventType().equals(ItemPurchasedEvent.EVENT_TYPE))
                .map(ItemPurchasedEvent.class::cast)
                .findFirst()
                .orElseThrow();
            assertEquals(20L, purchased.getHardCurrencySpent());
            assertEquals("bundles", purchased.getCategory());
        }

        @Test
        @DisplayName("a cost that fails midway refunds the costs already paid")
        void midwayFailureIsCompensated() {
            CurrencyLedger flakyLedger = spy(economy.ledger);
            doReturn(EconomyResult.rejected(EconomyError.INSUFFICIENT_FUNDS, "stars ledger unavailable"))
                .when(flakyLedger).spend(eq(PLAYER), eq("stars"), anyLong(), anyString());
            DynamicPricingEngine flakyShop = new DynamicPricingEngine(
                new ShopCatalog(List.of(EconomyTestFixture.item("crown", "coins", 100)
                    .costs(List.of(new ShopItemCost("coins", 100), new ShopItemCost("stars", 10)))
                    .build())),
                economy.registry, flakyLedger, economy.inventory, economy.levels, economy.eventBus,
                economy.metrics, economy.clock);
            economy.ledger.earn(PLAYER, "coins", 200, "quest");
            economy.ledger.earn(PLAYER, "stars", 20, "level");

            EconomyResult<PurchaseReceipt> result = flakyShop.purchase("crown", PLAYER);

            assertTrue(result.isRejectedWith(EconomyError.PURCHASE_COST_FAILURE));
            assertEquals(200L, economy.ledger.getBalance(PLAYER, "coins"));
            assertEquals(20L, economy.ledger.getBalance(PLAYER, "stars"));
            assertEquals(0L, economy.inventory.quantity(PLAYER, InventoryKind.ITEM, "crown"));
            assertEquals(0L, flakyShop.purchaseCount(PLAYER, "crown"));
            Transaction refund = economy.ledger.history(PLAYER, "coins", 1).get(0);
            assertTrue(refund.isCompensation());
            assertEquals("refund_purchase_crown", refund.getTag());

            assertEquals(0L, economy.ledger.totalSpent(PLAYER, "coins"));
            assertEquals(1, economy.flowLog.size("coins"));
            RecordingSubscriber recorder = dispatchToRecorder();
            assertFalse(recorder.types().contains(CurrencySpentEvent.EVENT_TYPE));
            assertFalse(recorder.types().contains(ItemPurchasedEvent.EVENT_TYPE));
        }

        @Test
        @DisplayName("costs in the same currency are checked together and a denial leaves no spend behind")
        void repeatedCurrencyCostsCheckedTogether() {
            economy.ledger.earn(PLAYER, "gems", 15, "gift");

            EconomyResult<PurchaseReceipt> result = shop.purchase("twin_gems", PLAYER);

            assertTrue(result.isRejectedWith(EconomyError.INSUFFICIENT_FUNDS));
            assertEquals(15L, economy.ledger.getBalance(PLAYER, "gems"));
            assertEquals(1, economy.flowLog.size("gems"));
            assertEquals(0L, economy.ledger.totalSpent(PLAYER, "gems"));

            economy.dispatcher.dispatchAll();
            PlayerEconomicProfile profile = economy.profiles.get(PLAYER).orElseThrow();
            assertEquals(0L, profile.getTotalSpent());
            assertEquals(PlayerSegment.NEW, profile.getSegment());

            economy.ledger.earn(PLAYER, "gems", 5, "gift");
            assertTrue(shop.purchase("twin_gems", PLAYER).isSuccess());
            assertEquals(0L, economy.ledger.getBalance(PLAYER, "gems"));
        }

        @Test
        @DisplayName("a purchase after the discount window ends pays the original price without a sweep")
        void expiredDiscountNotChargedBeforeSweep() {
            economy.ledger.earn(PLAYER, "coins", 1000, "quest");
            shop.applyTimedDiscount("sword", 50, 1, 0);
            assertEquals(50L, listed("sword"));

            economy.clock.advance(Duration.ofHours(2));
            EconomyResult<PurchaseReceipt> result = shop.purchase("sword", PLAYER);

            assertTrue(result.isSuccess());
            assertFalse(result.getValue().isDiscounted());
            assertEquals(100L, result.getValue().getPaid().get(0).getAmount());
            assertEquals(900L, economy.ledger.getBalance(PLAYER, "coins"));
            assertEquals(0, shop.expireDiscounts());
            RecordingSubscriber recorder = dispatchToRecorder();
            DiscountEndedEvent ended = recorder.received().stream()
                .filter(e -> e.getEventType().equals(DiscountEndedEvent.EVENT_TYPE))
                .map(DiscountEndedEvent.class::cast)
                .findFirst()
                .orElseThrow();
            assertEquals(DiscountEndedEvent.REASON_EXPIRED, ended.getReason());
        }

        @Test
        @DisplayName("the charged price follows the sink multiplier, never below one unit")
        void chargedPriceFollowsSinkMultiplier() {
            economy.ledger.earn(PLAYER, "coins", 1000, "quest");
            shop.onSinkMultiplier("coins", 1.5);

            PriceQuote quote = shop.item("sword").orElseThrow().getPrices().get(0);
            EconomyResult<PurchaseReceipt> result = shop.purchase("sword", PLAYER);

            assertEquals(100L, quote.getListedAmount());
            assertEquals(150L, quote.getChargedAmount());
            assertEquals(150L, result.getValue().getPaid().get(0).getAmount());
            assertEquals(850L, economy.ledger.getBalance(PLAYER, "coins"));

            shop.onSinkMultiplier("coins", 0.001);
            assertEquals(1L, shop.item("sword").orElseThrow().getPrices().get(0).getChargedAmount());
        }
    }

    @Nested
    @DisplayName("eligibility")
    class Eligibility {

        @Test
        @DisplayName("unknown items are reported as unknown")
        void unknownItem() {
            assertTrue(shop.purchase("dragon", PLAYER).isRejectedWith(EconomyError.ITEM_UNKNOWN));
            assertFalse(shop.canPurchase("dragon", PLAYER));
        }

        @Test
        @DisplayName("unavailable, expired, sold-out and level-gated items are rejected")
        void unavailableItems() {
            economy.ledger.earn(PLAYER, "coins", 1000, "quest");

            assertTrue(shop.purchase("retired", PLAYER).isRejectedWith(EconomyError.ITEM_UNAVAILABLE));
            assertTrue(shop.purchase("veteran_pack", PLAYER).isRejectedWith(EconomyError.ITEM_UNAVAILABLE));

            assertTrue(shop.purchase("limited", PLAYER).isSuccess());
            assertTrue(shop.purchase("limited", "player-2").isRejectedWith(EconomyError.ITEM_UNAVAILABLE));

            assertTrue(shop.canPurchase("flash_sale", PLAYER));
            economy.clock.advance(Duration.ofHours(1));
            assertTrue(shop.purchase("flash_sale", PLAYER).isRejectedWith(EconomyError.ITEM_UNAVAILABLE));
            assertEquals(1000L - 10L, economy.ledger.getBalance(PLAYER, "coins"));
        }

        @Test
        @DisplayName("the per-player cap applies per player")
        void perPlayerCap() {
            economy.levels.setLevel(PLAYER, 7);
            economy.levels.setLevel("player-2", 7);
            economy.ledger.earn(PLAYER, "coins", 100, "quest");
            economy.ledger.earn("player-2", "coins", 100, "quest");

            assertTrue(shop.purchase("veteran_pack", PLAYER).isSuccess());
            assertTrue(shop.purchase("veteran_pack", PLAYER).isRejectedWith(EconomyError.ITEM_UNAVAILABLE));
            assertTrue(shop.purchase("veteran_pack", "player-2").isSuccess());
        }

        @Test
        @DisplayName("the listing shows only purchasable items, recommended then popular then display order")
        void listingOrder() {
            List<String> ids = shop.availableItems(PLAYER).stream().map(ShopItemView::getId).toList();

            assertEquals("helmet", ids.get(0));
            assertEquals("shield", ids.get(1));
            assertFalse(ids.contains("retired"));
            assertFalse(ids.contains("veteran_pack"));
            assertTrue(ids.indexOf("sword") > ids.indexOf("shield"));
            assertEquals(List.of("gem_pack"),
                shop.itemsByCategory("BUNDLES").stream().map(ShopItemView::getId).toList());
        }
    }

    @Nested
    @DisplayName("timed discounts")
    class Discounts {

        @Test
        @DisplayName("expiry restores the exact original cost")
        void expiryRestoresOriginal() {
            EconomyResult<DiscountWindow> applied = shop.applyTimedDiscount("sword", 33, 2, 0);

            assertTrue(applied.isSuccess());
            assertEquals(67L, listed("sword"));
            assertEquals(100L, shop.item("sword").orElseThrow().getPrices().get(0).getOriginalAmount());

            economy.clock.advance(Duration.ofMinutes(119));
            assertEquals(0, shop.expireDiscounts());
            economy.clock.advance(Duration.ofMinutes(1));
            assertEquals(1, shop.expireDiscounts());

            assertEquals(100L, listed("sword"));
            assertNull(shop.item("sword").orElseThrow().getDiscountPercentage());
        }

        @Test
        @DisplayName("a cap of zero leaves the discount uncapped")
        void zeroCapIsUncapped() {
            economy.ledger.earn(PLAYER, "coins", 1000, "quest");
            DiscountWindow window = shop.applyTimedDiscount("sword", 50, 2, 0).getValue();
            assertFalse(window.capReached());

            for (int i = 0; i < 3; i++) {
                assertTrue(shop.purchase("sword", PLAYER).getValue().isDiscounted());
            }

            assertEquals(50L, listed("sword"));
            assertEquals(850L, economy.ledger.getBalance(PLAYER, "coins"));
        }

        @Test
        @DisplayName("listings and exports drop an ended window before the sweep runs")
        void endedWindowHiddenFromReads() {
            shop.applyTimedDiscount("shield", 25, 1, 0);
            economy.clock.advance(Duration.ofHours(1));

            ShopItemView view = shop.item("shield").orElseThrow();
            assertEquals(80L, view.getPrices().get(0).getListedAmount());
            assertNull(view.getDiscountPercentage());
            ShopItemState exported = shop.exportItemStates().stream()
                .filter(state -> state.getItemId().equals("shield"))
                .findFirst()
                .orElseThrow();
            assertNull(exported.getDiscount());
            assertEquals(80L, exported.getCurrentCosts().get(0).getAmount());
        }

        @Test
        @DisplayName("a replacing discount is computed from the original, not the discounted price")
        void replacementUsesOriginal() {
            shop.applyTimedDiscount("sword", 50, 2, 0);
            shop.applyTimedDiscount("sword", 20, 2, 0);

            assertEquals(80L, listed("sword"));

            economy.clock.advance(Duration.ofHours(2));
            shop.expireDiscounts();
            assertEquals(100L, listed("sword"));
        }

        @Test
        @DisplayName("a discount ends early once its purchase cap is reached")
        void capReachedReverts() {
            economy.ledger.earn(PLAYER, "coins", 1000, "quest");
            shop.applyTimedDiscount("sword", 50, 24, 1);

            EconomyResult<PurchaseReceipt> first = shop.purchase("sword", PLAYER);
            EconomyResult<PurchaseReceipt> second = shop.purchase("sword", PLAYER);

            assertTrue(first.getValue().isDiscounted());
            assertEquals(50L, first.getValue().getPaid().get(0).getAmount());
            assertFalse(second.getValue().isDiscounted());
            assertEquals(100L, second.getValue().getPaid().get(0).getAmount());
            assertEquals(100L, listed("sword"));

            RecordingSubscriber recorder = dispatchToRecorder();
            DiscountEndedEvent ended = recorder.received().stream()
                .filter(e -> e.getEventType().equals(DiscountEndedEvent.EVENT_TYPE))
                .map(DiscountEndedEvent.class::cast)
                .findFirst()
                .orElseThrow();
            assertEquals(DiscountEndedEvent.REASON_CAP_REACHED, ended.getReason());
        }

        @Test
        @DisplayName("deep discounts never price an item below one unit")
        void discountFloor() {
            shop.applyTimedDiscount("limited", 99.9, 1, 0);

            assertEquals(1L, listed("limited"));
        }

        @Test
        @DisplayName("out-of-range discounts are rejected")
        void rejectsInvalidDiscounts() {
            assertTrue(shop.applyTimedDiscount("sword", 0, 2, 0).isRejectedWith(EconomyError.INVALID_AMOUNT));
            assertTrue(shop.applyTimedDiscount("sword", 100, 2, 0).isRejectedWith(EconomyError.INVALID_AMOUNT));
            assertTrue(shop.applyTimedDiscount("sword", 10, 0, 0).isRejectedWith(EconomyError.INVALID_AMOUNT));
            assertTrue(shop.applyTimedDiscount("dragon", 10, 2, 0).isRejectedWith(EconomyError.ITEM_UNKNOWN));
            assertEquals(100L, listed("sword"));
        }

        @Test
        @DisplayName("multi-cost items discount and restore every cost line")
        void multiCostDiscount() {
            shop.applyTimedDiscount("crown", 25, 1, 0);
            assertEquals(List.of(75L, 8L), listedAll("crown"));

            economy.clock.advance(Duration.ofHours(1));
            shop.expireDiscounts();
            assertEquals(List.of(100L, 10L), listedAll("crown"));
        }
    }

    private long listed(String itemId) {
        return shop.item(itemId).orElseThrow().getPrices().get(0).getListedAmount();
    }

    private List<Long> listedAll(String itemId) {
        return shop.item(itemId).orElseThrow().getPrices().stream().map(PriceQuote::getListedAmount).toList();
    }

    private RecordingSubscriber dispatchToRecorder() {
        RecordingSubscriber recorder = new RecordingSubscriber("recorder");
        new EventDispatcher(economy.eventBus, List.of(recorder), new IdempotentEventProcessor(), economy.metrics,
            500, 3).dispatchAll();
        return recorder;
    }
}
