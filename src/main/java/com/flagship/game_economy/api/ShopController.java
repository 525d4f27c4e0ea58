package com.flagship.game_economy.api;

import com.flagship.game_economy.api.dto.DiscountRequest;
import com.flagship.game_economy.api.dto.PlayerRequest;
import com.flagship.game_economy.common.EconomyError;
import com.flagship.game_economy.personalization.PersonalizedOfferService;
import com.flagship.game_economy.pricing.DiscountWindow;
import com.flagship.game_economy.pricing.DynamicPricingEngine;
import com.flagship.game_economy.pricing.PurchaseReceipt;
import com.flagship.game_economy.pricing.ShopItemView;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/shop")
@RequiredArgsConstructor
@Slf4j
public class ShopController {

    private final DynamicPricingEngine pricing;
    private final PersonalizedOfferService offers;

    /**
     * Lists the shop. With a player, only items that player may buy now, in
     * presentation order.
     */
    @GetMapping("/items")
    public ResponseEntity<List<ShopItemView>> listItems(@RequestParam(required = false) String playerId) {
        if (playerId == null || playerId.isBlank()) {
            return ResponseEntity.ok(pricing.allItems());
        }
        return ResponseEntity.ok(pricing.availableItems(playerId));
    }

    @GetMapping("/items/{itemId}")
    public ResponseEntity<ShopItemView> getItem(@PathVariable String itemId) {
        return pricing.item(itemId)
            .map(ResponseEntity::ok)
            .orElseThrow(() -> new EconomyRejectionException(EconomyError.ITEM_UNKNOWN, "Unknown item " + itemId));
    }

    @GetMapping("/categories/{category}")
    public ResponseEntity<List<ShopItemView>> listCategory(@PathVariable String category) {
        return ResponseEntity.ok(pricing.itemsByCategory(category));
    }

    @PostMapping("/items/{itemId}/purchase")
    public ResponseEntity<PurchaseReceipt> purchase(@PathVariable String itemId,
                                                    @Valid @RequestBody PlayerRequest request) {
        log.info("Purchase request: item={}, player={}", itemId, request.getPlayerId());
        PurchaseReceipt receipt = EconomyRejectionException.unwrap(pricing.purchase(itemId, request.getPlayerId()));
        return ResponseEntity.status(HttpStatus.CREATED).body(receipt);
    }

    @PostMapping("/items/{itemId}/discounts")
    public ResponseEntity<DiscountWindow> applyDiscount(@PathVariable String itemId,
                                                       @Valid @RequestBody DiscountRequest request) {
        int maxPurchases = request.getMaxPurchases() == null ? 0 : request.getMaxPurchases();
        DiscountWindow window = EconomyRejectionException.unwrap(
            pricing.applyTimedDiscount(itemId, request.getPercentage(), request.getDurationHours(), maxPurchases));
        return ResponseEntity.status(HttpStatus.CREATED).body(window);
    }

    @PostMapping("/items/{itemId}/personalized-offer")
    public ResponseEntity<DiscountWindow> requestOffer(@PathVariable String itemId,
                                                       @Valid @RequestBody PlayerRequest request) {
        if (!pricing.containsItem(itemId)) {
            throw new EconomyRejectionException(EconomyError.ITEM_UNKNOWN, "Unknown item " + itemId);
        }
        return offers.requestOffer(request.getPlayerId(), itemId)
            .map(window -> ResponseEntity.status(HttpStatus.CREATED).body(window))
            .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
