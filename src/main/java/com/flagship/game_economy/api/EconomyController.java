package com.flagship.game_economy.api;

import com.flagship.game_economy.api.dto.BalanceResponse;
import com.flagship.game_economy.api.dto.CurrencyAmountRequest;
import com.flagship.game_economy.api.dto.ExchangeRequest;
import com.flagship.game_economy.api.dto.LevelRequest;
import com.flagship.game_economy.api.dto.RewardRequest;
import com.flagship.game_economy.api.dto.TransactionResponse;
import com.flagship.game_economy.inventory.InventoryKind;
import com.flagship.game_economy.inventory.InventoryService;
import com.flagship.game_economy.inventory.InventoryState;
import com.flagship.game_economy.ledger.CurrencyLedger;
import com.flagship.game_economy.pricing.InMemoryPlayerLevels;
import com.flagship.game_economy.profile.PlayerProfileStore;
import com.flagship.game_economy.profile.ProfileEventType;
import com.flagship.game_economy.profile.ProfileSummary;
import com.flagship.game_economy.rewards.RewardGrant;
import com.flagship.game_economy.rewards.RewardService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Player-facing wallet, reward, inventory and profile endpoints.
 */
@RestController
@RequestMapping("/api/players/{playerId}")
@RequiredArgsConstructor
@Slf4j
public class EconomyController {

    private final CurrencyLedger ledger;
    private final RewardService rewards;
    private final InventoryService inventory;
    private final PlayerProfileStore profiles;
    private final InMemoryPlayerLevels levels;

    @GetMapping("/balances")
    public ResponseEntity<BalanceResponse> getBalances(@PathVariable String playerId) {
        return ResponseEntity.ok(balances(playerId, null));
    }

    @PostMapping("/earn")
    public ResponseEntity<BalanceResponse> earn(@PathVariable String playerId,
                                                @Valid @RequestBody CurrencyAmountRequest request) {
        log.info("Earn request: player={}, currency={}, amount={}", playerId, request.getCurrencyId(),
            request.getAmount());
        EconomyRejectionException.unwrap(
            ledger.earn(playerId, request.getCurrencyId(), request.getAmount(), tagOrDefault(request, "api")));
        return ResponseEntity.ok(balances(playerId, null));
    }

    @PostMapping("/spend")
    public ResponseEntity<BalanceResponse> spend(@PathVariable String playerId,
                                                 @Valid @RequestBody CurrencyAmountRequest request) {
        log.info("Spend request: player={}, currency={}, amount={}", playerId, request.getCurrencyId(),
            request.getAmount());
        EconomyRejectionException.unwrap(
            ledger.spend(playerId, request.getCurrencyId(), request.getAmount(), tagOrDefault(request, "api")));
        return ResponseEntity.ok(balances(playerId, null));
    }

    @PostMapping("/exchange")
    public ResponseEntity<BalanceResponse> exchange(@PathVariable String playerId,
                                                    @Valid @RequestBody ExchangeRequest request) {
        log.info("Exchange request: player={}, {} -> {}, amount={}", playerId, request.getFromCurrency(),
            request.getToCurrency(), request.getAmount());
        Long converted = EconomyRejectionException.unwrap(
            ledger.exchange(playerId, request.getFromCurrency(), request.getToCurrency(), request.getAmount()));
        return ResponseEntity.ok(balances(playerId, converted));
    }

    @PostMapping("/rewards")
    public ResponseEntity<RewardGrant> claimReward(@PathVariable String playerId,
                                                   @Valid @RequestBody RewardRequest request) {
        String source = request.getSource() == null || request.getSource().isBlank() ? "api" : request.getSource();
        return ResponseEntity.ok(EconomyRejectionException.unwrap(
            rewards.grantReward(playerId, request.getCurrencyId(), request.getBaseAmount(), source)));
    }

    @GetMapping("/transactions/{currencyId}")
    public ResponseEntity<List<TransactionResponse>> getTransactions(@PathVariable String playerId,
                                                                     @PathVariable String currencyId,
                                                                     @RequestParam(defaultValue = "50") int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return ResponseEntity.ok(ledger.history(playerId, currencyId, limit).stream()
            .map(TransactionResponse::from)
            .toList());
    }

    @GetMapping("/inventory")
    public ResponseEntity<InventoryState> getInventory(@PathVariable String playerId) {
        return ResponseEntity.ok(inventory.contents(playerId));
    }

    @PostMapping("/inventory/{kind}/{id}/consume")
    public ResponseEntity<Map<String, Long>> consume(@PathVariable String playerId,
                                                     @PathVariable InventoryKind kind,
                                                     @PathVariable String id,
                                                     @RequestParam(defaultValue = "1") long quantity) {
        Long remaining = EconomyRejectionException.unwrap(inventory.consume(playerId, kind, id, quantity));
        return ResponseEntity.ok(Map.of("remaining", remaining));
    }

    @PostMapping("/sessions")
    public ResponseEntity<ProfileSummary> recordSession(@PathVariable String playerId) {
        profiles.recordEvent(playerId, ProfileEventType.ACTIVITY, 0, Map.of());
        return getProfile(playerId);
    }

    @PutMapping("/level")
    public ResponseEntity<Map<String, Integer>> reportLevel(@PathVariable String playerId,
                                                            @Valid @RequestBody LevelRequest request) {
        log.info("Level report: player={}, level={}", playerId, request.getLevel());
        levels.setLevel(playerId, request.getLevel());
        return ResponseEntity.ok(Map.of("level", levels.levelOf(playerId)));
    }

    @GetMapping("/level")
    public ResponseEntity<Map<String, Integer>> getLevel(@PathVariable String playerId) {
        return ResponseEntity.ok(Map.of("level", levels.levelOf(playerId)));
    }

    @GetMapping("/profile")
    public ResponseEntity<ProfileSummary> getProfile(@PathVariable String playerId) {
        return profiles.summary(playerId)
            .map(ResponseEntity::ok)
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    private BalanceResponse balances(String playerId, Long convertedAmount) {
        return BalanceResponse.builder()
            .playerId(playerId)
            .balances(ledger.balances(playerId))
            .convertedAmount(convertedAmount)
            .build();
    }

    private static String tagOrDefault(CurrencyAmountRequest request, String fallback) {
        return request.getTag() == null || request.getTag().isBlank() ? fallback : request.getTag();
    }
}
