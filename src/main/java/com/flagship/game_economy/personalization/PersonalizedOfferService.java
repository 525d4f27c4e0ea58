package com.flagship.game_economy.personalization;

import com.flagship.game_economy.common.EconomyResult;
import com.flagship.game_economy.config.EconomyProperties;
import com.flagship.game_economy.currency.Currency;
import com.flagship.game_economy.ledger.CurrencyLedger;
import com.flagship.game_economy.pricing.DiscountWindow;
import com.flagship.game_economy.pricing.DynamicPricingEngine;
import com.flagship.game_economy.profile.PlayerProfileStore;
import com.flagship.game_economy.profile.PlayerSegment;
import com.flagship.game_economy.profile.ProfileSummary;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Asks the personalization service for a price suggestion and turns a
 * price cut into a timed discount.
 *
 * The remote answer never bypasses the shop's own rules: the discount goes
 * through {@link DynamicPricingEngine#applyTimedDiscount}, is capped at
 * {@code max-personalized-discount-percent}, and purchases still check
 * eligibility and affordability. Suggestions to raise prices, timeouts and
 * remote failures are ignored.
 */
@Service
@Slf4j
public class PersonalizedOfferService {

    static final String ACTION_OFFER = "offer";

    private final PersonalizationClient client;
    private final PlayerProfileStore profiles;
    private final CurrencyLedger ledger;
    private final DynamicPricingEngine pricing;
    private final EconomyProperties.Pricing settings;
    private final ExecutorService executor = Executors.newFixedThreadPool(2, runnable -> {
        Thread thread = new Thread(runnable, "personalization-client");
        thread.setDaemon(true);
        return thread;
    });

    public PersonalizedOfferService(PersonalizationClient client,
                                    PlayerProfileStore profiles,
                                    CurrencyLedger ledger,
                                    DynamicPricingEngine pricing,
                                    EconomyProperties properties) {
        this.client = client;
        this.profiles = profiles;
        this.ledger = ledger;
        this.pricing = pricing;
        this.settings = properties.getPricing();
    }

    /**
     * @return the discount window opened for the item, or empty if no offer was made
     */
    public Optional<DiscountWindow> requestOffer(String playerId, String itemId) {
        if (!pricing.containsItem(itemId)) {
            log.debug("Personalized offer skipped, unknown item {}", itemId);
            return Optional.empty();
        }
        PersonalizationRequest request = buildRequest(playerId, itemId);

        Optional<PersonalizationResponse> response = callWithTimeout(request);
        if (response.isEmpty() || response.get().getPriceFactor() == null) {
            return Optional.empty();
        }

        double factor = response.get().getPriceFactor();
        if (!(factor > 0 && factor < 1)) {
            log.debug("Ignoring price factor {} for item {}", factor, itemId);
            return Optional.empty();
        }

        double percent = Math.min((1.0 - factor) * 100.0, settings.getMaxPersonalizedDiscountPercent());
        EconomyResult<DiscountWindow> applied = pricing.applyTimedDiscount(itemId, percent,
            settings.getPersonalizedOfferHours(), 0);
        if (applied.isRejected()) {
            log.warn("Personalized discount on {} rejected: {}", itemId, applied.getMessage());
            return Optional.empty();
        }
        log.info("Personalized {}% discount on {} for player {} ({})", percent, itemId, playerId,
            response.get().getOfferType());
        return Optional.of(applied.getValue());
    }

    PersonalizationRequest buildRequest(String playerId, String itemId) {
        Optional<ProfileSummary> summary = profiles.summary(playerId);
        long recentSpend = 0;
        for (Currency currency : ledger.tradeableCurrencies()) {
            recentSpend += ledger.totalSpent(playerId, currency.getId());
        }
        return new PersonalizationRequest(playerId,
            summary.map(ProfileSummary::getSegment).orElse(PlayerSegment.NEW),
            summary.map(ProfileSummary::getEngagementScore).orElse(0.0),
            summary.map(ProfileSummary::getChurnRisk).orElse(0.0),
            recentSpend, itemId, ACTION_OFFER);
    }

    private Optional<PersonalizationResponse> callWithTimeout(PersonalizationRequest request) {
        Duration timeout = settings.getPersonalizationTimeout();
        CompletableFuture<Optional<PersonalizationResponse>> call =
            CompletableFuture.supplyAsync(() -> client.suggest(request), executor);
        try {
            Optional<PersonalizationResponse> response = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return response == null ? Optional.empty() : response;
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Personalization service timed out after {}ms for player {}", timeout.toMillis(),
                request.getPlayerId());
            return Optional.empty();
        } catch (ExecutionException e) {
            log.warn("Personalization service failed for player {}: {}", request.getPlayerId(),
                e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }
}
