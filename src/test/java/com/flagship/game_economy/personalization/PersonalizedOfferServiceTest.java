package com.flagship.game_economy.personalization;

import com.flagship.game_economy.EconomyTestFixture;
import com.flagship.game_economy.config.EconomyProperties;
import com.flagship.game_economy.pricing.DiscountWindow;
import com.flagship.game_economy.profile.PlayerProfileStore;
import com.flagship.game_economy.profile.PlayerSegment;
import com.flagship.game_economy.profile.ProfileEventType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * The personalization service may only lower prices, through a normal timed
 * discount, and its failures never reach the player.
 */
class PersonalizedOfferServiceTest {

    private static final String PLAYER = "player-1";

    private EconomyTestFixture economy;
    private PersonalizationClient client;
    private PersonalizedOfferService offers;

    @BeforeEach
    void setUp() {
        EconomyProperties properties = new EconomyProperties();
        properties.getPricing().setPersonalizationTimeout(Duration.ofMillis(200));
        economy = new EconomyTestFixture(properties, EconomyTestFixture.item("sword", "coins", 100).build());
        client = mock(PersonalizationClient.class);
        offers = new PersonalizedOfferService(client, economy.profiles, economy.ledger, economy.pricing, properties);
    }

    @AfterEach
    void tearDown() {
        offers.shutdown();
    }

    @Test
    @DisplayName("a price factor below one becomes a timed discount")
    void factorBecomesDiscount() {
        when(client.suggest(any())).thenReturn(Optional.of(new PersonalizationResponse(0.7, "win_back")));

        Optional<DiscountWindow> window = offers.requestOffer(PLAYER, "sword");

        assertTrue(window.isPresent());
        assertEquals(30.0, window.get().getPercentage(), 1e-9);
        assertEquals(EconomyTestFixture.START.plus(Duration.ofHours(24)), window.get().getEndsAt());
        assertEquals(70L, economy.pricing.item("sword").orElseThrow().getPrices().get(0).getListedAmount());
    }

    @Test
    @DisplayName("the discount is capped")
    void discountIsCapped() {
        when(client.suggest(any())).thenReturn(Optional.of(new PersonalizationResponse(0.1, "aggressive")));

        Optional<DiscountWindow> window = offers.requestOffer(PLAYER, "sword");

        assertEquals(50.0, window.orElseThrow().getPercentage(), 1e-9);
        assertEquals(50L, economy.pricing.item("sword").orElseThrow().getPrices().get(0).getListedAmount());
    }

    @Test
    @DisplayName("suggestions to keep or raise the price are ignored")
    void priceIncreasesIgnored() {
        when(client.suggest(any())).thenReturn(Optional.of(new PersonalizationResponse(1.2, "premium")));

        assertTrue(offers.requestOffer(PLAYER, "sword").isEmpty());
        assertEquals(100L, economy.pricing.item("sword").orElseThrow().getPrices().get(0).getListedAmount());
    }

    @Test
    @DisplayName("remote failures and empty answers make no offer")
    void failuresIgnored() {
        doThrow(new IllegalStateException("connection refused")).when(client).suggest(any());
        assertTrue(offers.requestOffer(PLAYER, "sword").isEmpty());

        doReturn(Optional.empty()).when(client).suggest(any());
        assertTrue(offers.requestOffer(PLAYER, "sword").isEmpty());

        doReturn(Optional.of(new PersonalizationResponse(null, "none"))).when(client).suggest(any());
        assertTrue(offers.requestOffer(PLAYER, "sword").isEmpty());
        assertNull(economy.pricing.item("sword").orElseThrow().getDiscountPercentage());
    }

    @Test
    @DisplayName("a slow service times out without an offer")
    void timeoutIgnored() {
        when(client.suggest(any())).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return Optional.of(new PersonalizationResponse(0.5, "late"));
        });

        long started = System.nanoTime();
        Optional<DiscountWindow> window = offers.requestOffer(PLAYER, "sword");

        assertTrue(window.isEmpty());
        assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofSeconds(1)) < 0);
        assertNull(economy.pricing.item("sword").orElseThrow().getDiscountPercentage());
    }

    @Test
    @DisplayName("unknown items never reach the service")
    void unknownItemSkipped() {
        assertTrue(offers.requestOffer(PLAYER, "dragon").isEmpty());
        verify(client, never()).suggest(any());
    }

    @Test
    @DisplayName("the request carries the player's profile and lifetime spend")
    void requestCarriesProfile() {
        economy.ledger.earn(PLAYER, "gems", 100, "gift");
        economy.ledger.spend(PLAYER, "gems", 60, "skip");
        economy.profiles.recordEvent(PLAYER, ProfileEventType.CURRENCY_SPENT, 60,
            Map.of(PlayerProfileStore.TAG_HARD_CURRENCY, "true"));
        when(client.suggest(any())).thenReturn(Optional.empty());

        offers.requestOffer(PLAYER, "sword");

        ArgumentCaptor<PersonalizationRequest> captor = ArgumentCaptor.forClass(PersonalizationRequest.class);
        verify(client).suggest(captor.capture());
        PersonalizationRequest request = captor.getValue();
        assertEquals(PLAYER, request.getPlayerId());
        assertEquals(PlayerSegment.REGULAR, request.getSegment());
        assertEquals(60L, request.getRecentSpend());
        assertEquals("sword", request.getItemId());
        assertEquals(PersonalizedOfferService.ACTION_OFFER, request.getRequestedAction());
    }
}
