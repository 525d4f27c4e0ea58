package com.flagship.game_economy.snapshot;

import com.flagship.game_economy.currency.ExchangeRate;
import com.flagship.game_economy.inflation.MultiplierState;
import com.flagship.game_economy.inventory.InventoryState;
import com.flagship.game_economy.ledger.WalletState;
import com.flagship.game_economy.pricing.ShopItemState;
import com.flagship.game_economy.profile.PlayerEconomicProfile;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Versioned, structured copy of all mutable economy state.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EconomySnapshot {
    private int version;
    private Instant createdAt;
    private List<WalletState> wallets = new ArrayList<>();
    private List<PlayerEconomicProfile> profiles = new ArrayList<>();
    private List<ExchangeRate> exchangeRates = new ArrayList<>();
    private Map<String, MultiplierState> multipliers = new HashMap<>();
    private List<ShopItemState> shopItems = new ArrayList<>();
    private List<ShopItemState.PlayerPurchases> purchaseHistories = new ArrayList<>();
    private List<InventoryState> inventories = new ArrayList<>();
}
