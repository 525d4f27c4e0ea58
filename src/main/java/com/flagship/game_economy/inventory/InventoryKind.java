package com.flagship.game_economy.inventory;

public enum InventoryKind {
    ITEM,
    BOOSTER
}
