package com.flagship.game_economy.currency;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only set of currencies known to the economy.
 *
 * Populated from the catalog at startup. Lookups of unknown ids return empty
 * rather than throwing so that balance reads stay safe.
 */
public class CurrencyRegistry {

    private final Map<String, Currency> currencies;

    public CurrencyRegistry(Collection<Currency> definitions) {
        Map<String, Currency> byId = new LinkedHashMap<>();
        for (Currency currency : definitions) {
            validate(currency);
            if (byId.putIfAbsent(currency.getId(), currency) != null) {
                throw new IllegalArgumentException("Duplicate currency id: " + currency.getId());
            }
        }
        this.currencies = Collections.unmodifiableMap(byId);
    }

    public Optional<Currency> find(String currencyId) {
        if (currencyId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(currencies.get(currencyId));
    }

    public boolean contains(String currencyId) {
        return currencyId != null && currencies.containsKey(currencyId);
    }

    public Collection<Currency> all() {
        return currencies.values();
    }

    public List<Currency> tradeable() {
        List<Currency> result = new ArrayList<>();
        for (Currency currency : currencies.values()) {
            if (currency.isTradeable()) {
                result.add(currency);
            }
        }
        return result;
    }

    private static void validate(Currency currency) {
        if (currency.getId() == null || currency.getId().isBlank()) {
            throw new IllegalArgumentException("Currency id is required");
        }
        if (currency.getMinAmount() < 0) {
            throw new IllegalArgumentException("Currency " + currency.getId() + " has a negative minimum");
        }
        if (currency.getMaxAmount() < currency.getMinAmount()) {
            throw new IllegalArgumentException("Currency " + currency.getId() + " has max below min");
        }
    }
}
