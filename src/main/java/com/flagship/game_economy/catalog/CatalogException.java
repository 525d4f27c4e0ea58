package com.flagship.game_economy.catalog;

/**
 * The static catalog is missing, unreadable or references something that does
 * not exist. The economy cannot start without a consistent catalog.
 */
public class CatalogException extends RuntimeException {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
