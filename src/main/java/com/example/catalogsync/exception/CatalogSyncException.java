package com.example.catalogsync.exception;

/**
 * Base exception for catalog sync errors.
 * Carries the entity family and natural key of the item being processed, when known.
 */
public class CatalogSyncException extends RuntimeException {

    private final String family;
    private final String naturalKey;

    public CatalogSyncException(String message) {
        super(message);
        this.family = null;
        this.naturalKey = null;
    }

    public CatalogSyncException(String message, Throwable cause) {
        super(message, cause);
        this.family = null;
        this.naturalKey = null;
    }

    public CatalogSyncException(String message, String family, String naturalKey) {
        super(message);
        this.family = family;
        this.naturalKey = naturalKey;
    }

    public CatalogSyncException(String message, String family, String naturalKey, Throwable cause) {
        super(message, cause);
        this.family = family;
        this.naturalKey = naturalKey;
    }

    public String getFamily() {
        return family;
    }

    public String getNaturalKey() {
        return naturalKey;
    }
}
