package com.example.catalogsync.exception;

/**
 * A declared source type has no counterpart in the target schema (e.g. an unmapped column type).
 */
public class UnknownTypeException extends CatalogSyncException {

    private final String typeName;

    public UnknownTypeException(String typeName, String family, String naturalKey) {
        super("Unknown type '" + typeName + "' for " + family + " item " + naturalKey, family, naturalKey);
        this.typeName = typeName;
    }

    public String getTypeName() {
        return typeName;
    }
}
