package com.example.catalogsync.enums;

/**
 * Status of an asset in the target catalog.
 * The catalog groups statuses into workflow stages; the sync only writes the values below.
 */
public enum AssetStatus {
    /**
     * Draft group. Changes are visible to editors only.
     */
    WORKING("WORKING"),

    /**
     * Published and visible to all catalog readers.
     */
    PUBLISHED("PUBLISHED"),

    /**
     * Flagged for deletion review. A data steward has to confirm the deletion in the catalog.
     */
    MARKED_FOR_REVIEW("DELETENEW");

    private final String wireValue;

    AssetStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String getWireValue() {
        return wireValue;
    }

    /**
     * Map a status value returned by the catalog. Unknown statuses (e.g. archive stages) yield null.
     */
    public static AssetStatus fromWireValue(String value) {
        if (value == null) {
            return null;
        }
        for (AssetStatus status : values()) {
            if (status.wireValue.equalsIgnoreCase(value.trim())) {
                return status;
            }
        }
        return null;
    }
}
