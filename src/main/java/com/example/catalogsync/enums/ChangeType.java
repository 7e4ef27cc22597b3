package com.example.catalogsync.enums;

/**
 * Classification of a source record (or child item) after reconciliation.
 */
public enum ChangeType {
    /**
     * No target asset existed; one was created.
     */
    CREATED,

    /**
     * Target asset existed and at least one field or child differed.
     */
    UPDATED,

    /**
     * Target asset existed and matched the source.
     */
    UNCHANGED,

    /**
     * Target asset has no source counterpart any more and was handled by the deletion policy.
     */
    DELETED
}
