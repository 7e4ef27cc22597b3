package com.example.catalogsync.enums;

/**
 * Catalog operation planned by the reconciler.
 */
public enum MutationType {
    CREATE,
    UPDATE,
    UNCHANGED,
    HARD_DELETE,
    MARK_FOR_REVIEW
}
