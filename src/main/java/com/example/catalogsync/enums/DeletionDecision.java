package com.example.catalogsync.enums;

/**
 * Outcome of the deletion policy for a delete candidate.
 */
public enum DeletionDecision {
    /**
     * Asset has no dependents and is removed together with its mapping entry.
     */
    HARD_DELETE,

    /**
     * Asset has dependents; it is flagged for review and kept, and so is its mapping entry.
     */
    MARK_FOR_REVIEW
}
