package com.example.catalogsync.enums;

/**
 * Which side of a sync a check was run against.
 */
public enum SyncSide {
    SOURCE,
    CATALOG
}
