package com.example.catalogsync.enums;

/**
 * Overall status of a sync run, as handed to the reporting side.
 */
public enum RunStatus {
    /**
     * Run completed without any error.
     */
    SUCCESS,

    /**
     * Run completed but some items failed and were skipped.
     */
    WARNING,

    /**
     * Run aborted before mutating anything (duplicate keys, unreachable source or catalog).
     */
    ERROR
}
