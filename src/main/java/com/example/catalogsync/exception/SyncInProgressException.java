package com.example.catalogsync.exception;

/**
 * A sync run was triggered while another one still owns the mapping files.
 */
public class SyncInProgressException extends CatalogSyncException {

    public SyncInProgressException(String family) {
        super("A sync run is already in progress; rejected trigger for " + family, family, null);
    }
}
