package com.example.catalogsync.service;

import com.example.catalogsync.config.SyncConfig;
import com.example.catalogsync.exception.CatalogSyncException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Fixed delay after every mutating catalog call, to keep the load on the catalog server low.
 */
@Component
public class RequestPacer {

    private final long delayMs;

    @Autowired
    public RequestPacer(SyncConfig syncConfig) {
        this(syncConfig.getPacingDelayMs());
    }

    public RequestPacer(long delayMs) {
        this.delayMs = delayMs;
    }

    public void pause() {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CatalogSyncException("Interrupted while pacing catalog requests", e);
        }
    }
}
