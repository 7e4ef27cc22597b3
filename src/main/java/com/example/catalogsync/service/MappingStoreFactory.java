package com.example.catalogsync.service;

import com.example.catalogsync.config.CatalogApiConfig;
import com.example.catalogsync.config.SyncConfig;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Opens the identity mapping file of a family for the configured catalog database.
 */
@Component
public class MappingStoreFactory {

    private final SyncConfig syncConfig;
    private final CatalogApiConfig catalogConfig;

    public MappingStoreFactory(SyncConfig syncConfig, CatalogApiConfig catalogConfig) {
        this.syncConfig = syncConfig;
        this.catalogConfig = catalogConfig;
    }

    public IdentityMappingStore open(String family) {
        return IdentityMappingStore.load(pathOf(family));
    }

    public Path pathOf(String family) {
        return Paths.get(syncConfig.getMappingDir(), catalogConfig.getDatabase() + "_" + family + "-mapping.csv");
    }
}
