package com.example.catalogsync.service;

import com.example.catalogsync.config.CatalogApiConfig;
import com.example.catalogsync.config.SyncConfig;
import com.example.catalogsync.dto.SyncReport;
import com.example.catalogsync.engine.DuplicateGuard;
import com.example.catalogsync.engine.LiveSubtree;
import com.example.catalogsync.engine.Reconciler;
import com.example.catalogsync.engine.RunState;
import com.example.catalogsync.enums.SyncSide;
import com.example.catalogsync.exception.CatalogSyncException;
import com.example.catalogsync.exception.ResourceNotFoundException;
import com.example.catalogsync.exception.SyncInProgressException;
import com.example.catalogsync.family.EntityFamily;
import com.example.catalogsync.model.MappingEntry;
import com.example.catalogsync.model.SourceRecord;
import com.example.catalogsync.model.TargetAsset;
import com.example.catalogsync.source.SourceReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs the reconciliation of entity families.
 * <p>
 * A run reads the source, checks both sides for duplicate keys, fetches the live scope and hands
 * everything to the {@link Reconciler}. Only one run may own the mapping files at a time.
 */
@Service
public class CatalogSyncService {

    private static final Logger log = LoggerFactory.getLogger(CatalogSyncService.class);

    private final Map<String, EntityFamily> families = new LinkedHashMap<>();
    private final Map<String, SourceReader> readers = new LinkedHashMap<>();
    private final CatalogAccessor catalog;
    private final CatalogApiConfig catalogConfig;
    private final SyncConfig syncConfig;
    private final DuplicateGuard duplicateGuard;
    private final Reconciler reconciler;
    private final MappingStoreFactory mappingStoreFactory;
    private final SyncRunService syncRunService;
    private final ReentrantLock runLock = new ReentrantLock();

    public CatalogSyncService(List<EntityFamily> families,
                              List<SourceReader> readers,
                              CatalogAccessor catalog,
                              CatalogApiConfig catalogConfig,
                              SyncConfig syncConfig,
                              DuplicateGuard duplicateGuard,
                              Reconciler reconciler,
                              MappingStoreFactory mappingStoreFactory,
                              SyncRunService syncRunService) {
        for (String name : List.of(SyncConfig.ORG_UNITS, SyncConfig.DATASET_COMPOSITIONS, SyncConfig.LAWS)) {
            families.stream().filter(f -> name.equals(f.getName())).findFirst()
                    .ifPresent(f -> this.families.put(name, f));
        }
        families.forEach(f -> this.families.putIfAbsent(f.getName(), f));
        readers.forEach(r -> this.readers.put(r.getFamily(), r));
        this.catalog = catalog;
        this.catalogConfig = catalogConfig;
        this.syncConfig = syncConfig;
        this.duplicateGuard = duplicateGuard;
        this.reconciler = reconciler;
        this.mappingStoreFactory = mappingStoreFactory;
        this.syncRunService = syncRunService;
    }

    public List<String> getFamilies() {
        return new ArrayList<>(families.keySet());
    }

    public boolean isRunning() {
        return runLock.isLocked();
    }

    /**
     * Reconcile one family.
     *
     * @throws ResourceNotFoundException when the family is unknown
     * @throws SyncInProgressException   when another run is active
     */
    public SyncReport sync(String familyName) {
        EntityFamily family = requireFamily(familyName);
        if (!runLock.tryLock()) {
            throw new SyncInProgressException(familyName);
        }
        try {
            return runFamily(family);
        } finally {
            runLock.unlock();
        }
    }

    /**
     * Reconcile all families one after the other. Disabled families are reported as skipped.
     */
    public List<SyncReport> syncAll() {
        if (!runLock.tryLock()) {
            throw new SyncInProgressException("all");
        }
        try {
            List<SyncReport> reports = new ArrayList<>();
            for (EntityFamily family : families.values()) {
                reports.add(runFamily(family));
            }
            return reports;
        } finally {
            runLock.unlock();
        }
    }

    public List<MappingEntry> getMappings(String familyName) {
        requireFamily(familyName);
        return mappingStoreFactory.open(familyName).all();
    }

    public boolean isConfigured() {
        return catalogConfig.isConfigured();
    }

    public boolean testConnection() {
        return catalogConfig.isConfigured() && catalog.testConnection();
    }

    private SyncReport runFamily(EntityFamily family) {
        String name = family.getName();
        if (!syncConfig.isEnabled(name)) {
            log.info("Skipping disabled family {}", name);
            return SyncReport.disabled(name);
        }
        SourceReader reader = readers.get(name);
        if (reader == null) {
            throw new ResourceNotFoundException("SourceReader", name);
        }

        LocalDateTime startedAt = LocalDateTime.now();
        log.info("Starting sync of {} into scheme '{}' scope '{}'", name, family.getScheme(), family.getScopePath());
        SyncReport report;
        try {
            family.prepareRun();

            List<SourceRecord> records = reader.read();
            duplicateGuard.checkUnique(name, records, SourceRecord::getNaturalKey,
                    record -> family.toDesiredAsset(record).getLabel(), SyncSide.SOURCE);

            TargetAsset scope = catalog.resolvePath(family.getScheme(), family.getScopePath())
                    .orElseThrow(() -> new CatalogSyncException("Scope '" + family.getScopePath()
                            + "' not found in scheme '" + family.getScheme() + "'", name, null));
            LiveSubtree live = LiveSubtree.fetch(catalog, scope);
            duplicateGuard.checkUnique(name, live.managedAssets(family), family::naturalKeyOf,
                    TargetAsset::getUuid, SyncSide.CATALOG);
            log.info("{}: {} source records, {} live assets in scope", name, records.size(), live.size());

            IdentityMappingStore mapping = mappingStoreFactory.open(name);
            RunState state;
            try {
                state = reconciler.reconcile(family, records, mapping, live);
            } finally {
                if (mapping.isDirty()) {
                    mapping.persist();
                }
            }
            report = state.toReport();
            report.setStartedAt(startedAt);
            log.info(report.getMessage());
        } catch (CatalogSyncException e) {
            log.error("Sync of {} failed: {}", name, e.getMessage(), e);
            report = SyncReport.failure(name, e.getMessage(), startedAt);
        }
        return syncRunService.record(report);
    }

    private EntityFamily requireFamily(String familyName) {
        EntityFamily family = families.get(familyName);
        if (family == null) {
            throw new ResourceNotFoundException("Entity family", familyName);
        }
        return family;
    }
}
