package com.example.catalogsync.service;

import com.example.catalogsync.dto.SyncReport;
import com.example.catalogsync.exception.SyncInProgressException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs all families on the configured cron schedule. Disabled with the cron value "-".
 */
@Component
public class SyncScheduler {

    private static final Logger log = LoggerFactory.getLogger(SyncScheduler.class);

    private final CatalogSyncService syncService;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public SyncScheduler(CatalogSyncService syncService) {
        this.syncService = syncService;
    }

    @Scheduled(cron = "${catalog-sync.schedule.cron:-}")
    public void runScheduledSync() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Previous scheduled sync still running, skipping this tick");
            return;
        }
        try {
            List<SyncReport> reports = syncService.syncAll();
            reports.forEach(r -> log.info("Scheduled sync of {} finished with {}", r.getFamily(), r.getStatus()));
        } catch (SyncInProgressException e) {
            log.warn("Skipping scheduled sync: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Scheduled sync failed: {}", e.getMessage(), e);
        } finally {
            running.set(false);
        }
    }
}
