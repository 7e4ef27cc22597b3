package com.example.catalogsync.controller;

import com.example.catalogsync.dto.SyncReport;
import com.example.catalogsync.entity.SyncRun;
import com.example.catalogsync.model.MappingEntry;
import com.example.catalogsync.service.CatalogSyncService;
import com.example.catalogsync.service.SyncRunService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Controller for triggering reconciliation runs and inspecting their results.
 */
@RestController
@RequestMapping("/api/sync")
@Tag(name = "Sync", description = "Endpoints for reconciling entity families into the catalog")
public class SyncController {

    private final CatalogSyncService syncService;
    private final SyncRunService syncRunService;

    public SyncController(CatalogSyncService syncService, SyncRunService syncRunService) {
        this.syncService = syncService;
        this.syncRunService = syncRunService;
    }

    @Operation(
        summary = "List entity families",
        description = "Names of the entity families that can be synchronized"
    )
    @GetMapping("/families")
    public ResponseEntity<List<String>> getFamilies() {
        return ResponseEntity.ok(syncService.getFamilies());
    }

    @Operation(
        summary = "Test catalog connection",
        description = "Check whether the catalog is configured and reachable"
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Connection status")
    })
    @GetMapping("/test-connection")
    public ResponseEntity<Map<String, Object>> testConnection() {
        boolean configured = syncService.isConfigured();
        boolean connected = syncService.testConnection();

        return ResponseEntity.ok(Map.of(
            "configured", configured,
            "connected", connected,
            "message", configured
                ? (connected ? "Successfully connected to the catalog" : "Failed to connect to the catalog")
                : "Catalog integration is not configured. Set catalog.base-url, catalog.username, and catalog.password."
        ));
    }

    @Operation(
        summary = "Sync all families",
        description = "Reconcile every enabled family, one after the other. Disabled families are reported as skipped."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "One report per family"),
        @ApiResponse(responseCode = "409", description = "Another sync run is in progress")
    })
    @PostMapping("/all")
    public ResponseEntity<List<SyncReport>> syncAll() {
        return ResponseEntity.ok(syncService.syncAll());
    }

    @Operation(
        summary = "Sync one family",
        description = "Reconcile the source records of one family against the catalog. " +
            "Creates missing assets, updates changed ones and deletes or flags assets no longer in the source."
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Run report",
            content = @Content(schema = @Schema(implementation = SyncReport.class))),
        @ApiResponse(responseCode = "404", description = "Unknown family"),
        @ApiResponse(responseCode = "409", description = "Another sync run is in progress")
    })
    @PostMapping("/{family}")
    public ResponseEntity<SyncReport> sync(
            @Parameter(description = "Family name, e.g. org-units, dataset-compositions or laws")
            @PathVariable("family") String family) {
        return ResponseEntity.ok(syncService.sync(family));
    }

    @Operation(
        summary = "Get run history",
        description = "Stored runs, newest first, optionally filtered by family"
    )
    @GetMapping("/runs")
    public ResponseEntity<List<SyncRun>> getRuns(
            @Parameter(description = "Optional family filter")
            @RequestParam(value = "family", required = false) String family) {
        return ResponseEntity.ok(syncRunService.getRuns(family));
    }

    @Operation(
        summary = "Get run report",
        description = "Full report of a stored run including item changes and errors"
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Run report"),
        @ApiResponse(responseCode = "404", description = "Run not found")
    })
    @GetMapping("/runs/{id}")
    public ResponseEntity<SyncReport> getRun(
            @Parameter(description = "Database ID of the run")
            @PathVariable("id") Long id) {
        return ResponseEntity.ok(syncRunService.getReport(id));
    }

    @Operation(
        summary = "Get identity mapping",
        description = "Current natural key to catalog UUID mapping of a family"
    )
    @GetMapping("/mappings/{family}")
    public ResponseEntity<List<MappingEntry>> getMappings(
            @Parameter(description = "Family name")
            @PathVariable("family") String family) {
        return ResponseEntity.ok(syncService.getMappings(family));
    }
}
