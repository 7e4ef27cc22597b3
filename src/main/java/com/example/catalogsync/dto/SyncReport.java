package com.example.catalogsync.dto;

import com.example.catalogsync.enums.RunStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of reconciling one entity family.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SyncReport {

    /**
     * Id of the stored run history row, once persisted.
     */
    private Long runId;

    private String family;

    private RunStatus status;

    private String message;

    private LocalDateTime startedAt;

    private LocalDateTime finishedAt;

    @Builder.Default
    private SyncCounts counts = new SyncCounts();

    @Builder.Default
    private List<ItemChange> created = new ArrayList<>();

    @Builder.Default
    private List<ItemChange> updated = new ArrayList<>();

    @Builder.Default
    private List<ItemChange> unchanged = new ArrayList<>();

    @Builder.Default
    private List<ItemChange> deleted = new ArrayList<>();

    /**
     * Mapping entries dropped because their asset no longer exists.
     */
    @Builder.Default
    private List<ItemChange> repairedMappings = new ArrayList<>();

    @Builder.Default
    private List<SyncError> errors = new ArrayList<>();

    public static SyncReport failure(String family, String errorMessage, LocalDateTime startedAt) {
        return SyncReport.builder()
                .family(family)
                .status(RunStatus.ERROR)
                .message(errorMessage)
                .startedAt(startedAt)
                .finishedAt(LocalDateTime.now())
                .build();
    }

    public static SyncReport disabled(String family) {
        LocalDateTime now = LocalDateTime.now();
        return SyncReport.builder()
                .family(family)
                .status(RunStatus.WARNING)
                .message("Family '" + family + "' is disabled. Set catalog-sync." + family + ".enabled=true to enable.")
                .startedAt(now)
                .finishedAt(now)
                .build();
    }
}
