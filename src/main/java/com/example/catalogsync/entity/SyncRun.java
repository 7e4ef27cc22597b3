package com.example.catalogsync.entity;

import com.example.catalogsync.enums.RunStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * History row of one reconciliation run of an entity family.
 */
@Entity
@Table(name = "sync_run")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SyncRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "family", nullable = false, length = 64)
    private String family;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private RunStatus status;

    @Column(name = "started_at", nullable = false)
    private LocalDateTime startedAt;

    @Column(name = "finished_at")
    private LocalDateTime finishedAt;

    @Column(name = "created_count")
    private int createdCount;

    @Column(name = "updated_count")
    private int updatedCount;

    @Column(name = "unchanged_count")
    private int unchangedCount;

    @Column(name = "deleted_count")
    private int deletedCount;

    @Column(name = "marked_for_review_count")
    private int markedForReviewCount;

    @Column(name = "error_count")
    private int errorCount;

    @Column(name = "message", length = 2048)
    private String message;

    /**
     * Full report as JSON, including item lists and errors
     */
    @Lob
    @Column(name = "report_json")
    @JsonIgnore
    private String reportJson;
}
