package com.example.catalogsync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Aggregated counters of a sync run.
 * {@code deleted} is the sum of {@code hardDeleted} and {@code markedForReview}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncCounts {

    private int created;
    private int updated;
    private int unchanged;
    private int deleted;
    private int hardDeleted;
    private int markedForReview;

    private int childrenCreated;
    private int childrenUpdated;
    private int childrenDeleted;
    private int childrenMarkedForReview;

    private int repairedMappings;
    private int errors;
}
