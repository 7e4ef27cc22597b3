package com.example.catalogsync.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A per-item failure recorded during a run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SyncError {

    private String naturalKey;

    /**
     * Child code, when the failure concerns a child item.
     */
    private String childCode;

    /**
     * Operation that failed, e.g. "create", "update", "delete", "mapType".
     */
    private String operation;

    private Integer statusCode;

    private String message;
}
