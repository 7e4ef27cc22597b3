package com.example.catalogsync.dto;

import com.example.catalogsync.enums.ChangeType;
import com.example.catalogsync.enums.DeletionDecision;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Report entry for one entity (or one child item) touched by a sync run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ItemChange {

    /**
     * Natural key of the entity, or the code of a child item.
     */
    private String naturalKey;

    private String uuid;

    private String label;

    private ChangeType changeType;

    /**
     * Set for deletions only.
     */
    private DeletionDecision deletionDecision;

    /**
     * True when an unmapped live asset carrying the key was taken over instead of creating a new one.
     */
    private boolean adopted;

    @Builder.Default
    private List<FieldChange> fieldChanges = new ArrayList<>();

    @Builder.Default
    private List<ItemChange> childChanges = new ArrayList<>();
}
