package com.example.catalogsync.engine;

import com.example.catalogsync.dto.FieldChange;
import com.example.catalogsync.enums.MutationType;
import com.example.catalogsync.model.SourceRecord;
import com.example.catalogsync.model.TargetAsset;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Planned change of one entity. Create and update mutations carry the source record,
 * delete mutations only the live asset.
 */
@Value
@Builder
public class Mutation {

    MutationType type;

    String naturalKey;

    SourceRecord record;

    TargetAsset desired;

    TargetAsset live;

    /**
     * Field changes known at planning time. A parent move is detected when the mutation is applied.
     */
    @Singular
    List<FieldChange> fieldChanges;

    @Singular
    List<ChildMutation> childMutations;

    int depth;

    boolean adopted;
}
