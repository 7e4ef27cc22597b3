package com.example.catalogsync.engine;

import com.example.catalogsync.dto.FieldChange;
import com.example.catalogsync.enums.MutationType;
import com.example.catalogsync.model.TargetAsset;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Planned change of one child item of a composite asset.
 */
@Value
@Builder
public class ChildMutation {

    MutationType type;

    String code;

    TargetAsset desired;

    TargetAsset live;

    @Singular
    List<FieldChange> fieldChanges;
}
