package com.example.catalogsync.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of the identity mapping: which catalog asset corresponds to which source entity.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"natural_key", "asset_type", "target_uuid", "parent_collection_path"})
public class MappingEntry {

    @JsonProperty("natural_key")
    private String naturalKey;

    @JsonProperty("asset_type")
    private String assetType;

    @JsonProperty("target_uuid")
    private String targetUuid;

    @JsonProperty("parent_collection_path")
    private String parentCollectionPath;
}
