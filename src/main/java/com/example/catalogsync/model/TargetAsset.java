package com.example.catalogsync.model;

import com.example.catalogsync.enums.AssetStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An asset of the target catalog as seen through the {@code CatalogAccessor}.
 * Also used as the desired payload when creating or updating assets.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TargetAsset {

    /**
     * Catalog UUID. Null for desired payloads that were not created yet.
     */
    private String uuid;

    /**
     * Catalog resource type, e.g. "Collection", "UmlClass", "ReferenceValue".
     */
    private String type;

    private String label;

    private String description;

    private String stereotype;

    private AssetStatus status;

    /**
     * UUID of the containing collection (or classifier/enumeration for child assets).
     */
    private String parentUuid;

    /**
     * Typed scalar fields such as title, physicalName, hasRange, code or shortText.
     */
    @Builder.Default
    private Map<String, String> attributes = new LinkedHashMap<>();

    /**
     * Custom properties, including the natural key field of engine-managed assets.
     */
    @Builder.Default
    private Map<String, String> customProperties = new LinkedHashMap<>();

    public String attribute(String name) {
        return attributes != null ? attributes.get(name) : null;
    }

    public String customProperty(String name) {
        return customProperties != null ? customProperties.get(name) : null;
    }

    public boolean isMarkedForReview() {
        return status == AssetStatus.MARKED_FOR_REVIEW;
    }
}
