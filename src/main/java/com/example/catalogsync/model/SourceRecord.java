package com.example.catalogsync.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * One canonical entity fetched from a source system for the current run.
 */
@Value
@Builder(toBuilder = true)
public class SourceRecord {

    /**
     * Stable external identifier used to match the record against catalog assets across runs.
     */
    String naturalKey;

    /**
     * Source fields in the family's vocabulary (e.g. "title", "url").
     */
    @Singular
    Map<String, String> fields;

    /**
     * Sub-items of composite entities (columns, paragraphs). Empty for simple entities.
     */
    @Singular
    List<ChildItem> children;

    /**
     * Human-readable location below the family scope, e.g. "Departement/Amt". Null means the scope root.
     */
    String parentPath;

    /**
     * Natural key of the parent record of the same family, for hierarchical families.
     */
    String parentKey;

    public String field(String name) {
        return fields.get(name);
    }

    /**
     * Nesting depth of the record, used to create parents before their children.
     */
    public int depth() {
        if (parentPath == null || parentPath.isBlank()) {
            return 0;
        }
        return CatalogPaths.split(parentPath).size();
    }
}
