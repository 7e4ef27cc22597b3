package com.example.catalogsync.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Sub-item of a composite entity: a column of a dataset composition or a paragraph of a law.
 * Matched by code, never by position.
 */
@Value
@Builder
public class ChildItem {

    /**
     * Technical name or code identifying the child within its parent.
     */
    String code;

    @Singular
    Map<String, String> values;

    public String value(String name) {
        return values.get(name);
    }
}
