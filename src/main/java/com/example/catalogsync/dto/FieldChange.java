package com.example.catalogsync.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Old and new value of a single field of an updated asset.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FieldChange {

    private String field;

    private String oldValue;

    private String newValue;

    public static FieldChange of(String field, String oldValue, String newValue) {
        return new FieldChange(field, oldValue, newValue);
    }
}
