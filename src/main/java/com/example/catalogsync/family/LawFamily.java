package com.example.catalogsync.family;

import com.example.catalogsync.config.SyncConfig;
import com.example.catalogsync.model.ChildItem;
import com.example.catalogsync.model.SourceRecord;
import com.example.catalogsync.model.TargetAsset;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Laws of the systematic law collection as reference objects, with their paragraphs as reference values.
 */
@Component
public class LawFamily extends BaseEntityFamily {

    public static final String KEY_FIELD = "systematic_number";
    public static final String STEREOTYPE = "LAW";
    public static final String CHILD_TYPE = "ReferenceValue";

    public LawFamily(SyncConfig syncConfig) {
        super(syncConfig);
    }

    /**
     * Trim a systematic number and strip wrapping single or double quotes, repeatedly.
     */
    public static String normalizeSystematicNumber(String value) {
        if (value == null) {
            return "";
        }
        String normalized = value.trim();
        while (normalized.length() >= 2
                && normalized.charAt(0) == normalized.charAt(normalized.length() - 1)
                && (normalized.charAt(0) == '\'' || normalized.charAt(0) == '"')) {
            normalized = normalized.substring(1, normalized.length() - 1).trim();
        }
        return normalized;
    }

    public static String labelOf(String systematicNumber, String title) {
        return "SG " + systematicNumber + " - " + title;
    }

    @Override
    public String getName() {
        return SyncConfig.LAWS;
    }

    @Override
    public String getKeyField() {
        return KEY_FIELD;
    }

    @Override
    public String getAssetType() {
        return "ReferenceObject";
    }

    @Override
    protected String getStereotype() {
        return STEREOTYPE;
    }

    @Override
    public boolean isComposite() {
        return true;
    }

    @Override
    public String naturalKeyOf(TargetAsset asset) {
        String key = asset.customProperty(KEY_FIELD);
        return key == null ? null : normalizeSystematicNumber(key);
    }

    @Override
    public TargetAsset toDesiredAsset(SourceRecord record) {
        Map<String, String> customProperties = new LinkedHashMap<>();
        customProperties.put(KEY_FIELD, record.getNaturalKey());
        return baseAsset()
                .label(labelOf(record.getNaturalKey(), nullToEmpty(record.field("title_de"))))
                .description(nullToEmpty(record.field("original_url_de")))
                .customProperties(customProperties)
                .build();
    }

    @Override
    public TargetAsset toDesiredChild(SourceRecord owner, ChildItem child) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("code", child.getCode());
        attributes.put("shortText", nullToEmpty(child.value("shortText")));
        return TargetAsset.builder()
                .type(CHILD_TYPE)
                .status(getWriteStatus())
                .attributes(attributes)
                .build();
    }

    @Override
    public String childKeyOf(TargetAsset child) {
        return child.attribute("code");
    }
}
