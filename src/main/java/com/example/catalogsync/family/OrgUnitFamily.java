package com.example.catalogsync.family;

import com.example.catalogsync.config.SyncConfig;
import com.example.catalogsync.model.SourceRecord;
import com.example.catalogsync.model.TargetAsset;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Organisational units of the staff directory, kept as a tree of collections.
 * Sub-units are records of the same family, nested below their parent unit.
 */
@Component
public class OrgUnitFamily extends BaseEntityFamily {

    public static final String KEY_FIELD = "id_im_staatskalender";
    public static final String LINK_FIELD = "link_zum_staatskalender";
    public static final String STEREOTYPE = "Organisationseinheit";

    public OrgUnitFamily(SyncConfig syncConfig) {
        super(syncConfig);
    }

    @Override
    public String getName() {
        return SyncConfig.ORG_UNITS;
    }

    @Override
    public String getKeyField() {
        return KEY_FIELD;
    }

    @Override
    public String getAssetType() {
        return "Collection";
    }

    @Override
    protected String getStereotype() {
        return STEREOTYPE;
    }

    @Override
    public TargetAsset toDesiredAsset(SourceRecord record) {
        Map<String, String> customProperties = new LinkedHashMap<>();
        customProperties.put(KEY_FIELD, record.getNaturalKey());
        customProperties.put(LINK_FIELD, nullToEmpty(record.field("url_website")));
        return baseAsset()
                .label(nullToEmpty(record.field("title")))
                .customProperties(customProperties)
                .build();
    }
}
