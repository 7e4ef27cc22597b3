package com.example.catalogsync.family;

import com.example.catalogsync.config.SourceApiConfig;
import com.example.catalogsync.config.SyncConfig;
import com.example.catalogsync.exception.UnknownTypeException;
import com.example.catalogsync.model.ChildItem;
import com.example.catalogsync.model.SourceRecord;
import com.example.catalogsync.model.TargetAsset;
import com.example.catalogsync.service.CatalogAccessor;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Open-data portal datasets as UML classes, with their columns as attributes keyed by technical name.
 */
@Component
public class DatasetCompositionFamily extends BaseEntityFamily {

    public static final String KEY_FIELD = "odsDataportalId";
    public static final String LINK_FIELD = "odsDataportalLink";
    public static final String STEREOTYPE = "ogd_dataset";
    public static final String CHILD_TYPE = "UmlAttribute";

    /**
     * Portal field types and the names of the technical datatypes they map to.
     */
    private static final Map<String, String> DATATYPES = Map.ofEntries(
            Map.entry("text", "Zeichenkette"),
            Map.entry("int", "Ganzzahl"),
            Map.entry("identifier", "Identifier"),
            Map.entry("boolean", "Wahrheitswert"),
            Map.entry("double", "Dezimalzahl"),
            Map.entry("datetime", "Zeitpunkt"),
            Map.entry("date", "Datum"),
            Map.entry("geo_point_2d", "geo_point_2d"),
            Map.entry("geo_shape", "geo_shape"),
            Map.entry("file", "Binärdaten"),
            Map.entry("json_blob", "Zeichenkette")
    );

    private final CatalogAccessor catalog;
    private final SourceApiConfig sourceConfig;
    private final Map<String, String> datatypeUuids = new HashMap<>();

    public DatasetCompositionFamily(SyncConfig syncConfig, SourceApiConfig sourceConfig, CatalogAccessor catalog) {
        super(syncConfig);
        this.sourceConfig = sourceConfig;
        this.catalog = catalog;
    }

    /**
     * Datatype name for a portal field type, empty when the type is not supported.
     */
    public static Optional<String> datatypeNameOf(String fieldType) {
        if (fieldType == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(DATATYPES.get(fieldType.trim().toLowerCase()));
    }

    @Override
    public String getName() {
        return SyncConfig.DATASET_COMPOSITIONS;
    }

    @Override
    public String getKeyField() {
        return KEY_FIELD;
    }

    @Override
    public String getAssetType() {
        return "UmlClass";
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
    public void prepareRun() {
        datatypeUuids.clear();
    }

    @Override
    public TargetAsset toDesiredAsset(SourceRecord record) {
        String datasetId = record.getNaturalKey();
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("physicalName", datasetId);
        Map<String, String> customProperties = new LinkedHashMap<>();
        customProperties.put(KEY_FIELD, datasetId);
        customProperties.put(LINK_FIELD, sourceConfig.getDatasetLink(datasetId));
        return baseAsset()
                .label(nullToEmpty(record.field("title")))
                .attributes(attributes)
                .customProperties(customProperties)
                .build();
    }

    @Override
    public TargetAsset toDesiredChild(SourceRecord owner, ChildItem child) {
        String fieldType = child.value("type");
        String datatypeName = datatypeNameOf(fieldType)
                .orElseThrow(() -> new UnknownTypeException(fieldType, getName(), owner.getNaturalKey()));

        String datatypeUuid = datatypeUuids.get(datatypeName);
        if (datatypeUuid == null) {
            datatypeUuid = catalog.resolveDatatype(datatypeName)
                    .orElseThrow(() -> new UnknownTypeException(datatypeName, getName(), owner.getNaturalKey()));
            datatypeUuids.put(datatypeName, datatypeUuid);
            log.debug("Resolved datatype {} to {}", datatypeName, datatypeUuid);
        }

        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("title", nullToEmpty(child.value("label")));
        attributes.put("hasRange", datatypeUuid);
        return TargetAsset.builder()
                .type(CHILD_TYPE)
                .label(child.getCode())
                .description(nullToEmpty(child.value("description")))
                .status(getWriteStatus())
                .attributes(attributes)
                .build();
    }

    @Override
    public String childKeyOf(TargetAsset child) {
        return child.getLabel();
    }
}
