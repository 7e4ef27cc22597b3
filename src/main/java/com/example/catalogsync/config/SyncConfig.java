package com.example.catalogsync.config;

import com.example.catalogsync.enums.AssetStatus;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration of the reconciliation runs: mapping file location, pacing, adoption of unmapped assets
 * and, per entity family, the target scheme, the scope collection path, the write status and the enabled flag.
 */
@Configuration
public class SyncConfig {

    public static final String ORG_UNITS = "org-units";
    public static final String DATASET_COMPOSITIONS = "dataset-compositions";
    public static final String LAWS = "laws";

    @Value("${catalog-sync.mapping-dir:./mappings}")
    private String mappingDir;

    @Value("${catalog-sync.pacing-delay-ms:1000}")
    private long pacingDelayMs;

    @Value("${catalog-sync.adopt-unmapped-assets:true}")
    private boolean adoptUnmappedAssets;

    @Value("${catalog-sync.org-units.enabled:true}")
    private boolean orgUnitsEnabled;

    @Value("${catalog-sync.org-units.scheme:Datenprodukte}")
    private String orgUnitsScheme;

    @Value("${catalog-sync.org-units.scope-path:}")
    private String orgUnitsScopePath;

    @Value("${catalog-sync.org-units.write-status:WORKING}")
    private String orgUnitsWriteStatus;

    @Value("${catalog-sync.dataset-compositions.enabled:true}")
    private boolean datasetCompositionsEnabled;

    @Value("${catalog-sync.dataset-compositions.scheme:Datenbankobjekte}")
    private String datasetCompositionsScheme;

    @Value("${catalog-sync.dataset-compositions.scope-path:OGD-Datensätze aus ODS}")
    private String datasetCompositionsScopePath;

    @Value("${catalog-sync.dataset-compositions.write-status:WORKING}")
    private String datasetCompositionsWriteStatus;

    @Value("${catalog-sync.laws.enabled:true}")
    private boolean lawsEnabled;

    @Value("${catalog-sync.laws.scheme:Referenzdaten}")
    private String lawsScheme;

    @Value("${catalog-sync.laws.scope-path:Systematische Gesetzessammlung}")
    private String lawsScopePath;

    @Value("${catalog-sync.laws.write-status:WORKING}")
    private String lawsWriteStatus;

    public String getMappingDir() {
        return mappingDir;
    }

    public long getPacingDelayMs() {
        return pacingDelayMs;
    }

    public boolean isAdoptUnmappedAssets() {
        return adoptUnmappedAssets;
    }

    public boolean isEnabled(String family) {
        return switch (family) {
            case ORG_UNITS -> orgUnitsEnabled;
            case DATASET_COMPOSITIONS -> datasetCompositionsEnabled;
            case LAWS -> lawsEnabled;
            default -> false;
        };
    }

    public String getScheme(String family) {
        return switch (family) {
            case ORG_UNITS -> orgUnitsScheme;
            case DATASET_COMPOSITIONS -> datasetCompositionsScheme;
            case LAWS -> lawsScheme;
            default -> throw new IllegalArgumentException("Unknown family: " + family);
        };
    }

    /**
     * Escaped business-key path of the collection that bounds the family, relative to its scheme.
     * Empty means the scheme root.
     */
    public String getScopePath(String family) {
        return switch (family) {
            case ORG_UNITS -> orgUnitsScopePath;
            case DATASET_COMPOSITIONS -> datasetCompositionsScopePath;
            case LAWS -> lawsScopePath;
            default -> throw new IllegalArgumentException("Unknown family: " + family);
        };
    }

    /**
     * Status written on created and updated assets. Unknown values fall back to WORKING.
     */
    public AssetStatus getWriteStatus(String family) {
        String value = switch (family) {
            case ORG_UNITS -> orgUnitsWriteStatus;
            case DATASET_COMPOSITIONS -> datasetCompositionsWriteStatus;
            case LAWS -> lawsWriteStatus;
            default -> null;
        };
        AssetStatus status = AssetStatus.fromWireValue(value);
        return status == null || status == AssetStatus.MARKED_FOR_REVIEW ? AssetStatus.WORKING : status;
    }
}
