package com.example.catalogsync.test;

import com.example.catalogsync.config.SourceApiConfig;
import com.example.catalogsync.config.SyncConfig;

/**
 * Utility class for test helpers.
 */
public class TestUtils {

    /**
     * Set a private field value using reflection.
     * Used to populate {@code @Value}-injected config classes outside a Spring context.
     *
     * @param target The object containing the field
     * @param fieldName The name of the field to set
     * @param value The value to set
     * @throws RuntimeException if the field cannot be accessed or set
     */
    public static void setPrivateField(Object target, String fieldName, Object value) {
        try {
            java.lang.reflect.Field field = target.getClass().getDeclaredField(fieldName);
            field.setAccessible(true);
            field.set(target, value);
        } catch (Exception e) {
            throw new RuntimeException("Failed to set field " + fieldName, e);
        }
    }

    /**
     * Sync configuration with the defaults of application.yml, no pacing and adoption enabled.
     */
    public static SyncConfig syncConfig() {
        SyncConfig config = new SyncConfig();
        setPrivateField(config, "mappingDir", "target/test-mappings");
        setPrivateField(config, "pacingDelayMs", 0L);
        setPrivateField(config, "adoptUnmappedAssets", true);
        setPrivateField(config, "orgUnitsEnabled", true);
        setPrivateField(config, "orgUnitsScheme", "Datenprodukte");
        setPrivateField(config, "orgUnitsScopePath", "");
        setPrivateField(config, "orgUnitsWriteStatus", "WORKING");
        setPrivateField(config, "datasetCompositionsEnabled", true);
        setPrivateField(config, "datasetCompositionsScheme", "Datenbankobjekte");
        setPrivateField(config, "datasetCompositionsScopePath", "OGD-Datensätze aus ODS");
        setPrivateField(config, "datasetCompositionsWriteStatus", "WORKING");
        setPrivateField(config, "lawsEnabled", true);
        setPrivateField(config, "lawsScheme", "Referenzdaten");
        setPrivateField(config, "lawsScopePath", "Systematische Gesetzessammlung");
        setPrivateField(config, "lawsWriteStatus", "WORKING");
        return config;
    }

    public static SourceApiConfig sourceApiConfig(String baseUrl) {
        SourceApiConfig config = new SourceApiConfig();
        setPrivateField(config, "baseUrl", baseUrl);
        setPrivateField(config, "pageSize", 2);
        setPrivateField(config, "connectionTimeout", 5000);
        setPrivateField(config, "readTimeout", 5000);
        setPrivateField(config, "orgUnitsDatasetId", "100349");
        setPrivateField(config, "lawsDatasetId", "100354");
        setPrivateField(config, "lawsFilter", "is_active=true AND info_badge='current'");
        setPrivateField(config, "datasetsFilter", "");
        setPrivateField(config, "datasetLinkTemplate", "https://data.bs.ch/explore/dataset/%s/");
        return config;
    }

    private TestUtils() {
        // Utility class - prevent instantiation
    }
}
