package com.example.catalogsync.source;

import com.example.catalogsync.config.SourceApiConfig;
import com.example.catalogsync.config.SyncConfig;
import com.example.catalogsync.model.ChildItem;
import com.example.catalogsync.model.SourceRecord;
import com.example.catalogsync.service.OdsClient;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the published datasets of the open-data portal together with their field definitions.
 */
@Component
public class DatasetCompositionSourceReader implements SourceReader {

    private static final Logger log = LoggerFactory.getLogger(DatasetCompositionSourceReader.class);

    private final OdsClient odsClient;
    private final SourceApiConfig sourceConfig;

    public DatasetCompositionSourceReader(OdsClient odsClient, SourceApiConfig sourceConfig) {
        this.odsClient = odsClient;
        this.sourceConfig = sourceConfig;
    }

    @Override
    public String getFamily() {
        return SyncConfig.DATASET_COMPOSITIONS;
    }

    @Override
    public List<SourceRecord> read() {
        return toRecords(odsClient.fetchDatasets(sourceConfig.getDatasetsFilter()));
    }

    public List<SourceRecord> toRecords(List<JsonNode> datasets) {
        List<SourceRecord> records = new ArrayList<>();
        int skipped = 0;
        for (JsonNode dataset : datasets) {
            String datasetId = text(dataset, "dataset_id");
            if (datasetId.isEmpty()) {
                skipped++;
                continue;
            }
            String title = text(dataset.path("metas").path("default"), "title");
            if (title.isEmpty()) {
                log.warn("Dataset {} has no title, using its id as label", datasetId);
                title = datasetId;
            }

            SourceRecord.SourceRecordBuilder builder = SourceRecord.builder()
                    .naturalKey(datasetId)
                    .field("title", title);
            for (JsonNode field : dataset.path("fields")) {
                String name = text(field, "name");
                if (name.isEmpty()) {
                    log.warn("Dataset {} contains a field without name, ignoring it", datasetId);
                    continue;
                }
                builder.child(ChildItem.builder()
                        .code(name)
                        .value("label", text(field, "label"))
                        .value("type", text(field, "type"))
                        .value("description", text(field, "description"))
                        .build());
            }
            records.add(builder.build());
        }
        if (skipped > 0) {
            log.warn("Skipped {} datasets without dataset_id", skipped);
        }
        log.info("Read {} dataset compositions", records.size());
        return records;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "" : value.asText().trim();
    }
}
