package com.example.catalogsync.source;

import com.example.catalogsync.config.SourceApiConfig;
import com.example.catalogsync.config.SyncConfig;
import com.example.catalogsync.model.CatalogPaths;
import com.example.catalogsync.model.SourceRecord;
import com.example.catalogsync.service.OdsClient;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads the org-unit tree of the staff directory.
 * <p>
 * Each unit is nested below its parent unit. Units whose parent is unknown, or that are part of a
 * parent cycle, are placed at the scope root.
 */
@Component
public class OrgUnitSourceReader implements SourceReader {

    private static final Logger log = LoggerFactory.getLogger(OrgUnitSourceReader.class);

    private final OdsClient odsClient;
    private final SourceApiConfig sourceConfig;

    public OrgUnitSourceReader(OdsClient odsClient, SourceApiConfig sourceConfig) {
        this.odsClient = odsClient;
        this.sourceConfig = sourceConfig;
    }

    @Override
    public String getFamily() {
        return SyncConfig.ORG_UNITS;
    }

    @Override
    public List<SourceRecord> read() {
        return toRecords(odsClient.fetchRecords(sourceConfig.getOrgUnitsDatasetId(), null));
    }

    /**
     * Build the records of the unit tree from raw directory rows.
     * Rows repeating an id are all emitted; the parent chain is resolved from the first row of each id.
     */
    public List<SourceRecord> toRecords(List<JsonNode> rows) {
        Map<String, JsonNode> units = new LinkedHashMap<>();
        List<JsonNode> keyed = new ArrayList<>();
        List<JsonNode> withoutKey = new ArrayList<>();
        for (JsonNode row : rows) {
            String id = text(row, "id");
            String title = text(row, "title");
            if (id.isEmpty() || title.isEmpty()) {
                withoutKey.add(row);
                continue;
            }
            keyed.add(row);
            units.putIfAbsent(id, row);
        }
        if (!withoutKey.isEmpty()) {
            log.warn("Skipped {} org units without id or title", withoutKey.size());
        }

        Map<String, String> effectiveParent = new LinkedHashMap<>();
        for (Map.Entry<String, JsonNode> unit : units.entrySet()) {
            String id = unit.getKey();
            String parentId = text(unit.getValue(), "parent_id");
            if (parentId.isEmpty()) {
                continue;
            }
            if (!units.containsKey(parentId)) {
                log.warn("Org unit {} ('{}') references unknown parent {}, placing it at the root",
                        id, text(unit.getValue(), "title"), parentId);
                continue;
            }
            if (isInCycle(id, units)) {
                log.warn("Org unit {} ('{}') is part of a parent cycle, placing it at the root",
                        id, text(unit.getValue(), "title"));
                continue;
            }
            effectiveParent.put(id, parentId);
        }

        List<SourceRecord> records = new ArrayList<>();
        for (JsonNode row : keyed) {
            String id = text(row, "id");

            List<String> ancestors = new ArrayList<>();
            String parent = effectiveParent.get(id);
            while (parent != null) {
                ancestors.add(CatalogPaths.escape(text(units.get(parent), "title")));
                parent = effectiveParent.get(parent);
            }
            Collections.reverse(ancestors);

            records.add(SourceRecord.builder()
                    .naturalKey(id)
                    .field("title", text(row, "title"))
                    .field("url_website", text(row, "url_website"))
                    .parentKey(effectiveParent.get(id))
                    .parentPath(ancestors.isEmpty() ? null : CatalogPaths.join(ancestors))
                    .build());
        }
        log.info("Read {} org units", records.size());
        return records;
    }

    private static boolean isInCycle(String id, Map<String, JsonNode> units) {
        Set<String> visited = new HashSet<>();
        String current = id;
        while (current != null && units.containsKey(current)) {
            if (!visited.add(current)) {
                return current.equals(id);
            }
            String parentId = text(units.get(current), "parent_id");
            if (parentId.equals(id)) {
                return true;
            }
            current = parentId.isEmpty() ? null : parentId;
        }
        return false;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? "" : value.asText().trim();
    }
}
