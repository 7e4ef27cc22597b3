package com.example.catalogsync.exception;

import com.example.catalogsync.enums.SyncSide;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Natural keys are not unique on one side of a sync. Fatal for the whole run.
 */
public class DuplicateKeyException extends CatalogSyncException {

    private final SyncSide side;
    private final Map<String, List<String>> collisions;

    public DuplicateKeyException(String family, SyncSide side, Map<String, List<String>> collisions) {
        super(buildMessage(family, side, collisions), family, null);
        this.side = side;
        this.collisions = Collections.unmodifiableMap(new LinkedHashMap<>(collisions));
    }

    public SyncSide getSide() {
        return side;
    }

    /**
     * Colliding natural keys mapped to the identifiers of the items sharing them.
     */
    public Map<String, List<String>> getCollisions() {
        return collisions;
    }

    private static String buildMessage(String family, SyncSide side, Map<String, List<String>> collisions) {
        String details = collisions.entrySet().stream()
                .map(e -> "'" + e.getKey() + "' -> " + e.getValue())
                .collect(Collectors.joining("; "));
        return "Duplicate natural keys detected in " + side.name().toLowerCase()
                + " data for " + family + " (" + collisions.size() + " keys): " + details;
    }
}
