package com.example.catalogsync.engine;

import com.example.catalogsync.dto.FieldChange;
import com.example.catalogsync.model.TargetAsset;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Field-level comparison of a live asset against its desired state.
 * <p>
 * Values are compared trimmed, with null and empty treated as equal. Only fields the desired asset
 * sets are compared: a null label, description or stereotype on the desired side is not managed.
 * Attributes and custom properties are compared per desired key in sorted order.
 */
public final class FieldDiff {

    public static final String LABEL = "label";
    public static final String DESCRIPTION = "description";
    public static final String STEREOTYPE = "stereotype";
    public static final String STATUS = "status";
    public static final String PARENT = "inCollection";

    private FieldDiff() {
    }

    public static String normalize(String value) {
        return value == null ? "" : value.trim();
    }

    public static boolean same(String left, String right) {
        return normalize(left).equals(normalize(right));
    }

    /**
     * Differences between live and desired values. A live asset flagged for review also yields a status change,
     * which restores it.
     */
    public static List<FieldChange> diff(TargetAsset live, TargetAsset desired) {
        List<FieldChange> changes = new ArrayList<>();
        compare(changes, LABEL, live.getLabel(), desired.getLabel());
        compare(changes, DESCRIPTION, live.getDescription(), desired.getDescription());
        compare(changes, STEREOTYPE, live.getStereotype(), desired.getStereotype());
        compareMap(changes, live.getAttributes(), desired.getAttributes());
        compareMap(changes, live.getCustomProperties(), desired.getCustomProperties());

        if (live.isMarkedForReview() && desired.getStatus() != null) {
            changes.add(FieldChange.of(STATUS, live.getStatus().getWireValue(), desired.getStatus().getWireValue()));
        }
        return changes;
    }

    private static void compare(List<FieldChange> changes, String field, String liveValue, String desiredValue) {
        if (desiredValue == null) {
            return;
        }
        if (!same(liveValue, desiredValue)) {
            changes.add(FieldChange.of(field, normalize(liveValue), normalize(desiredValue)));
        }
    }

    private static void compareMap(List<FieldChange> changes, Map<String, String> live, Map<String, String> desired) {
        if (desired == null || desired.isEmpty()) {
            return;
        }
        Map<String, String> sorted = new TreeMap<>(desired);
        for (Map.Entry<String, String> entry : sorted.entrySet()) {
            String liveValue = live == null ? null : live.get(entry.getKey());
            String desiredValue = entry.getValue() == null ? "" : entry.getValue();
            compare(changes, entry.getKey(), liveValue, desiredValue);
        }
    }
}
