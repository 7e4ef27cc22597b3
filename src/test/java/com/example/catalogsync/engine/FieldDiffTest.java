package com.example.catalogsync.engine;

import com.example.catalogsync.dto.FieldChange;
import com.example.catalogsync.enums.AssetStatus;
import com.example.catalogsync.model.TargetAsset;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FieldDiffTest {

    @Test
    void testDiff_IgnoresWhitespaceAndNullVersusEmpty() {
        TargetAsset live = asset(" Amt für Umwelt ", null, Map.of("title", "Name"));
        TargetAsset desired = asset("Amt für Umwelt", "", Map.of("title", "Name "));

        assertTrue(FieldDiff.diff(live, desired).isEmpty());
    }

    @Test
    void testDiff_ReportsChangedFieldsWithOldAndNewValue() {
        TargetAsset live = asset("Old", "d", Map.of("physicalName", "100001", "title", "A"));
        TargetAsset desired = asset("New", "d", Map.of("physicalName", "100001", "title", "B"));

        List<FieldChange> changes = FieldDiff.diff(live, desired);

        assertEquals(List.of(
                FieldChange.of(FieldDiff.LABEL, "Old", "New"),
                FieldChange.of("title", "A", "B")), changes);
    }

    @Test
    void testDiff_FieldsAbsentFromDesiredAreNotCompared() {
        TargetAsset live = asset("Label", "live description", Map.of("extra", "x"));
        live.getCustomProperties().put("owned_by_someone_else", "y");
        TargetAsset desired = TargetAsset.builder().label("Label").build();

        assertTrue(FieldDiff.diff(live, desired).isEmpty());
    }

    @Test
    void testDiff_FlaggedAssetGetsStatusRestored() {
        TargetAsset live = asset("Label", null, Map.of());
        live.setStatus(AssetStatus.MARKED_FOR_REVIEW);
        TargetAsset desired = asset("Label", null, Map.of());
        desired.setStatus(AssetStatus.WORKING);

        assertEquals(List.of(FieldChange.of(FieldDiff.STATUS, "DELETENEW", "WORKING")), FieldDiff.diff(live, desired));
    }

    @Test
    void testDiff_PublishedAssetKeepsItsStatus() {
        TargetAsset live = asset("Label", null, Map.of());
        live.setStatus(AssetStatus.PUBLISHED);
        TargetAsset desired = asset("Label", null, Map.of());
        desired.setStatus(AssetStatus.WORKING);

        assertTrue(FieldDiff.diff(live, desired).isEmpty());
    }

    private static TargetAsset asset(String label, String description, Map<String, String> attributes) {
        return TargetAsset.builder()
                .label(label)
                .description(description)
                .attributes(new LinkedHashMap<>(attributes))
                .build();
    }
}
