package com.example.catalogsync.family;

import com.example.catalogsync.model.ChildItem;
import com.example.catalogsync.model.SourceRecord;
import com.example.catalogsync.model.TargetAsset;
import com.example.catalogsync.test.TestUtils;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LawFamilyTest {

    private final LawFamily family = new LawFamily(TestUtils.syncConfig());

    @Test
    void testNormalizeSystematicNumber() {
        assertEquals("152.100", LawFamily.normalizeSystematicNumber(" 152.100 "));
        assertEquals("152.100", LawFamily.normalizeSystematicNumber("\"'152.100'\""));
        assertEquals("'152.100", LawFamily.normalizeSystematicNumber("'152.100"));
        assertEquals("", LawFamily.normalizeSystematicNumber(null));
    }

    @Test
    void testToDesiredAssetAndChild() {
        SourceRecord law = SourceRecord.builder()
                .naturalKey("152.100")
                .field("title_de", "Gesetz über die Information und den Datenschutz")
                .field("original_url_de", "https://www.gesetzessammlung.bs.ch/app/de/texts_of_law/152.100")
                .build();

        TargetAsset desired = family.toDesiredAsset(law);
        TargetAsset paragraph = family.toDesiredChild(law,
                ChildItem.builder().code("3").value("shortText", "Begriffe").build());

        assertEquals("ReferenceObject", desired.getType());
        assertEquals("SG 152.100 - Gesetz über die Information und den Datenschutz", desired.getLabel());
        assertEquals("https://www.gesetzessammlung.bs.ch/app/de/texts_of_law/152.100", desired.getDescription());
        assertEquals("152.100", desired.customProperty(LawFamily.KEY_FIELD));
        assertEquals("ReferenceValue", paragraph.getType());
        assertEquals("3", family.childKeyOf(paragraph));
        assertEquals("Begriffe", paragraph.attribute("shortText"));
        assertTrue(family.isComposite());
    }
}
