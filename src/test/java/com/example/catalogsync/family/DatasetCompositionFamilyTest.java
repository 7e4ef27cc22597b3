package com.example.catalogsync.family;

import com.example.catalogsync.config.SyncConfig;
import com.example.catalogsync.enums.AssetStatus;
import com.example.catalogsync.exception.UnknownTypeException;
import com.example.catalogsync.model.ChildItem;
import com.example.catalogsync.model.SourceRecord;
import com.example.catalogsync.model.TargetAsset;
import com.example.catalogsync.service.CatalogAccessor;
import com.example.catalogsync.test.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DatasetCompositionFamilyTest {

    private static final String TEXT_UUID = "0c1f6b3e-6f2d-4c39-9f0a-5d1b2c3d4e5f";

    @Mock
    private CatalogAccessor catalog;

    private DatasetCompositionFamily family;
    private SourceRecord dataset;

    @BeforeEach
    void setUp() {
        family = new DatasetCompositionFamily(TestUtils.syncConfig(), TestUtils.sourceApiConfig("http://localhost"), catalog);
        dataset = SourceRecord.builder()
                .naturalKey("100042")
                .field("title", "Bäume im Stadtgebiet")
                .build();
    }

    @Test
    void testToDesiredAsset() {
        TargetAsset desired = family.toDesiredAsset(dataset);

        assertEquals("UmlClass", desired.getType());
        assertEquals(DatasetCompositionFamily.STEREOTYPE, desired.getStereotype());
        assertEquals("Bäume im Stadtgebiet", desired.getLabel());
        assertEquals("100042", desired.attribute("physicalName"));
        assertEquals("100042", desired.customProperty(DatasetCompositionFamily.KEY_FIELD));
        assertEquals("https://data.bs.ch/explore/dataset/100042/",
                desired.customProperty(DatasetCompositionFamily.LINK_FIELD));
        assertEquals(AssetStatus.WORKING, desired.getStatus());
        assertEquals("OGD-Datensätze aus ODS", family.getScopePath());
        assertEquals(SyncConfig.DATASET_COMPOSITIONS, family.getName());
    }

    @Test
    void testToDesiredChild_ResolvesDatatypeOncePerRun() {
        when(catalog.resolveDatatype("Zeichenkette")).thenReturn(Optional.of(TEXT_UUID));

        TargetAsset first = family.toDesiredChild(dataset, column("art", "text"));
        TargetAsset second = family.toDesiredChild(dataset, column("gattung", "json_blob"));

        assertEquals("UmlAttribute", first.getType());
        assertEquals("art", first.getLabel());
        assertEquals("ART", first.attribute("title"));
        assertEquals(TEXT_UUID, first.attribute("hasRange"));
        assertEquals(TEXT_UUID, second.attribute("hasRange"));
        verify(catalog, times(1)).resolveDatatype("Zeichenkette");

        family.prepareRun();
        family.toDesiredChild(dataset, column("art", "text"));
        verify(catalog, times(2)).resolveDatatype("Zeichenkette");
    }

    @Test
    void testToDesiredChild_UnknownFieldType() {
        UnknownTypeException ex = assertThrows(UnknownTypeException.class,
                () -> family.toDesiredChild(dataset, column("raster", "raster_image")));

        assertEquals("raster_image", ex.getTypeName());
        assertEquals("100042", ex.getNaturalKey());
        verifyNoInteractions(catalog);
    }

    @Test
    void testToDesiredChild_DatatypeMissingInCatalog() {
        when(catalog.resolveDatatype("Ganzzahl")).thenReturn(Optional.empty());

        assertThrows(UnknownTypeException.class, () -> family.toDesiredChild(dataset, column("anzahl", "int")));
    }

    @Test
    void testIsManaged() {
        TargetAsset managed = family.toDesiredAsset(dataset);
        TargetAsset foreign = managed.toBuilder().stereotype("other").build();
        TargetAsset withoutKey = TargetAsset.builder().type("UmlClass").stereotype(DatasetCompositionFamily.STEREOTYPE).build();

        assertTrue(family.isManaged(managed));
        assertFalse(family.isManaged(foreign));
        assertFalse(family.isManaged(withoutKey));
        assertEquals("100042", family.naturalKeyOf(managed));
    }

    @Test
    void testDatatypeNameOf() {
        assertEquals(Optional.of("Binärdaten"), DatasetCompositionFamily.datatypeNameOf("file"));
        assertEquals(Optional.of("Datum"), DatasetCompositionFamily.datatypeNameOf(" DATE "));
        assertTrue(DatasetCompositionFamily.datatypeNameOf("").isEmpty());
    }

    private static ChildItem column(String name, String type) {
        return ChildItem.builder()
                .code(name)
                .value("label", name.toUpperCase())
                .value("type", type)
                .value("description", "")
                .build();
    }
}
