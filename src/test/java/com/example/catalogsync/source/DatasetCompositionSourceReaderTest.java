package com.example.catalogsync.source;

import com.example.catalogsync.model.ChildItem;
import com.example.catalogsync.model.SourceRecord;
import com.example.catalogsync.service.OdsClient;
import com.example.catalogsync.test.TestUtils;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DatasetCompositionSourceReaderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void testToRecords_MapsDatasetFieldsToChildren() throws Exception {
        DatasetCompositionSourceReader reader = new DatasetCompositionSourceReader(
                mock(OdsClient.class), TestUtils.sourceApiConfig("http://localhost"));

        List<SourceRecord> records = reader.toRecords(List.of(objectMapper.readTree("""
            {
              "dataset_id": "100042",
              "metas": {"default": {"title": "Bäume im Stadtgebiet"}},
              "fields": [
                {"name": "baum_id", "label": "Baum-ID", "type": "int", "description": "Eindeutige Nummer"},
                {"name": "geo_point_2d", "label": "Standort", "type": "geo_point_2d", "description": null},
                {"label": "ohne Namen", "type": "text"}
              ]
            }
            """), objectMapper.readTree("{\"metas\": {\"default\": {\"title\": \"ohne Id\"}}}")));

        assertEquals(1, records.size());
        SourceRecord dataset = records.get(0);
        assertEquals("100042", dataset.getNaturalKey());
        assertEquals("Bäume im Stadtgebiet", dataset.field("title"));
        assertEquals(2, dataset.getChildren().size());
        ChildItem first = dataset.getChildren().get(0);
        assertEquals("baum_id", first.getCode());
        assertEquals("Baum-ID", first.value("label"));
        assertEquals("int", first.value("type"));
        assertEquals("Eindeutige Nummer", first.value("description"));
        assertEquals("", dataset.getChildren().get(1).value("description"));
    }
}
