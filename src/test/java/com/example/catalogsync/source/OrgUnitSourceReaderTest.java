package com.example.catalogsync.source;

import com.example.catalogsync.engine.DuplicateGuard;
import com.example.catalogsync.enums.SyncSide;
import com.example.catalogsync.exception.DuplicateKeyException;
import com.example.catalogsync.model.SourceRecord;
import com.example.catalogsync.service.OdsClient;
import com.example.catalogsync.test.TestUtils;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OrgUnitSourceReaderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private OdsClient odsClient;

    private OrgUnitSourceReader reader;

    @BeforeEach
    void setUp() {
        reader = new OrgUnitSourceReader(odsClient, TestUtils.sourceApiConfig("http://localhost"));
    }

    @Test
    void testRead_BuildsParentChain() {
        when(odsClient.fetchRecords("100349", null)).thenReturn(List.of(
                unit("1", "Departement", null),
                unit("2", "Amt f. Umwelt", "1"),
                unit("3", "Abteilung Luft", "2")));

        Map<String, SourceRecord> records = byKey(reader.read());

        assertEquals(3, records.size());
        assertNull(records.get("1").getParentPath());
        assertNull(records.get("1").getParentKey());
        assertEquals("Departement", records.get("2").getParentPath());
        assertEquals("1", records.get("2").getParentKey());
        assertEquals("Departement/\"Amt f. Umwelt\"", records.get("3").getParentPath());
        assertEquals("2", records.get("3").getParentKey());
        assertEquals(2, records.get("3").depth());
        assertEquals("https://staatskalender.bs.ch/organization/3", records.get("3").field("url_website"));
    }

    @Test
    void testToRecords_UnknownParentsAndCyclesGoToRoot() {
        Map<String, SourceRecord> records = byKey(reader.toRecords(List.of(
                unit("4", "Verwaiste Stelle", "99"),
                unit("5", "Kreis A", "6"),
                unit("6", "Kreis B", "5"),
                unit("8", "Unter Kreis", "5"))));

        assertNull(records.get("4").getParentKey());
        assertNull(records.get("5").getParentKey());
        assertNull(records.get("6").getParentKey());
        assertEquals("5", records.get("8").getParentKey());
        assertEquals("Kreis A", records.get("8").getParentPath());
    }

    @Test
    void testToRecords_SkipsUnitsWithoutIdOrTitle() {
        List<SourceRecord> records = reader.toRecords(List.of(
                unit("1", "Departement", null),
                unit("", "Ohne Id", null),
                unit("2", " ", null)));

        assertEquals(1, records.size());
        assertEquals("1", records.get(0).getNaturalKey());
    }

    @Test
    void testToRecords_KeepsRepeatedIdsForDuplicateGuard() {
        List<SourceRecord> records = reader.toRecords(List.of(
                unit("1", "Departement", null),
                unit("7", "Amt A", "1"),
                unit("7", "Amt B", "1")));

        assertEquals(3, records.size());
        assertEquals(List.of("Amt A", "Amt B"), records.stream()
                .filter(record -> "7".equals(record.getNaturalKey()))
                .map(record -> record.field("title"))
                .collect(Collectors.toList()));

        DuplicateKeyException ex = assertThrows(DuplicateKeyException.class,
                () -> new DuplicateGuard().checkUnique("org-units", records, SourceRecord::getNaturalKey,
                        record -> record.field("title"), SyncSide.SOURCE));
        assertEquals(Map.of("7", List.of("Amt A", "Amt B")), ex.getCollisions());
    }

    private JsonNode unit(String id, String title, String parentId) {
        ObjectNode node = objectMapper.createObjectNode()
                .put("id", id)
                .put("title", title)
                .put("url_website", "https://staatskalender.bs.ch/organization/" + id);
        if (parentId == null) {
            node.putNull("parent_id");
        } else {
            node.put("parent_id", parentId);
        }
        return node;
    }

    private static Map<String, SourceRecord> byKey(List<SourceRecord> records) {
        return records.stream().collect(Collectors.toMap(SourceRecord::getNaturalKey, Function.identity()));
    }
}
