package com.example.catalogsync.engine;

import com.example.catalogsync.enums.SyncSide;
import com.example.catalogsync.exception.DuplicateKeyException;
import com.example.catalogsync.model.SourceRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DuplicateGuardTest {

    private final DuplicateGuard guard = new DuplicateGuard();

    @Test
    void testCheckUnique_UniqueKeysPass() {
        List<SourceRecord> records = List.of(record("1", "A"), record("2", "B"), record("", "no key"));

        assertDoesNotThrow(() -> guard.checkUnique("org-units", records, SourceRecord::getNaturalKey,
                r -> r.field("title"), SyncSide.SOURCE));
    }

    @Test
    void testCheckUnique_ReportsEveryCollision() {
        List<SourceRecord> records = List.of(
                record("1", "A"), record("1", "A bis"),
                record("2", "B"),
                record("3", "C"), record("3", "C bis"), record("3", "C ter"));

        DuplicateKeyException ex = assertThrows(DuplicateKeyException.class,
                () -> guard.checkUnique("org-units", records, SourceRecord::getNaturalKey,
                        r -> r.field("title"), SyncSide.SOURCE));

        assertEquals(SyncSide.SOURCE, ex.getSide());
        assertEquals("org-units", ex.getFamily());
        assertEquals(Map.of("1", List.of("A", "A bis"), "3", List.of("C", "C bis", "C ter")), ex.getCollisions());
        assertTrue(ex.getMessage().contains("'3'"));
    }

    private static SourceRecord record(String key, String title) {
        return SourceRecord.builder().naturalKey(key).field("title", title).build();
    }
}
