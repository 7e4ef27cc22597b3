package com.example.catalogsync.engine;

import com.example.catalogsync.enums.SyncSide;
import com.example.catalogsync.exception.DuplicateKeyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Verifies that natural keys are unique before anything is mutated.
 * The whole collection is scanned so that every collision is reported at once.
 */
@Component
public class DuplicateGuard {

    private static final Logger log = LoggerFactory.getLogger(DuplicateGuard.class);

    /**
     * @param family       family name for the error report
     * @param items        source records or live managed assets
     * @param keyExtractor natural key of an item; items without a key are ignored
     * @param idExtractor  identifier listed for colliding items (record label, asset UUID)
     * @param side         which side the items come from
     * @throws DuplicateKeyException listing every colliding key
     */
    public <T> void checkUnique(String family, Collection<T> items, Function<T, String> keyExtractor,
                                Function<T, String> idExtractor, SyncSide side) {
        Map<String, List<String>> idsByKey = new LinkedHashMap<>();
        for (T item : items) {
            String key = keyExtractor.apply(item);
            if (key == null || key.isBlank()) {
                continue;
            }
            idsByKey.computeIfAbsent(key, k -> new ArrayList<>()).add(idExtractor.apply(item));
        }

        Map<String, List<String>> collisions = new LinkedHashMap<>();
        idsByKey.forEach((key, ids) -> {
            if (ids.size() > 1) {
                collisions.put(key, ids);
            }
        });

        if (!collisions.isEmpty()) {
            DuplicateKeyException ex = new DuplicateKeyException(family, side, collisions);
            log.error(ex.getMessage());
            throw ex;
        }
        log.debug("{} {} keys are unique ({} items)", family, side, items.size());
    }
}
