package com.example.catalogsync.service;

import com.example.catalogsync.exception.CatalogSyncException;
import com.example.catalogsync.model.MappingEntry;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Persistent natural key to catalog UUID mapping of one entity family.
 * <p>
 * The store is loaded fully from its CSV file, changed in memory during a run and rewritten
 * in one go by {@link #persist()}. A missing file is an empty store.
 */
public class IdentityMappingStore {

    private static final Logger log = LoggerFactory.getLogger(IdentityMappingStore.class);

    private static final Pattern UUID_PATTERN =
            Pattern.compile("^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private static final CsvMapper CSV_MAPPER = new CsvMapper();
    private static final CsvSchema SCHEMA = CSV_MAPPER.schemaFor(MappingEntry.class).withHeader();

    private final Path file;
    private final Map<String, MappingEntry> entries = new TreeMap<>();
    private boolean dirty;

    public IdentityMappingStore(Path file) {
        this.file = file;
    }

    /**
     * Load the store from its file. Rows that fail validation are skipped with a warning.
     */
    public static IdentityMappingStore load(Path file) {
        IdentityMappingStore store = new IdentityMappingStore(file);
        if (!Files.exists(file)) {
            log.info("Mapping file {} does not exist yet, starting with an empty mapping", file);
            return store;
        }

        try (MappingIterator<MappingEntry> rows = CSV_MAPPER.readerFor(MappingEntry.class).with(SCHEMA).readValues(file.toFile())) {
            while (rows.hasNext()) {
                MappingEntry entry = rows.next();
                try {
                    validate(entry);
                    store.entries.put(entry.getNaturalKey(), entry);
                } catch (IllegalArgumentException e) {
                    log.warn("Skipping invalid row in mapping file {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new CatalogSyncException("Failed to read mapping file " + file + ": " + e.getMessage(), e);
        }
        log.info("Loaded {} mapping entries from {}", store.entries.size(), file);
        return store;
    }

    public Optional<MappingEntry> get(String naturalKey) {
        return Optional.ofNullable(entries.get(naturalKey));
    }

    /**
     * Insert or replace the entry for its natural key.
     *
     * @throws IllegalArgumentException on an empty key, type or UUID, or a malformed UUID
     */
    public void put(MappingEntry entry) {
        validate(entry);
        MappingEntry normalized = entry.toBuilder()
                .parentCollectionPath(entry.getParentCollectionPath() == null ? "" : entry.getParentCollectionPath())
                .build();
        MappingEntry previous = entries.put(normalized.getNaturalKey(), normalized);
        if (!normalized.equals(previous)) {
            dirty = true;
        }
    }

    public Optional<MappingEntry> remove(String naturalKey) {
        MappingEntry removed = entries.remove(naturalKey);
        if (removed != null) {
            dirty = true;
        }
        return Optional.ofNullable(removed);
    }

    /**
     * All entries, sorted by natural key.
     */
    public List<MappingEntry> all() {
        return new ArrayList<>(entries.values());
    }

    public int size() {
        return entries.size();
    }

    public boolean isDirty() {
        return dirty;
    }

    /**
     * Rewrite the whole file through a temporary file and an atomic move.
     */
    public void persist() {
        try {
            Path dir = file.toAbsolutePath().getParent();
            Files.createDirectories(dir);
            Path temp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8);
                 SequenceWriter rows = CSV_MAPPER.writer(SCHEMA).writeValues(writer)) {
                rows.writeAll(entries.values());
            }
            try {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            dirty = false;
            log.info("Persisted {} mapping entries to {}", entries.size(), file);
        } catch (IOException e) {
            throw new CatalogSyncException("Failed to write mapping file " + file + ": " + e.getMessage(), e);
        }
    }

    private static void validate(MappingEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("Mapping entry must not be null");
        }
        if (isBlank(entry.getNaturalKey())) {
            throw new IllegalArgumentException("Natural key must not be empty");
        }
        if (isBlank(entry.getAssetType())) {
            throw new IllegalArgumentException("Asset type must not be empty for key '" + entry.getNaturalKey() + "'");
        }
        if (isBlank(entry.getTargetUuid())) {
            throw new IllegalArgumentException("UUID must not be empty for key '" + entry.getNaturalKey() + "'");
        }
        if (!UUID_PATTERN.matcher(entry.getTargetUuid().trim()).matches()) {
            throw new IllegalArgumentException("Invalid UUID format '" + entry.getTargetUuid()
                    + "' for key '" + entry.getNaturalKey() + "'");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
