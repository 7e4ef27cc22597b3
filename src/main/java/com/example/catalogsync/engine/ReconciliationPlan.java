package com.example.catalogsync.engine;

import com.example.catalogsync.dto.SyncError;
import com.example.catalogsync.enums.MutationType;
import com.example.catalogsync.family.EntityFamily;
import com.example.catalogsync.model.MappingEntry;
import com.example.catalogsync.model.TargetAsset;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * The mutations one reconciliation run will apply, in order: creates and updates parents first,
 * then deletions deepest first.
 */
public class ReconciliationPlan {

    private final EntityFamily family;
    private final TargetAsset scopeRoot;
    private final List<Mutation> upserts = new ArrayList<>();
    private final List<Mutation> deletions = new ArrayList<>();
    private final List<MappingEntry> staleEntries = new ArrayList<>();
    private final List<SyncError> errors = new ArrayList<>();

    public ReconciliationPlan(EntityFamily family, TargetAsset scopeRoot) {
        this.family = family;
        this.scopeRoot = scopeRoot;
    }

    public void addUpsert(Mutation mutation) {
        upserts.add(mutation);
    }

    public void addDeletion(Mutation mutation) {
        deletions.add(mutation);
    }

    public void addStaleEntry(MappingEntry entry) {
        staleEntries.add(entry);
    }

    public void addError(SyncError error) {
        errors.add(error);
    }

    public EntityFamily getFamily() {
        return family;
    }

    public TargetAsset getScopeRoot() {
        return scopeRoot;
    }

    public List<Mutation> getUpserts() {
        List<Mutation> ordered = new ArrayList<>(upserts);
        ordered.sort(Comparator.comparingInt(Mutation::getDepth));
        return Collections.unmodifiableList(ordered);
    }

    public List<Mutation> getDeletions() {
        List<Mutation> ordered = new ArrayList<>(deletions);
        ordered.sort(Comparator.comparingInt(Mutation::getDepth).reversed());
        return Collections.unmodifiableList(ordered);
    }

    public List<MappingEntry> getStaleEntries() {
        return Collections.unmodifiableList(staleEntries);
    }

    public List<SyncError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public long countOf(MutationType type) {
        return upserts.stream().filter(m -> m.getType() == type).count()
                + deletions.stream().filter(m -> m.getType() == type).count();
    }
}
