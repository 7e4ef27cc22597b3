package com.example.catalogsync.engine;

import com.example.catalogsync.config.SyncConfig;
import com.example.catalogsync.dto.FieldChange;
import com.example.catalogsync.dto.ItemChange;
import com.example.catalogsync.dto.SyncError;
import com.example.catalogsync.enums.ChangeType;
import com.example.catalogsync.enums.DeletionDecision;
import com.example.catalogsync.enums.MutationType;
import com.example.catalogsync.exception.CatalogSyncException;
import com.example.catalogsync.exception.RemoteException;
import com.example.catalogsync.exception.UnknownTypeException;
import com.example.catalogsync.family.EntityFamily;
import com.example.catalogsync.model.ChildItem;
import com.example.catalogsync.model.MappingEntry;
import com.example.catalogsync.model.SourceRecord;
import com.example.catalogsync.model.TargetAsset;
import com.example.catalogsync.service.CatalogAccessor;
import com.example.catalogsync.service.IdentityMappingStore;
import com.example.catalogsync.service.RequestPacer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Generic reconciliation of source records against the live catalog through the identity mapping.
 * <p>
 * {@link #plan} only reads: it re-verifies mapped assets, diffs fields and child items and classifies
 * delete candidates. {@link #apply} performs the mutations and updates the mapping after each
 * acknowledged catalog call. A failure on one item is recorded and the run continues.
 */
@Component
public class Reconciler {

    private static final Logger log = LoggerFactory.getLogger(Reconciler.class);

    private final CatalogAccessor catalog;
    private final DeletionPolicy deletionPolicy;
    private final RequestPacer pacer;
    private final SyncConfig syncConfig;

    public Reconciler(CatalogAccessor catalog, DeletionPolicy deletionPolicy, RequestPacer pacer, SyncConfig syncConfig) {
        this.catalog = catalog;
        this.deletionPolicy = deletionPolicy;
        this.pacer = pacer;
        this.syncConfig = syncConfig;
    }

    public RunState reconcile(EntityFamily family, List<SourceRecord> records, IdentityMappingStore mapping,
                              LiveSubtree live) {
        RunState state = new RunState(family.getName());
        ReconciliationPlan plan = plan(family, records, mapping, live);
        apply(plan, mapping, state);
        return state;
    }

    // ======================== Planning ========================

    public ReconciliationPlan plan(EntityFamily family, List<SourceRecord> records, IdentityMappingStore mapping,
                                   LiveSubtree live) {
        ReconciliationPlan plan = new ReconciliationPlan(family, live.getRoot());

        Map<String, TargetAsset> managedByKey = new HashMap<>();
        for (TargetAsset asset : live.managedAssets(family)) {
            managedByKey.putIfAbsent(family.naturalKeyOf(asset), asset);
        }

        Set<String> sourceKeys = new HashSet<>();
        Set<String> claimedUuids = new HashSet<>();
        List<SourceRecord> ordered = new ArrayList<>(records);
        ordered.sort(Comparator.comparingInt(SourceRecord::depth).thenComparing(SourceRecord::getNaturalKey));

        for (SourceRecord record : ordered) {
            sourceKeys.add(record.getNaturalKey());
            try {
                Mutation mutation = planRecord(family, record, mapping, live, managedByKey, plan);
                if (mutation == null) {
                    continue;
                }
                if (mutation.getLive() != null && !claimedUuids.add(mutation.getLive().getUuid())) {
                    String message = "Asset " + mutation.getLive().getUuid() + " is already claimed by another "
                            + family.getName() + " key";
                    log.error("Skipping {} '{}': {}", family.getName(), record.getNaturalKey(), message);
                    plan.addError(SyncError.builder()
                            .naturalKey(record.getNaturalKey())
                            .operation("resolve")
                            .message(message)
                            .build());
                    continue;
                }
                plan.addUpsert(mutation);
            } catch (CatalogSyncException e) {
                log.error("Failed to plan {} '{}': {}", family.getName(), record.getNaturalKey(), e.getMessage());
                plan.addError(error(record.getNaturalKey(), null, "plan", e));
            }
        }

        planDeletions(family, mapping, live, sourceKeys, claimedUuids, plan);

        log.info("Planned {} run: {} creates, {} updates, {} unchanged, {} hard deletes, {} marked for review, {} stale mappings",
                family.getName(), plan.countOf(MutationType.CREATE), plan.countOf(MutationType.UPDATE),
                plan.countOf(MutationType.UNCHANGED), plan.countOf(MutationType.HARD_DELETE),
                plan.countOf(MutationType.MARK_FOR_REVIEW), plan.getStaleEntries().size());
        return plan;
    }

    private Mutation planRecord(EntityFamily family, SourceRecord record, IdentityMappingStore mapping,
                                LiveSubtree live, Map<String, TargetAsset> managedByKey, ReconciliationPlan plan) {
        String key = record.getNaturalKey();
        TargetAsset desired = family.toDesiredAsset(record);
        TargetAsset current = null;
        boolean adopted = false;

        Optional<MappingEntry> entry = mapping.get(key);
        if (entry.isPresent()) {
            String uuid = entry.get().getTargetUuid();
            current = live.find(uuid).orElseGet(() -> catalog.get(uuid).orElse(null));
            if (current == null) {
                log.warn("Stale mapping for {} '{}': asset {} no longer exists, it will be recreated",
                        family.getName(), key, uuid);
                plan.addStaleEntry(entry.get());
            }
        }

        if (current == null) {
            TargetAsset unmapped = managedByKey.get(key);
            if (unmapped != null) {
                if (!syncConfig.isAdoptUnmappedAssets()) {
                    String message = "Unmapped asset " + unmapped.getUuid() + " already carries key '" + key + "'";
                    log.error("Skipping {} '{}': {}", family.getName(), key, message);
                    plan.addError(SyncError.builder().naturalKey(key).operation("adopt").message(message).build());
                    return null;
                }
                log.info("Adopting unmapped asset {} for {} '{}'", unmapped.getUuid(), family.getName(), key);
                current = unmapped;
                adopted = true;
            }
        }

        Mutation.MutationBuilder mutation = Mutation.builder()
                .naturalKey(key)
                .record(record)
                .desired(desired)
                .live(current)
                .depth(record.depth())
                .adopted(adopted);

        if (current == null) {
            mutation.type(MutationType.CREATE);
        } else {
            List<FieldChange> changes = FieldDiff.diff(current, desired);
            mutation.type(changes.isEmpty() ? MutationType.UNCHANGED : MutationType.UPDATE)
                    .fieldChanges(changes);
        }

        if (family.isComposite()) {
            mutation.childMutations(planChildren(family, record, current, plan));
        }
        return mutation.build();
    }

    private List<ChildMutation> planChildren(EntityFamily family, SourceRecord record, TargetAsset current,
                                             ReconciliationPlan plan) {
        String key = record.getNaturalKey();
        Map<String, TargetAsset> liveByCode = new LinkedHashMap<>();
        if (current != null) {
            for (TargetAsset child : catalog.listChildren(current)) {
                String code = family.childKeyOf(child);
                if (code == null || code.isBlank()) {
                    continue;
                }
                if (liveByCode.putIfAbsent(code, child) != null) {
                    log.warn("{} '{}' has more than one child with code '{}', keeping {}",
                            family.getName(), key, code, liveByCode.get(code).getUuid());
                }
            }
        }

        List<ChildMutation> upserts = new ArrayList<>();
        Set<String> desiredCodes = new LinkedHashSet<>();
        for (ChildItem child : record.getChildren()) {
            if (!desiredCodes.add(child.getCode())) {
                log.warn("Ignoring repeated child code '{}' of {} '{}'", child.getCode(), family.getName(), key);
                continue;
            }
            TargetAsset desiredChild;
            try {
                desiredChild = family.toDesiredChild(record, child);
            } catch (UnknownTypeException e) {
                log.warn("Skipping child '{}' of {} '{}': {}", child.getCode(), family.getName(), key, e.getMessage());
                plan.addError(error(key, child.getCode(), "mapType", e));
                continue;
            }

            TargetAsset liveChild = liveByCode.get(child.getCode());
            if (liveChild == null) {
                upserts.add(ChildMutation.builder()
                        .type(MutationType.CREATE)
                        .code(child.getCode())
                        .desired(desiredChild)
                        .build());
            } else {
                List<FieldChange> changes = FieldDiff.diff(liveChild, desiredChild);
                if (!changes.isEmpty()) {
                    upserts.add(ChildMutation.builder()
                            .type(MutationType.UPDATE)
                            .code(child.getCode())
                            .desired(desiredChild)
                            .live(liveChild)
                            .fieldChanges(changes)
                            .build());
                }
            }
        }

        List<ChildMutation> deletions = new ArrayList<>();
        Set<String> plannedHardDeletes = new HashSet<>();
        for (Map.Entry<String, TargetAsset> entry : liveByCode.entrySet()) {
            TargetAsset liveChild = entry.getValue();
            if (desiredCodes.contains(entry.getKey()) || liveChild.isMarkedForReview()) {
                continue;
            }
            DeletionDecision decision = deletionPolicy.decide(liveChild, catalog.listChildren(liveChild), plannedHardDeletes);
            if (decision == DeletionDecision.HARD_DELETE) {
                plannedHardDeletes.add(liveChild.getUuid());
            }
            deletions.add(ChildMutation.builder()
                    .type(toMutationType(decision))
                    .code(entry.getKey())
                    .live(liveChild)
                    .build());
        }

        List<ChildMutation> all = new ArrayList<>(upserts);
        all.addAll(deletions);
        return all;
    }

    private void planDeletions(EntityFamily family, IdentityMappingStore mapping, LiveSubtree live,
                               Set<String> sourceKeys, Set<String> claimedUuids, ReconciliationPlan plan) {
        Map<String, DeleteCandidate> candidates = new LinkedHashMap<>();

        for (TargetAsset asset : live.managedAssets(family)) {
            String key = family.naturalKeyOf(asset);
            if (sourceKeys.contains(key) || claimedUuids.contains(asset.getUuid()) || asset.isMarkedForReview()) {
                continue;
            }
            candidates.put(asset.getUuid(), new DeleteCandidate(key, asset, live.depthOf(asset.getUuid())));
        }

        for (MappingEntry entry : mapping.all()) {
            String uuid = entry.getTargetUuid();
            if (sourceKeys.contains(entry.getNaturalKey()) || claimedUuids.contains(uuid) || candidates.containsKey(uuid)) {
                continue;
            }
            try {
                Optional<TargetAsset> asset = live.find(uuid).or(() -> catalog.get(uuid));
                if (asset.isEmpty()) {
                    log.warn("Stale mapping for {} '{}': asset {} no longer exists", family.getName(),
                            entry.getNaturalKey(), uuid);
                    plan.addStaleEntry(entry);
                } else if (!asset.get().isMarkedForReview()) {
                    candidates.put(uuid, new DeleteCandidate(entry.getNaturalKey(), asset.get(), live.depthOf(uuid)));
                }
            } catch (CatalogSyncException e) {
                log.error("Failed to verify mapped asset {} of {} '{}': {}", uuid, family.getName(),
                        entry.getNaturalKey(), e.getMessage());
                plan.addError(error(entry.getNaturalKey(), null, "get", e));
            }
        }

        List<DeleteCandidate> deepestFirst = new ArrayList<>(candidates.values());
        deepestFirst.sort(Comparator.comparingInt(DeleteCandidate::getDepth).reversed());

        Set<String> plannedHardDeletes = new HashSet<>();
        for (DeleteCandidate candidate : deepestFirst) {
            try {
                List<TargetAsset> dependents = catalog.listChildren(candidate.asset);
                DeletionDecision decision = deletionPolicy.decide(candidate.asset, dependents, plannedHardDeletes);
                if (decision == DeletionDecision.HARD_DELETE) {
                    plannedHardDeletes.add(candidate.asset.getUuid());
                }
                plan.addDeletion(Mutation.builder()
                        .type(toMutationType(decision))
                        .naturalKey(candidate.key)
                        .live(candidate.asset)
                        .depth(candidate.depth)
                        .build());
            } catch (CatalogSyncException e) {
                log.error("Failed to classify delete candidate {} '{}': {}", family.getName(), candidate.key, e.getMessage());
                plan.addError(error(candidate.key, null, "listChildren", e));
            }
        }
    }

    // ======================== Applying ========================

    public void apply(ReconciliationPlan plan, IdentityMappingStore mapping, RunState state) {
        for (MappingEntry stale : plan.getStaleEntries()) {
            mapping.remove(stale.getNaturalKey());
            state.recordRepaired(stale);
        }
        plan.getErrors().forEach(state::recordError);

        Map<String, String> resolvedPaths = new HashMap<>();
        for (Mutation mutation : plan.getUpserts()) {
            if (mutation.getType() == MutationType.CREATE) {
                applyCreate(plan, mutation, mapping, state, resolvedPaths);
            } else {
                applyUpdate(plan, mutation, mapping, state, resolvedPaths);
            }
        }
        for (Mutation mutation : plan.getDeletions()) {
            applyDeletion(plan.getFamily(), mutation, mapping, state);
        }
    }

    private void applyCreate(ReconciliationPlan plan, Mutation mutation, IdentityMappingStore mapping,
                             RunState state, Map<String, String> resolvedPaths) {
        EntityFamily family = plan.getFamily();
        String key = mutation.getNaturalKey();
        try {
            ParentRef parent = resolveParent(plan, mutation.getRecord(), mapping, resolvedPaths);
            TargetAsset created = catalog.create(parent.uuid, mutation.getDesired(), family.getWriteStatus());
            pacer.pause();
            String type = created.getType() != null ? created.getType() : mutation.getDesired().getType();
            mapping.put(new MappingEntry(key, type, created.getUuid(), parent.path));
            log.info("Created {} '{}' ({}) as {}", family.getName(), mutation.getDesired().getLabel(), key, created.getUuid());

            ItemChange change = ItemChange.builder()
                    .naturalKey(key)
                    .uuid(created.getUuid())
                    .label(mutation.getDesired().getLabel())
                    .build();
            for (ChildMutation child : mutation.getChildMutations()) {
                applyChild(family, key, created.getUuid(), child, change, state);
            }
            state.recordCreated(change);
        } catch (CatalogSyncException | IllegalArgumentException e) {
            log.error("Failed to create {} '{}': {}", family.getName(), key, e.getMessage());
            state.recordError(key, null, "create", e);
        }
    }

    private void applyUpdate(ReconciliationPlan plan, Mutation mutation, IdentityMappingStore mapping,
                             RunState state, Map<String, String> resolvedPaths) {
        EntityFamily family = plan.getFamily();
        String key = mutation.getNaturalKey();
        TargetAsset current = mutation.getLive();
        List<FieldChange> changes = new ArrayList<>(mutation.getFieldChanges());
        try {
            ParentRef parent = resolveParent(plan, mutation.getRecord(), mapping, resolvedPaths);
            boolean moved = !FieldDiff.same(current.getParentUuid(), parent.uuid);
            if (moved) {
                changes.add(FieldChange.of(FieldDiff.PARENT, current.getParentUuid(), parent.uuid));
            }

            Optional<MappingEntry> existing = mapping.get(key);
            if (mutation.isAdopted() || existing.isEmpty()) {
                String knownPath = moved ? existing.map(MappingEntry::getParentCollectionPath).orElse("") : parent.path;
                mapping.put(new MappingEntry(key, current.getType(), current.getUuid(), knownPath));
            }

            if (!changes.isEmpty()) {
                TargetAsset payload = mutation.getDesired().toBuilder()
                        .uuid(current.getUuid())
                        .parentUuid(moved ? parent.uuid : null)
                        .build();
                catalog.update(current.getUuid(), payload, true, family.getWriteStatus());
                pacer.pause();
                if (moved) {
                    log.info("Moved {} '{}' ({}) from {} to {}", family.getName(), payload.getLabel(), key,
                            current.getParentUuid(), parent.uuid);
                }
                log.info("Updated {} '{}' ({}): {} field change(s)", family.getName(), payload.getLabel(), key, changes.size());
            }

            String type = current.getType() != null ? current.getType() : mutation.getDesired().getType();
            mapping.put(new MappingEntry(key, type, current.getUuid(), parent.path));

            ItemChange change = ItemChange.builder()
                    .naturalKey(key)
                    .uuid(current.getUuid())
                    .label(mutation.getDesired().getLabel())
                    .adopted(mutation.isAdopted())
                    .fieldChanges(changes)
                    .build();
            boolean childrenChanged = false;
            for (ChildMutation child : mutation.getChildMutations()) {
                childrenChanged |= applyChild(family, key, current.getUuid(), child, change, state);
            }

            if (!changes.isEmpty() || childrenChanged) {
                state.recordUpdated(change);
            } else {
                state.recordUnchanged(change);
            }
        } catch (CatalogSyncException | IllegalArgumentException e) {
            log.error("Failed to update {} '{}': {}", family.getName(), key, e.getMessage());
            state.recordError(key, null, "update", e);
        }
    }

    /**
     * @return true when the child mutation was applied
     */
    private boolean applyChild(EntityFamily family, String ownerKey, String ownerUuid, ChildMutation child,
                               ItemChange ownerChange, RunState state) {
        String operation = child.getType().name().toLowerCase();
        try {
            switch (child.getType()) {
                case CREATE -> {
                    TargetAsset created = catalog.create(ownerUuid, child.getDesired(), family.getWriteStatus());
                    pacer.pause();
                    state.recordChildCreated();
                    ownerChange.getChildChanges().add(childChange(child, created.getUuid(),
                            ChangeType.CREATED, null));
                    log.debug("Created child '{}' of {} '{}'", child.getCode(), family.getName(), ownerKey);
                }
                case UPDATE -> {
                    catalog.update(child.getLive().getUuid(), child.getDesired(), true, family.getWriteStatus());
                    pacer.pause();
                    state.recordChildUpdated();
                    ownerChange.getChildChanges().add(childChange(child, child.getLive().getUuid(),
                            ChangeType.UPDATED, null));
                    log.debug("Updated child '{}' of {} '{}'", child.getCode(), family.getName(), ownerKey);
                }
                case HARD_DELETE, MARK_FOR_REVIEW -> {
                    DeletionDecision decision = removeAsset(child.getLive(), child.getType());
                    state.recordChildDeleted(decision);
                    ownerChange.getChildChanges().add(childChange(child, child.getLive().getUuid(),
                            ChangeType.DELETED, decision));
                    log.info("Removed child '{}' of {} '{}' ({})", child.getCode(), family.getName(), ownerKey, decision);
                }
                default -> {
                    return false;
                }
            }
            return true;
        } catch (CatalogSyncException e) {
            log.error("Failed to {} child '{}' of {} '{}': {}", operation, child.getCode(), family.getName(),
                    ownerKey, e.getMessage());
            state.recordError(ownerKey, child.getCode(), operation, e);
            return false;
        }
    }

    private void applyDeletion(EntityFamily family, Mutation mutation, IdentityMappingStore mapping, RunState state) {
        String key = mutation.getNaturalKey();
        TargetAsset target = mutation.getLive();
        try {
            DeletionDecision decision = removeAsset(target, mutation.getType());
            if (decision == DeletionDecision.HARD_DELETE) {
                mapping.get(key)
                        .filter(entry -> entry.getTargetUuid().equalsIgnoreCase(target.getUuid()))
                        .ifPresent(entry -> mapping.remove(key));
                log.info("Deleted {} '{}' ({}) {}", family.getName(), target.getLabel(), key, target.getUuid());
            } else {
                log.info("Marked {} '{}' ({}) {} for review", family.getName(), target.getLabel(), key, target.getUuid());
            }
            state.recordDeleted(ItemChange.builder()
                    .naturalKey(key)
                    .uuid(target.getUuid())
                    .label(target.getLabel())
                    .build(), decision);
        } catch (CatalogSyncException e) {
            log.error("Failed to delete {} '{}': {}", family.getName(), key, e.getMessage());
            state.recordError(key, null, "delete", e);
        }
    }

    /**
     * Hard delete or flag an asset. A planned hard delete is downgraded when the asset has children by now.
     */
    private DeletionDecision removeAsset(TargetAsset target, MutationType type) {
        if (type == MutationType.HARD_DELETE) {
            List<TargetAsset> remaining = catalog.listChildren(target);
            if (remaining.isEmpty()) {
                catalog.delete(target.getUuid());
                pacer.pause();
                return DeletionDecision.HARD_DELETE;
            }
            log.warn("Asset {} still has {} children, flagging it for review instead of deleting it",
                    target.getUuid(), remaining.size());
        }
        catalog.markForReview(target.getUuid());
        pacer.pause();
        return DeletionDecision.MARK_FOR_REVIEW;
    }

    /**
     * Parent collection of a record: the mapped asset of its parent key, the collection at its parent path,
     * or the scope root.
     */
    private ParentRef resolveParent(ReconciliationPlan plan, SourceRecord record, IdentityMappingStore mapping,
                                    Map<String, String> resolvedPaths) {
        EntityFamily family = plan.getFamily();
        String scopePath = family.getScopePath();
        String relative = record.getParentPath();
        boolean atRoot = relative == null || relative.isBlank();
        String fullPath = atRoot ? scopePath : (scopePath.isEmpty() ? relative : scopePath + "/" + relative);

        if (record.getParentKey() != null && !record.getParentKey().isBlank()) {
            MappingEntry parentEntry = mapping.get(record.getParentKey())
                    .orElseThrow(() -> new CatalogSyncException("Parent '" + record.getParentKey()
                            + "' has no catalog asset", family.getName(), record.getNaturalKey()));
            return new ParentRef(parentEntry.getTargetUuid(), fullPath);
        }
        if (atRoot) {
            return new ParentRef(plan.getScopeRoot().getUuid(), scopePath);
        }

        String uuid = resolvedPaths.get(fullPath);
        if (uuid == null) {
            uuid = catalog.resolvePath(family.getScheme(), fullPath)
                    .map(TargetAsset::getUuid)
                    .orElseThrow(() -> new CatalogSyncException("Parent collection not found: " + fullPath,
                            family.getName(), record.getNaturalKey()));
            resolvedPaths.put(fullPath, uuid);
        }
        return new ParentRef(uuid, fullPath);
    }

    private static ItemChange childChange(ChildMutation child, String uuid,
                                          ChangeType changeType,
                                          DeletionDecision decision) {
        return ItemChange.builder()
                .naturalKey(child.getCode())
                .uuid(uuid)
                .changeType(changeType)
                .deletionDecision(decision)
                .fieldChanges(new ArrayList<>(child.getFieldChanges()))
                .build();
    }

    private static MutationType toMutationType(DeletionDecision decision) {
        return decision == DeletionDecision.HARD_DELETE ? MutationType.HARD_DELETE : MutationType.MARK_FOR_REVIEW;
    }

    private static SyncError error(String key, String childCode, String operation, Exception e) {
        return SyncError.builder()
                .naturalKey(key)
                .childCode(childCode)
                .operation(operation)
                .statusCode(e instanceof RemoteException remote ? remote.getStatusCode() : null)
                .message(e.getMessage())
                .build();
    }

    private static final class ParentRef {
        private final String uuid;
        private final String path;

        private ParentRef(String uuid, String path) {
            this.uuid = uuid;
            this.path = path;
        }
    }

    private static final class DeleteCandidate {
        private final String key;
        private final TargetAsset asset;
        private final int depth;

        private DeleteCandidate(String key, TargetAsset asset, int depth) {
            this.key = key;
            this.asset = asset;
            this.depth = depth;
        }

        private int getDepth() {
            return depth;
        }
    }
}
