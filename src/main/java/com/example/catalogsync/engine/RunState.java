package com.example.catalogsync.engine;

import com.example.catalogsync.dto.ItemChange;
import com.example.catalogsync.dto.SyncCounts;
import com.example.catalogsync.dto.SyncError;
import com.example.catalogsync.dto.SyncReport;
import com.example.catalogsync.enums.ChangeType;
import com.example.catalogsync.enums.DeletionDecision;
import com.example.catalogsync.enums.RunStatus;
import com.example.catalogsync.exception.RemoteException;
import com.example.catalogsync.model.MappingEntry;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable accumulator of one family run. Turned into a {@link SyncReport} when the run ends.
 */
public class RunState {

    private final String family;
    private final LocalDateTime startedAt;
    private final SyncCounts counts = new SyncCounts();
    private final List<ItemChange> created = new ArrayList<>();
    private final List<ItemChange> updated = new ArrayList<>();
    private final List<ItemChange> unchanged = new ArrayList<>();
    private final List<ItemChange> deleted = new ArrayList<>();
    private final List<ItemChange> repairedMappings = new ArrayList<>();
    private final List<SyncError> errors = new ArrayList<>();

    public RunState(String family) {
        this(family, LocalDateTime.now());
    }

    public RunState(String family, LocalDateTime startedAt) {
        this.family = family;
        this.startedAt = startedAt;
    }

    public void recordCreated(ItemChange change) {
        change.setChangeType(ChangeType.CREATED);
        created.add(change);
        counts.setCreated(counts.getCreated() + 1);
    }

    public void recordUpdated(ItemChange change) {
        change.setChangeType(ChangeType.UPDATED);
        updated.add(change);
        counts.setUpdated(counts.getUpdated() + 1);
    }

    public void recordUnchanged(ItemChange change) {
        change.setChangeType(ChangeType.UNCHANGED);
        unchanged.add(change);
        counts.setUnchanged(counts.getUnchanged() + 1);
    }

    public void recordDeleted(ItemChange change, DeletionDecision decision) {
        change.setChangeType(ChangeType.DELETED);
        change.setDeletionDecision(decision);
        deleted.add(change);
        counts.setDeleted(counts.getDeleted() + 1);
        if (decision == DeletionDecision.HARD_DELETE) {
            counts.setHardDeleted(counts.getHardDeleted() + 1);
        } else {
            counts.setMarkedForReview(counts.getMarkedForReview() + 1);
        }
    }

    public void recordChildCreated() {
        counts.setChildrenCreated(counts.getChildrenCreated() + 1);
    }

    public void recordChildUpdated() {
        counts.setChildrenUpdated(counts.getChildrenUpdated() + 1);
    }

    public void recordChildDeleted(DeletionDecision decision) {
        if (decision == DeletionDecision.HARD_DELETE) {
            counts.setChildrenDeleted(counts.getChildrenDeleted() + 1);
        } else {
            counts.setChildrenMarkedForReview(counts.getChildrenMarkedForReview() + 1);
        }
    }

    public void recordRepaired(MappingEntry entry) {
        repairedMappings.add(ItemChange.builder()
                .naturalKey(entry.getNaturalKey())
                .uuid(entry.getTargetUuid())
                .build());
        counts.setRepairedMappings(counts.getRepairedMappings() + 1);
    }

    public void recordError(SyncError error) {
        errors.add(error);
        counts.setErrors(counts.getErrors() + 1);
    }

    public void recordError(String naturalKey, String childCode, String operation, Exception ex) {
        Integer statusCode = ex instanceof RemoteException remote ? remote.getStatusCode() : null;
        recordError(SyncError.builder()
                .naturalKey(naturalKey)
                .childCode(childCode)
                .operation(operation)
                .statusCode(statusCode)
                .message(ex.getMessage())
                .build());
    }

    public SyncCounts getCounts() {
        return counts;
    }

    public List<SyncError> getErrors() {
        return errors;
    }

    public String getFamily() {
        return family;
    }

    public SyncReport toReport() {
        RunStatus status = errors.isEmpty() ? RunStatus.SUCCESS : RunStatus.WARNING;
        String message = String.format("%s: %d created, %d updated, %d unchanged, %d deleted (%d marked for review), %d errors",
                family, counts.getCreated(), counts.getUpdated(), counts.getUnchanged(), counts.getDeleted(),
                counts.getMarkedForReview(), counts.getErrors());
        return SyncReport.builder()
                .family(family)
                .status(status)
                .message(message)
                .startedAt(startedAt)
                .finishedAt(LocalDateTime.now())
                .counts(counts)
                .created(new ArrayList<>(created))
                .updated(new ArrayList<>(updated))
                .unchanged(new ArrayList<>(unchanged))
                .deleted(new ArrayList<>(deleted))
                .repairedMappings(new ArrayList<>(repairedMappings))
                .errors(new ArrayList<>(errors))
                .build();
    }
}
