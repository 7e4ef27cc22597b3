package com.example.catalogsync.engine;

import com.example.catalogsync.enums.DeletionDecision;
import com.example.catalogsync.model.TargetAsset;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Set;

/**
 * Decides how an asset that disappeared from the source is removed from the catalog.
 * <p>
 * An asset without dependents, or whose dependents are all hard deleted in the same run, is hard deleted.
 * Anything else is flagged for review and kept, together with its mapping entry, so that a reappearing
 * source entity gets the same catalog identity back.
 */
@Component
public class DeletionPolicy {

    public DeletionDecision decide(TargetAsset candidate, Collection<TargetAsset> dependents,
                                   Set<String> plannedHardDeletes) {
        if (dependents == null || dependents.isEmpty()) {
            return DeletionDecision.HARD_DELETE;
        }
        boolean allGoing = dependents.stream()
                .allMatch(dependent -> dependent.getUuid() != null && plannedHardDeletes.contains(dependent.getUuid()));
        return allGoing ? DeletionDecision.HARD_DELETE : DeletionDecision.MARK_FOR_REVIEW;
    }
}
