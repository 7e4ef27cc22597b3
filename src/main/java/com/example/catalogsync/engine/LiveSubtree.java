package com.example.catalogsync.engine;

import com.example.catalogsync.family.EntityFamily;
import com.example.catalogsync.model.TargetAsset;
import com.example.catalogsync.service.CatalogAccessor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Snapshot of the catalog assets below a family's scope collection, fetched once per run.
 * Only collections are descended into; child items of classifiers and enumerations are read on demand.
 */
public class LiveSubtree {

    public static final String COLLECTION_TYPE = "Collection";

    private final TargetAsset root;
    private final Map<String, TargetAsset> byUuid = new LinkedHashMap<>();
    private final Map<String, Integer> depthByUuid = new HashMap<>();

    public LiveSubtree(TargetAsset root) {
        this.root = root;
    }

    /**
     * Breadth-first walk of the scope.
     */
    public static LiveSubtree fetch(CatalogAccessor catalog, TargetAsset root) {
        LiveSubtree subtree = new LiveSubtree(root);
        Deque<TargetAsset> queue = new ArrayDeque<>();
        queue.add(root);
        Map<String, Integer> depth = new HashMap<>();
        depth.put(root.getUuid(), 0);

        while (!queue.isEmpty()) {
            TargetAsset current = queue.poll();
            int childDepth = depth.get(current.getUuid()) + 1;
            for (TargetAsset child : catalog.listChildren(current)) {
                if (child.getUuid() == null || depth.containsKey(child.getUuid())) {
                    continue;
                }
                depth.put(child.getUuid(), childDepth);
                subtree.add(child, childDepth);
                if (COLLECTION_TYPE.equals(child.getType())) {
                    queue.add(child);
                }
            }
        }
        return subtree;
    }

    public void add(TargetAsset asset, int depth) {
        byUuid.put(asset.getUuid(), asset);
        depthByUuid.put(asset.getUuid(), depth);
    }

    public TargetAsset getRoot() {
        return root;
    }

    public Optional<TargetAsset> find(String uuid) {
        return Optional.ofNullable(byUuid.get(uuid));
    }

    public int depthOf(String uuid) {
        return depthByUuid.getOrDefault(uuid, 0);
    }

    public List<TargetAsset> managedAssets(EntityFamily family) {
        List<TargetAsset> managed = new ArrayList<>();
        for (TargetAsset asset : byUuid.values()) {
            if (family.isManaged(asset)) {
                managed.add(asset);
            }
        }
        return managed;
    }

    public int size() {
        return byUuid.size();
    }
}
