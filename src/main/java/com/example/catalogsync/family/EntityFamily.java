package com.example.catalogsync.family;

import com.example.catalogsync.enums.AssetStatus;
import com.example.catalogsync.exception.UnknownTypeException;
import com.example.catalogsync.model.ChildItem;
import com.example.catalogsync.model.SourceRecord;
import com.example.catalogsync.model.TargetAsset;

/**
 * The capabilities the generic reconciler needs from an entity family: where its assets live,
 * how a source record becomes a desired asset and how a live asset is recognized as one of ours.
 */
public interface EntityFamily {

    /**
     * Family name as used in configuration, mapping file names and the REST API, e.g. "org-units".
     */
    String getName();

    /**
     * Custom property carrying the natural key on managed assets.
     */
    String getKeyField();

    /**
     * Catalog type of the family's assets, e.g. "Collection".
     */
    String getAssetType();

    String getScheme();

    /**
     * Escaped path of the scope collection inside the scheme. Empty for the scheme root.
     */
    String getScopePath();

    AssetStatus getWriteStatus();

    /**
     * Desired state of the asset for a source record. The parent is resolved by the reconciler.
     */
    TargetAsset toDesiredAsset(SourceRecord record);

    /**
     * True when the live asset belongs to this family and carries a natural key.
     */
    boolean isManaged(TargetAsset asset);

    String naturalKeyOf(TargetAsset asset);

    /**
     * Whether assets of this family own child items (columns, paragraphs) that are diffed by code.
     */
    boolean isComposite();

    /**
     * Desired state of a child item.
     *
     * @throws UnknownTypeException when the child's type cannot be mapped to the catalog
     */
    TargetAsset toDesiredChild(SourceRecord owner, ChildItem child);

    /**
     * Code of a live child asset, the key children are matched by.
     */
    String childKeyOf(TargetAsset child);

    /**
     * Called at the start of every run, before any record is planned. Drops per-run lookups.
     */
    default void prepareRun() {
    }
}
