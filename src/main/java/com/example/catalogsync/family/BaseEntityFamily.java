package com.example.catalogsync.family;

import com.example.catalogsync.config.SyncConfig;
import com.example.catalogsync.enums.AssetStatus;
import com.example.catalogsync.model.ChildItem;
import com.example.catalogsync.model.SourceRecord;
import com.example.catalogsync.model.TargetAsset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class providing the configuration lookups and the managed-asset filter shared by all families.
 */
public abstract class BaseEntityFamily implements EntityFamily {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final SyncConfig syncConfig;

    protected BaseEntityFamily(SyncConfig syncConfig) {
        this.syncConfig = syncConfig;
    }

    /**
     * Stereotype identifying the family's assets inside a scheme.
     */
    protected abstract String getStereotype();

    @Override
    public String getScheme() {
        return syncConfig.getScheme(getName());
    }

    @Override
    public String getScopePath() {
        String scopePath = syncConfig.getScopePath(getName());
        return scopePath == null ? "" : scopePath.trim();
    }

    @Override
    public AssetStatus getWriteStatus() {
        return syncConfig.getWriteStatus(getName());
    }

    @Override
    public boolean isManaged(TargetAsset asset) {
        if (asset == null || !getAssetType().equals(asset.getType())) {
            return false;
        }
        if (!getStereotype().equals(asset.getStereotype())) {
            return false;
        }
        String key = naturalKeyOf(asset);
        return key != null && !key.isBlank();
    }

    @Override
    public String naturalKeyOf(TargetAsset asset) {
        String key = asset.customProperty(getKeyField());
        return key == null ? null : key.trim();
    }

    @Override
    public boolean isComposite() {
        return false;
    }

    @Override
    public TargetAsset toDesiredChild(SourceRecord owner, ChildItem child) {
        throw new UnsupportedOperationException(getName() + " has no child items");
    }

    @Override
    public String childKeyOf(TargetAsset child) {
        throw new UnsupportedOperationException(getName() + " has no child items");
    }

    /**
     * Builder pre-filled with type, stereotype and write status.
     */
    protected TargetAsset.TargetAssetBuilder baseAsset() {
        return TargetAsset.builder()
                .type(getAssetType())
                .stereotype(getStereotype())
                .status(getWriteStatus());
    }

    protected static String nullToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
