package com.example.catalogsync.service;

import com.example.catalogsync.enums.AssetStatus;
import com.example.catalogsync.exception.RemoteException;
import com.example.catalogsync.model.TargetAsset;

import java.util.List;
import java.util.Optional;

/**
 * Read and write access to the target catalog's asset tree.
 * <p>
 * Every operation fails with {@link RemoteException} on transport or protocol errors.
 * A missing asset on a read (HTTP 404 or 410) is reported as an empty result, not as an error.
 */
public interface CatalogAccessor {

    Optional<TargetAsset> get(String uuid);

    /**
     * Create an asset below the given parent (collection, scheme, classifier or enumeration).
     *
     * @return the created asset, including its new UUID
     */
    TargetAsset create(String parentUuid, TargetAsset payload, AssetStatus status);

    /**
     * Update an asset.
     *
     * @param merge true to change only the fields present in the payload, false to replace the asset
     * @param status status to write, or null to leave the status untouched
     */
    TargetAsset update(String uuid, TargetAsset payload, boolean merge, AssetStatus status);

    void delete(String uuid);

    /**
     * Direct children of an asset. Assets that cannot contain others yield an empty list.
     */
    List<TargetAsset> listChildren(TargetAsset parent);

    void markForReview(String uuid);

    /**
     * Resolve a collection by its escaped business-key path inside a scheme. An empty path resolves the scheme itself.
     */
    Optional<TargetAsset> resolvePath(String scheme, String path);

    /**
     * UUID of a technical datatype by name.
     */
    Optional<String> resolveDatatype(String name);

    /**
     * Check connectivity, false when unreachable or not configured.
     */
    boolean testConnection();
}
