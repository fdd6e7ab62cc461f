package com.vrwx.services.storage;

import com.vrwx.services.manifest.ExecutionManifest;

import java.util.Optional;

/**
 * Content-addressed manifest backend. Manifests are keyed by their 0x-prefixed keccak256 hash.
 */
public interface ManifestStorage {

    /**
     * Stores a manifest under its hash.
     *
     * @return URL at which the manifest can be fetched
     */
    String store(String hash, ExecutionManifest manifest) throws ManifestStorageException;

    Optional<ExecutionManifest> retrieve(String hash) throws ManifestStorageException;

    boolean exists(String hash) throws ManifestStorageException;

    String getUrl(String hash);

    /**
     * Short backend name, such as {@code local} or {@code memory}.
     */
    String provider();
}
