package com.vrwx.services.storage;

import com.vrwx.services.manifest.ExecutionManifest;
import com.vrwx.services.manifest.ManifestHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Front for a {@link ManifestStorage} backend. In strict mode a stored manifest must be readable
 * back before its URL is returned and every backend failure propagates; otherwise failures are
 * logged and the backend's URL for the hash is returned anyway.
 */
public class ManifestStore {

    private static final Logger log = LoggerFactory.getLogger(ManifestStore.class);

    private final ManifestStorage storage;
    private final boolean strict;

    public ManifestStore(ManifestStorage storage, boolean strict) {
        this.storage = storage;
        this.strict = strict;
        log.info("Initialized {} manifest storage (strict={})", storage.provider(), strict);
    }

    /**
     * Stores a manifest under its own canonical hash.
     */
    public String store(ExecutionManifest manifest) {
        return store(ManifestHasher.hashHex(manifest), manifest);
    }

    /**
     * @throws IllegalStateException in strict mode, when the backend fails or the manifest is not
     *                               found after storing
     */
    public String store(String hash, ExecutionManifest manifest) {
        try {
            String url = storage.store(hash, manifest);
            if (strict && !storage.exists(hash)) {
                throw new ManifestStorageException("Manifest " + hash + " not found after storage (strict mode)");
            }
            return url;
        } catch (ManifestStorageException e) {
            if (strict) {
                throw new IllegalStateException(e.getMessage(), e);
            }
            log.error("Failed to store manifest {}", hash, e);
            return storage.getUrl(hash);
        }
    }

    public Optional<ExecutionManifest> retrieve(String hash) {
        try {
            return storage.retrieve(hash);
        } catch (ManifestStorageException e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }

    public boolean isStrict() {
        return strict;
    }

    public String provider() {
        return storage.provider();
    }
}
