package com.vrwx.services.storage;

import com.vrwx.services.manifest.ExecutionManifest;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of ManifestStorage for testing and development.
 */
public class InMemoryManifestStorage implements ManifestStorage {

    private final Map<String, ExecutionManifest> manifests = new ConcurrentHashMap<>();
    private final String baseUrl;

    public InMemoryManifestStorage(String baseUrl) {
        this.baseUrl = baseUrl == null || baseUrl.isEmpty() ? LocalManifestStorage.DEFAULT_BASE_URL : baseUrl;
    }

    public InMemoryManifestStorage() {
        this(LocalManifestStorage.DEFAULT_BASE_URL);
    }

    @Override
    public String store(String hash, ExecutionManifest manifest) {
        manifests.put(hash.toLowerCase(), manifest);
        return getUrl(hash);
    }

    @Override
    public Optional<ExecutionManifest> retrieve(String hash) {
        return Optional.ofNullable(manifests.get(hash.toLowerCase()));
    }

    @Override
    public boolean exists(String hash) {
        return manifests.containsKey(hash.toLowerCase());
    }

    @Override
    public String getUrl(String hash) {
        return baseUrl + "/" + hash;
    }

    @Override
    public String provider() {
        return "memory";
    }

    public int size() {
        return manifests.size();
    }
}
