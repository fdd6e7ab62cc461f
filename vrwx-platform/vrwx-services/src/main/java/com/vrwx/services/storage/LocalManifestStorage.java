package com.vrwx.services.storage;

import com.vrwx.services.manifest.ExecutionManifest;
import com.vrwx.services.manifest.ManifestCanonicalizer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Stores each manifest as {@code <hash>.json} in a local directory, in canonical form.
 */
public class LocalManifestStorage implements ManifestStorage {

    public static final String DEFAULT_BASE_URL = "/manifests";

    private final Path dataDir;
    private final String baseUrl;

    public LocalManifestStorage(Path dataDir, String baseUrl) throws ManifestStorageException {
        this.dataDir = dataDir;
        this.baseUrl = baseUrl == null || baseUrl.isEmpty() ? DEFAULT_BASE_URL : baseUrl;
        try {
            Files.createDirectories(dataDir);
        } catch (IOException e) {
            throw new ManifestStorageException("Cannot create manifest directory " + dataDir, e);
        }
    }

    @Override
    public String store(String hash, ExecutionManifest manifest) throws ManifestStorageException {
        Path file = fileFor(hash);
        try {
            Files.writeString(file, ManifestCanonicalizer.canonicalize(manifest), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ManifestStorageException("Failed to store manifest: " + e.getMessage(), e);
        }
        return getUrl(hash);
    }

    @Override
    public Optional<ExecutionManifest> retrieve(String hash) throws ManifestStorageException {
        Path file = fileFor(hash);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(ManifestCanonicalizer.parse(Files.readString(file, StandardCharsets.UTF_8)));
        } catch (IOException | IllegalArgumentException e) {
            throw new ManifestStorageException("Failed to read manifest " + hash, e);
        }
    }

    @Override
    public boolean exists(String hash) {
        return Files.exists(fileFor(hash));
    }

    @Override
    public String getUrl(String hash) {
        return baseUrl + "/" + hash;
    }

    @Override
    public String provider() {
        return "local";
    }

    Path fileFor(String hash) {
        // only hex digits and the x of the prefix survive, so no path traversal
        String safeHash = hash.replaceAll("[^a-fA-F0-9x]", "");
        return dataDir.resolve(safeHash + ".json");
    }
}
