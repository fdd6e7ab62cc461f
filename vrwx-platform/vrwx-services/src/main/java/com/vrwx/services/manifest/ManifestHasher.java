package com.vrwx.services.manifest;

import com.vrwx.core.crypto.Keccak;
import com.vrwx.core.domain.Bytes32;

/**
 * keccak256 over the UTF-8 bytes of canonical JSON. The manifest hash is the completion hash a
 * controller signs over.
 */
public final class ManifestHasher {

    private ManifestHasher() {}

    public static Bytes32 hash(ExecutionManifest manifest) {
        return Keccak.hashUtf8(ManifestCanonicalizer.canonicalize(manifest));
    }

    public static String hashHex(ExecutionManifest manifest) {
        return hash(manifest).toHex();
    }

    public static Bytes32 hashObject(Object value) {
        return Keccak.hashUtf8(ManifestCanonicalizer.canonicalizeObject(value));
    }

    /**
     * Job spec hash carried on offers and jobs.
     */
    public static Bytes32 hashJobSpec(JobSpec jobSpec) {
        return hashObject(jobSpec);
    }
}
