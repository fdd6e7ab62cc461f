package com.vrwx.services.proof;

import com.vrwx.core.domain.Bytes32;

/**
 * Everything a controller needs to sign and submit a completion: the manifest hash doubles as
 * the completion hash.
 */
public record ProofData(
        Bytes32 manifestHash,
        Bytes32 serviceTypeHash,
        int qualityScore,
        int workUnits,
        String canonicalManifest
) {}
