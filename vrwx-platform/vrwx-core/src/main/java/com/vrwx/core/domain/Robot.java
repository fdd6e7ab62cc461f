package com.vrwx.core.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Registered robot identity bound to the address that signs its completion claims.
 * Deactivation is terminal for new work; the record is kept for history.
 */
public record Robot(
        Bytes32 robotId,
        Address controller,
        byte[] publicKey,
        Bytes32 metadataHash,
        boolean active,
        Instant registeredAt
) {
    public Robot {
        Objects.requireNonNull(robotId, "Robot ID cannot be null");
        Objects.requireNonNull(controller, "Controller cannot be null");
        publicKey = publicKey == null ? new byte[0] : publicKey.clone();
        metadataHash = metadataHash == null ? Bytes32.ZERO : metadataHash;
    }

    @Override
    public byte[] publicKey() {
        return publicKey.clone();
    }

    public Robot withKey(byte[] newPublicKey, Bytes32 newMetadataHash) {
        return new Robot(robotId, controller, newPublicKey, newMetadataHash, active, registeredAt);
    }

    public Robot withController(Address newController) {
        return new Robot(robotId, newController, publicKey, metadataHash, active, registeredAt);
    }

    public Robot deactivated() {
        return new Robot(robotId, controller, publicKey, metadataHash, false, registeredAt);
    }
}
