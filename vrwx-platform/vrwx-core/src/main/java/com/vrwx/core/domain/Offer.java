package com.vrwx.core.domain;

import java.math.BigInteger;
import java.time.Instant;

public record Offer(
        BigInteger offerId,
        Address operator,
        Bytes32 robotId,
        ServiceType serviceType,
        Bytes32 jobSpecHash,
        BigInteger price,
        Instant expiresAt,
        BigInteger minBond,
        boolean active
) {
    public Offer deactivated() {
        return new Offer(offerId, operator, robotId, serviceType, jobSpecHash, price, expiresAt, minBond, false);
    }
}
