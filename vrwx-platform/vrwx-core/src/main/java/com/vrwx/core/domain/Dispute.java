package com.vrwx.core.domain;

import java.math.BigInteger;
import java.time.Instant;

public record Dispute(
        BigInteger jobId,
        Address challenger,
        Bytes32 reasonHash,
        Verdict verdict,
        Instant createdAt,
        Instant resolvedAt
) {
    public static Dispute open(BigInteger jobId, Address challenger, Bytes32 reasonHash, Instant now) {
        return new Dispute(jobId, challenger, reasonHash, Verdict.PENDING, now, null);
    }

    public boolean isResolved() {
        return verdict != Verdict.PENDING;
    }

    public Dispute resolve(Verdict verdict, Instant now) {
        return new Dispute(jobId, challenger, reasonHash, verdict, createdAt, now);
    }
}
