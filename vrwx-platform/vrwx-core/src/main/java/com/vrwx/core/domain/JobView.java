package com.vrwx.core.domain;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Read-only snapshot of a job.
 */
public record JobView(
        BigInteger jobId,
        Address buyer,
        Bytes32 robotId,
        ServiceType serviceType,
        Bytes32 jobSpecHash,
        BigInteger price,
        Instant deadline,
        JobStatus status,
        Bytes32 completionHash,
        int qualityScore,
        int workUnits,
        Instant settleAfter,
        BigInteger receiptTokenId,
        BigInteger lockedBond
) {}
