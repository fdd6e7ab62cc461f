package com.vrwx.core.domain;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Non-transferable proof that a job settled. The metadata hash is the completion hash.
 */
public record Receipt(
        BigInteger tokenId,
        Address owner,
        BigInteger jobId,
        Bytes32 metadataHash,
        Instant mintedAt
) {}
