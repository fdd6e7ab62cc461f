package com.vrwx.core.domain;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Statement signed by a robot's controller that a job was completed.
 * The deadline is in unix seconds, matching the typed-data encoding.
 */
public record CompletionClaim(
        BigInteger jobId,
        Bytes32 jobSpecHash,
        Bytes32 completionHash,
        Bytes32 robotId,
        Address controller,
        BigInteger deadline,
        int qualityScore,
        long workUnits
) {
    public static final int MAX_QUALITY_SCORE = 255;
    public static final long MAX_WORK_UNITS = 0xFFFF_FFFFL;

    public CompletionClaim {
        Objects.requireNonNull(jobId, "Job ID cannot be null");
        Objects.requireNonNull(jobSpecHash, "Job spec hash cannot be null");
        Objects.requireNonNull(completionHash, "Completion hash cannot be null");
        Objects.requireNonNull(robotId, "Robot ID cannot be null");
        Objects.requireNonNull(controller, "Controller cannot be null");
        Objects.requireNonNull(deadline, "Deadline cannot be null");
        if (qualityScore < 0 || qualityScore > MAX_QUALITY_SCORE) {
            throw new IllegalArgumentException("Quality score out of uint8 range: " + qualityScore);
        }
        if (workUnits < 0 || workUnits > MAX_WORK_UNITS) {
            throw new IllegalArgumentException("Work units out of uint32 range: " + workUnits);
        }
    }
}
