package com.vrwx.relay.submit;

import com.vrwx.core.domain.Address;
import com.vrwx.core.domain.Bytes32;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A signed completion to be relayed. {@code submitter} selects the submission queue in
 * self-submit mode and is ignored in relay mode.
 */
public record CompletionRequest(
        BigInteger jobId,
        Bytes32 completionHash,
        int qualityScore,
        long workUnits,
        String signature,
        Address submitter
) {

    public CompletionRequest {
        Objects.requireNonNull(jobId, "Job ID cannot be null");
        Objects.requireNonNull(completionHash, "Completion hash cannot be null");
    }
}
