package com.vrwx.relay.submit;

import com.vrwx.core.domain.Address;
import com.vrwx.core.domain.JobView;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Outcome of relaying a completion. On success the job is COMPLETED and its challenge window
 * closes at {@code settleAfter}; on failure {@code error} carries a stable cause.
 */
public record RelayResult(
        boolean success,
        BigInteger jobId,
        Address signer,
        Instant settleAfter,
        String manifestUrl,
        String error
) {

    public static RelayResult success(JobView job, Address signer, String manifestUrl) {
        return new RelayResult(true, job.jobId(), signer, job.settleAfter(), manifestUrl, null);
    }

    public static RelayResult failure(BigInteger jobId, Address signer, String error) {
        return new RelayResult(false, jobId, signer, null, null, error);
    }
}
