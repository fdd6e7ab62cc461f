package com.vrwx.relay.claim;

import com.vrwx.core.crypto.ClaimTypedData;
import com.vrwx.core.domain.Bytes32;
import com.vrwx.core.domain.CompletionClaim;
import com.vrwx.core.domain.JobView;
import com.vrwx.ledger.identity.IdentityRegistry;
import com.vrwx.ledger.job.JobEngine;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.Optional;

/**
 * Builds the claim a controller must sign from the ledger's view of the job and the robot's
 * registered controller.
 */
@Service
public class ClaimAssembler {

    private final JobEngine jobEngine;
    private final IdentityRegistry identityRegistry;

    public ClaimAssembler(JobEngine jobEngine, IdentityRegistry identityRegistry) {
        this.jobEngine = jobEngine;
        this.identityRegistry = identityRegistry;
    }

    /**
     * @return empty when the job or its robot is unknown
     */
    public Optional<CompletionClaim> assemble(BigInteger jobId, Bytes32 completionHash,
                                              int qualityScore, long workUnits) {
        Optional<JobView> job = jobEngine.getJob(jobId);
        if (job.isEmpty()) {
            return Optional.empty();
        }
        return identityRegistry.getRobot(job.get().robotId())
                .map(robot -> jobEngine.claimFor(job.get(), completionHash, qualityScore, workUnits,
                        robot.controller()));
    }

    public Optional<ClaimForSigning> forSigning(BigInteger jobId, Bytes32 completionHash,
                                                int qualityScore, long workUnits) {
        return assemble(jobId, completionHash, qualityScore, workUnits)
                .map(claim -> new ClaimForSigning(claim, jobEngine.getDomain(),
                        ClaimTypedData.toTypedData(jobEngine.getDomain(), claim)));
    }
}
