package com.vrwx.relay.claim;

import com.vrwx.core.crypto.ClaimSignatures;
import com.vrwx.core.domain.Address;
import com.vrwx.core.domain.CompletionClaim;
import com.vrwx.core.domain.Robot;
import com.vrwx.ledger.identity.IdentityRegistry;
import com.vrwx.ledger.job.JobEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.security.SignatureException;
import java.util.Optional;

/**
 * Off-ledger pre-check of a controller's completion signature, run before a claim is queued for
 * submission. Reads only; safe to call concurrently for any number of jobs.
 */
@Service
public class ClaimVerifier {

    private static final Logger log = LoggerFactory.getLogger(ClaimVerifier.class);

    private final IdentityRegistry identityRegistry;
    private final JobEngine jobEngine;

    public ClaimVerifier(IdentityRegistry identityRegistry, JobEngine jobEngine) {
        this.identityRegistry = identityRegistry;
        this.jobEngine = jobEngine;
    }

    public VerifyResult verify(CompletionClaim claim, String signatureHex) {
        byte[] signature;
        try {
            signature = ClaimSignatures.parseHex(signatureHex);
        } catch (SignatureException e) {
            return VerifyResult.invalid(VerifyResult.Error.MALFORMED_SIGNATURE,
                    "Signature verification failed: " + e.getMessage());
        }
        return verify(claim, signature);
    }

    public VerifyResult verify(CompletionClaim claim, byte[] signature) {
        Optional<Robot> robot = identityRegistry.getRobot(claim.robotId());
        if (robot.isEmpty()) {
            return VerifyResult.invalid(VerifyResult.Error.ROBOT_NOT_FOUND, "Robot not found in IdentityRegistry");
        }
        if (!robot.get().active()) {
            return VerifyResult.invalid(VerifyResult.Error.ROBOT_DEACTIVATED,
                    "Robot is deactivated in IdentityRegistry");
        }
        Address expected = robot.get().controller();

        Address recovered;
        try {
            recovered = ClaimSignatures.recover(jobEngine.getDomain(), claim, signature);
        } catch (SignatureException e) {
            log.debug("Undecodable signature for job {}: {}", claim.jobId(), e.getMessage());
            return VerifyResult.invalid(VerifyResult.Error.MALFORMED_SIGNATURE,
                    "Signature verification failed: " + e.getMessage());
        }

        if (!recovered.equals(expected)) {
            return VerifyResult.invalid(VerifyResult.Error.SIGNATURE_MISMATCH,
                    "Signature from " + recovered + " does not match controller " + expected, recovered, expected);
        }
        if (!claim.controller().equals(expected)) {
            return VerifyResult.invalid(VerifyResult.Error.CONTROLLER_MISMATCH,
                    "Claim controller " + claim.controller() + " does not match registry " + expected,
                    recovered, expected);
        }
        return VerifyResult.valid(recovered, expected);
    }
}
