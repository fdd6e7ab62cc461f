package com.vrwx.services.proof;

import com.vrwx.services.manifest.ExecutionManifest;
import com.vrwx.services.manifest.JobSpec;
import com.vrwx.services.manifest.ManifestCanonicalizer;
import com.vrwx.services.manifest.ManifestHasher;
import com.vrwx.services.module.ServiceModule;
import com.vrwx.services.module.ServiceModuleRegistry;
import com.vrwx.services.module.VerificationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authoritative recomputation of quality and work units from a manifest. Claimed values must
 * match what this produces before a completion is relayed.
 */
public class ProofVerifier {

    private static final Logger log = LoggerFactory.getLogger(ProofVerifier.class);

    private final ServiceModuleRegistry registry;

    public ProofVerifier(ServiceModuleRegistry registry) {
        this.registry = registry;
    }

    public record Scores(int qualityScore, int workUnits) {}

    /**
     * @throws IllegalArgumentException if no module handles the manifest's service type
     */
    public Scores recompute(ExecutionManifest manifest, JobSpec jobSpec) {
        ServiceModule module = moduleFor(manifest);
        return new Scores(module.computeQualityScore(manifest, jobSpec),
                module.computeWorkUnits(manifest, jobSpec));
    }

    public VerificationResult verifyScores(ExecutionManifest manifest, JobSpec jobSpec,
                                           int claimedQuality, int claimedWorkUnits) {
        Scores computed;
        try {
            computed = recompute(manifest, jobSpec);
        } catch (IllegalArgumentException e) {
            return VerificationResult.invalid(e.getMessage());
        }

        if (claimedQuality != computed.qualityScore()) {
            log.debug("Quality mismatch for job {}: claimed {}, computed {}",
                    manifest.jobId(), claimedQuality, computed.qualityScore());
            return VerificationResult.failure(
                    "Quality mismatch: claimed " + claimedQuality + ", computed " + computed.qualityScore(),
                    computed.qualityScore(), computed.workUnits());
        }
        if (claimedWorkUnits != computed.workUnits()) {
            return VerificationResult.failure(
                    "WorkUnits mismatch: claimed " + claimedWorkUnits + ", computed " + computed.workUnits(),
                    computed.qualityScore(), computed.workUnits());
        }
        if (computed.qualityScore() < jobSpec.qualityMin()) {
            return VerificationResult.failure(
                    "Quality " + computed.qualityScore() + " below minimum " + jobSpec.qualityMin(),
                    computed.qualityScore(), computed.workUnits());
        }
        return VerificationResult.success(computed.qualityScore(), computed.workUnits());
    }

    public VerificationResult verifyCompletion(ExecutionManifest manifest, JobSpec jobSpec) {
        if (manifest.serviceType() == null || registry.find(manifest.serviceType()).isEmpty()) {
            return VerificationResult.invalid("Unsupported service type: " + manifest.serviceType());
        }
        return moduleFor(manifest).verifyCompletion(manifest, jobSpec);
    }

    public ProofData buildProofData(ExecutionManifest manifest, JobSpec jobSpec) {
        Scores computed = recompute(manifest, jobSpec);
        return new ProofData(
                ManifestHasher.hash(manifest),
                manifest.serviceType().typeHash(),
                computed.qualityScore(),
                computed.workUnits(),
                ManifestCanonicalizer.canonicalize(manifest));
    }

    private ServiceModule moduleFor(ExecutionManifest manifest) {
        if (manifest.serviceType() == null) {
            throw new IllegalArgumentException("Unsupported service type: null");
        }
        return registry.getModule(manifest.serviceType());
    }
}
