package com.vrwx.services.module;

/**
 * Outcome of checking a manifest against its job spec. Scores are the recomputed values, or zero
 * when the manifest could not be scored at all.
 */
public record VerificationResult(boolean ok, String reason, int qualityScore, int workUnits) {

    public static VerificationResult success(int qualityScore, int workUnits) {
        return new VerificationResult(true, null, qualityScore, workUnits);
    }

    public static VerificationResult failure(String reason, int qualityScore, int workUnits) {
        return new VerificationResult(false, reason, qualityScore, workUnits);
    }

    public static VerificationResult invalid(String reason) {
        return new VerificationResult(false, reason, 0, 0);
    }
}
