package com.vrwx.services.module;

import com.vrwx.core.domain.ServiceType;
import com.vrwx.services.manifest.ExecutionManifest;
import com.vrwx.services.manifest.JobSpec;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Scoring rules for one service type. Implementations are pure: the same manifest and job spec
 * always produce the same quality score and work units.
 */
public sealed interface ServiceModule permits InspectionModule, PatrolModule, DeliveryModule {

    int MAX_QUALITY = 100;

    ServiceType id();

    String label();

    String description();

    List<String> requiredCapabilities();

    BigDecimal baseRateUsd();

    /**
     * @throws ManifestValidationException if the job spec is for another service or is malformed
     */
    void validateSpec(JobSpec jobSpec);

    /**
     * @throws ManifestValidationException if the service section is missing or inconsistent
     */
    void validateManifest(ExecutionManifest manifest);

    /**
     * Builds a manifest from raw telemetry events. Each event is a map with a {@code type} key;
     * unknown event types are ignored.
     */
    ExecutionManifest buildManifest(List<Map<String, Object>> events, JobSpec jobSpec,
                                    long jobId, String robotId, String controller);

    /**
     * Quality score in [0, 100].
     */
    int computeQualityScore(ExecutionManifest manifest, JobSpec jobSpec);

    int computeWorkUnits(ExecutionManifest manifest, JobSpec jobSpec);

    default VerificationResult verifyCompletion(ExecutionManifest manifest, JobSpec jobSpec) {
        try {
            validateSpec(jobSpec);
            validateManifest(manifest);
        } catch (ManifestValidationException e) {
            return VerificationResult.invalid(e.getMessage());
        }

        int qualityScore = computeQualityScore(manifest, jobSpec);
        int workUnits = computeWorkUnits(manifest, jobSpec);
        if (qualityScore < jobSpec.qualityMin()) {
            return VerificationResult.failure(
                    "Quality score " + qualityScore + " below minimum " + jobSpec.qualityMin(),
                    qualityScore, workUnits);
        }
        return VerificationResult.success(qualityScore, workUnits);
    }

    default ServiceDefinition definition() {
        return new ServiceDefinition(id(), id().typeHash(), label(), description(),
                requiredCapabilities(), baseRateUsd());
    }
}
