package com.vrwx.services.manifest;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.vrwx.core.domain.ServiceType;

import java.util.List;

/**
 * Record of what a robot did for a job. Exactly one of the service sections is expected to be
 * present, matching {@link #serviceType()}. Absent fields are left out of the JSON form so that
 * the manifest hash does not depend on them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionManifest(
        String manifestVersion,
        String schemaVersion,
        String serviceModuleVersion,
        long jobId,
        String robotId,
        String controller,
        ServiceType serviceType,
        long startTs,
        long endTs,
        String routeDigest,
        List<Artifact> artifacts,
        Inspection inspection,
        Patrol patrol,
        Delivery delivery
) {

    public static final String MANIFEST_VERSION = "2.0";
    public static final String SCHEMA_VERSION = "2025-12-15";
    public static final String SERVICE_MODULE_VERSION = "1.0";

    public ExecutionManifest {
        artifacts = artifacts == null ? null : List.copyOf(artifacts);
    }

    public int artifactCount() {
        return artifacts == null ? 0 : artifacts.size();
    }

    public boolean hasRouteDigest() {
        return routeDigest != null && !routeDigest.isEmpty();
    }

    /**
     * Copy stamped with the current manifest, schema and module versions.
     */
    public ExecutionManifest versioned() {
        return new ExecutionManifest(MANIFEST_VERSION, SCHEMA_VERSION, SERVICE_MODULE_VERSION,
                jobId, robotId, controller, serviceType, startTs, endTs, routeDigest, artifacts,
                inspection, patrol, delivery);
    }

    public record Artifact(String type, String sha256, long bytes) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Inspection(Integer coverageVisited, Integer coverageTotal, Integer anomaliesDetected) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Patrol(
            List<String> checkpointsRequired,
            List<String> checkpointsVisited,
            List<Long> dwellSeconds,
            Long minDwellRequired
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Delivery(String pickupProofHash, String dropoffProofHash, Long pickupTs, Long dropoffTs) {}
}
