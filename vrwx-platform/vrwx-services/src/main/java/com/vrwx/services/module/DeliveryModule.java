package com.vrwx.services.module;

import com.vrwx.core.domain.ServiceType;
import com.vrwx.services.manifest.ExecutionManifest;
import com.vrwx.services.manifest.ExecutionManifest.Delivery;
import com.vrwx.services.manifest.JobSpec;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Map;

import static com.vrwx.services.module.ModuleSupport.*;

/**
 * Package delivery with proof of pickup and dropoff. Quality is 40 points per proof, 10 for a
 * route digest and 10 for delivering inside the job's time window. One delivery is one work unit.
 */
public final class DeliveryModule implements ServiceModule {

    static final long DEFAULT_DURATION_SECONDS = 900;

    private final Clock clock;

    public DeliveryModule(Clock clock) {
        this.clock = clock;
    }

    public DeliveryModule() {
        this(Clock.systemUTC());
    }

    @Override
    public ServiceType id() {
        return ServiceType.DELIVERY;
    }

    @Override
    public String label() {
        return "Delivery";
    }

    @Override
    public String description() {
        return "Package delivery service - robot picks up and delivers items with proof of completion";
    }

    @Override
    public List<String> requiredCapabilities() {
        return List.of("navigation", "localization", "cargo_hold", "proof_capture");
    }

    @Override
    public BigDecimal baseRateUsd() {
        return BigDecimal.valueOf(200);
    }

    @Override
    public void validateSpec(JobSpec jobSpec) {
        requireSpec(ServiceType.DELIVERY, jobSpec);
    }

    @Override
    public void validateManifest(ExecutionManifest manifest) {
        requireManifest(ServiceType.DELIVERY, manifest);
        Delivery delivery = manifest.delivery();
        if (delivery == null) {
            throw new ManifestValidationException("Missing required field: manifest.delivery");
        }
        if (isBlank(delivery.pickupProofHash())) {
            throw new ManifestValidationException("Missing required field: manifest.delivery.pickupProofHash");
        }
        if (isBlank(delivery.dropoffProofHash())) {
            throw new ManifestValidationException("Missing required field: manifest.delivery.dropoffProofHash");
        }
    }

    @Override
    public ExecutionManifest buildManifest(List<Map<String, Object>> events, JobSpec jobSpec,
                                           long jobId, String robotId, String controller) {
        long startTs = 0;
        long endTs = 0;
        String pickupProof = "";
        String dropoffProof = "";
        Long pickupTs = null;
        Long dropoffTs = null;
        String routeDigest = null;

        for (Map<String, Object> event : events) {
            String type = type(event);
            if ("pickup".equals(type)) {
                pickupProof = getString(event, "proofHash", "");
                pickupTs = getLong(event, "timestamp");
                if (startTs == 0 && pickupTs != null) startTs = pickupTs;
            } else if ("dropoff".equals(type)) {
                dropoffProof = getString(event, "proofHash", "");
                dropoffTs = getLong(event, "timestamp");
                if (dropoffTs != null) endTs = dropoffTs;
            } else if ("start".equals(type)) {
                startTs = getLong(event, "timestamp", 0);
            } else if ("end".equals(type)) {
                endTs = getLong(event, "timestamp", 0);
            } else if ("route".equals(type)) {
                routeDigest = getString(event, "digest");
            }
        }

        long now = clock.instant().getEpochSecond();
        if (startTs == 0) startTs = now - DEFAULT_DURATION_SECONDS;
        if (endTs == 0) endTs = now;

        return new ExecutionManifest(null, null, null, jobId, robotId, controller,
                ServiceType.DELIVERY, startTs, endTs, routeDigest, null, null, null,
                new Delivery(pickupProof, dropoffProof, pickupTs, dropoffTs));
    }

    @Override
    public int computeQualityScore(ExecutionManifest manifest, JobSpec jobSpec) {
        Delivery delivery = manifest.delivery();
        if (delivery == null) return 0;

        int score = 0;
        if (!isBlank(delivery.pickupProofHash())) score += 40;
        if (!isBlank(delivery.dropoffProofHash())) score += 40;
        if (manifest.hasRouteDigest()) score += 10;

        JobSpec.TimeWindow window = jobSpec == null ? null : jobSpec.timeWindow();
        if (window != null) {
            long deliveredAt = delivery.dropoffTs() != null && delivery.dropoffTs() != 0
                    ? delivery.dropoffTs()
                    : manifest.endTs();
            if (deliveredAt != 0 && window.contains(deliveredAt)) {
                score += 10;
            }
        }
        return clampQuality(score);
    }

    @Override
    public int computeWorkUnits(ExecutionManifest manifest, JobSpec jobSpec) {
        return 1;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isEmpty();
    }
}
