package com.vrwx.services.module;

import com.vrwx.core.domain.ServiceType;
import com.vrwx.services.manifest.ExecutionManifest;
import com.vrwx.services.manifest.ExecutionManifest.Artifact;
import com.vrwx.services.manifest.ExecutionManifest.Inspection;
import com.vrwx.services.manifest.JobSpec;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.vrwx.services.module.ModuleSupport.*;

/**
 * Facility inspection: the robot visits coverage points and captures artifacts.
 * Quality is 80 points for coverage ratio plus 20 when any artifact was captured.
 */
public final class InspectionModule implements ServiceModule {

    static final int DEFAULT_COVERAGE_TOTAL = 10;
    static final long DEFAULT_DURATION_SECONDS = 300;

    private final Clock clock;

    public InspectionModule(Clock clock) {
        this.clock = clock;
    }

    public InspectionModule() {
        this(Clock.systemUTC());
    }

    @Override
    public ServiceType id() {
        return ServiceType.INSPECTION;
    }

    @Override
    public String label() {
        return "Inspection";
    }

    @Override
    public String description() {
        return "Facility inspection service - robot visits coverage points and captures artifacts (images, scans, reports)";
    }

    @Override
    public List<String> requiredCapabilities() {
        return List.of("navigation", "camera", "localization");
    }

    @Override
    public BigDecimal baseRateUsd() {
        return BigDecimal.valueOf(100);
    }

    @Override
    public void validateSpec(JobSpec jobSpec) {
        requireSpec(ServiceType.INSPECTION, jobSpec);
    }

    @Override
    public void validateManifest(ExecutionManifest manifest) {
        requireManifest(ServiceType.INSPECTION, manifest);
        Inspection inspection = manifest.inspection();
        if (inspection == null) {
            throw new ManifestValidationException("Missing required field: manifest.inspection");
        }
        if (inspection.coverageVisited() == null) {
            throw new ManifestValidationException("Missing required field: manifest.inspection.coverageVisited");
        }
        if (inspection.coverageTotal() == null || inspection.coverageTotal() < 1) {
            throw new ManifestValidationException("Invalid manifest.inspection.coverageTotal: must be >= 1");
        }
        if (inspection.coverageVisited() > inspection.coverageTotal()) {
            throw new ManifestValidationException("Invalid manifest: coverageVisited cannot exceed coverageTotal");
        }
    }

    @Override
    public ExecutionManifest buildManifest(List<Map<String, Object>> events, JobSpec jobSpec,
                                           long jobId, String robotId, String controller) {
        int coverageVisited = 0;
        int coverageTotal = DEFAULT_COVERAGE_TOTAL;
        long startTs = 0;
        long endTs = 0;
        List<Artifact> artifacts = new ArrayList<>();
        String routeDigest = null;
        int anomalies = 0;

        for (Map<String, Object> event : events) {
            String type = type(event);
            if ("coverage".equals(type)) {
                coverageVisited = (int) getLong(event, "visited", 0);
                coverageTotal = (int) getLong(event, "total", DEFAULT_COVERAGE_TOTAL);
            } else if ("artifact".equals(type)) {
                artifacts.add(new Artifact(
                        getString(event, "artifactType", "image"),
                        getString(event, "sha256", ""),
                        getLong(event, "bytes", 0)));
            } else if ("start".equals(type)) {
                startTs = getLong(event, "timestamp", 0);
            } else if ("end".equals(type)) {
                endTs = getLong(event, "timestamp", 0);
            } else if ("route".equals(type)) {
                routeDigest = getString(event, "digest");
            } else if ("anomaly".equals(type)) {
                anomalies++;
            }
        }

        long now = clock.instant().getEpochSecond();
        if (startTs == 0) startTs = now - DEFAULT_DURATION_SECONDS;
        if (endTs == 0) endTs = now;

        return new ExecutionManifest(null, null, null, jobId, robotId, controller,
                ServiceType.INSPECTION, startTs, endTs, routeDigest,
                artifacts.isEmpty() ? null : artifacts,
                new Inspection(coverageVisited, coverageTotal, anomalies > 0 ? anomalies : null),
                null, null);
    }

    @Override
    public int computeQualityScore(ExecutionManifest manifest, JobSpec jobSpec) {
        Inspection inspection = manifest.inspection();
        if (inspection == null) return 0;

        int visited = inspection.coverageVisited() == null ? 0 : inspection.coverageVisited();
        int total = inspection.coverageTotal() == null ? 0 : inspection.coverageTotal();
        double coverageRatio = total > 0 ? (double) visited / total : 0;
        double artifactScore = manifest.artifactCount() > 0 ? 20 : 0;
        return clampQuality(coverageRatio * 80 + artifactScore);
    }

    @Override
    public int computeWorkUnits(ExecutionManifest manifest, JobSpec jobSpec) {
        Inspection inspection = manifest.inspection();
        if (inspection == null) return 0;

        int visited = inspection.coverageVisited() == null ? 0 : inspection.coverageVisited();
        return clampWorkUnits((long) visited + manifest.artifactCount());
    }
}
