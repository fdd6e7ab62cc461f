package com.vrwx.services.module;

import com.vrwx.core.domain.ServiceType;
import com.vrwx.services.Manifests;
import com.vrwx.services.manifest.ExecutionManifest;
import com.vrwx.services.manifest.ExecutionManifest.Inspection;
import com.vrwx.services.manifest.JobSpec;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class InspectionModuleTest {

    private static final Instant NOW = Instant.ofEpochSecond(1702600000L);

    private final InspectionModule module = new InspectionModule(Clock.fixed(NOW, ZoneOffset.UTC));
    private final JobSpec spec = Manifests.spec(ServiceType.INSPECTION, 80);

    @Test
    void scoresCoverageAndArtifacts() {
        ExecutionManifest manifest = Manifests.inspection();

        assertThat(module.computeQualityScore(manifest, spec)).isEqualTo(92);
        assertThat(module.computeWorkUnits(manifest, spec)).isEqualTo(47);
    }

    @Test
    void fullCoverageWithoutArtifactsCapsAtEighty() {
        ExecutionManifest manifest = withInspection(new Inspection(10, 10, null));

        assertThat(module.computeQualityScore(manifest, spec)).isEqualTo(80);
        assertThat(module.computeWorkUnits(manifest, spec)).isEqualTo(10);
    }

    @Test
    void rejectsVisitedAboveTotal() {
        assertThatThrownBy(() -> module.validateManifest(withInspection(new Inspection(11, 10, null))))
                .isInstanceOf(ManifestValidationException.class)
                .hasMessageContaining("coverageVisited cannot exceed coverageTotal");
    }

    @Test
    void rejectsEmptyCoverage() {
        assertThatThrownBy(() -> module.validateManifest(withInspection(new Inspection(0, 0, null))))
                .hasMessageContaining("coverageTotal");
    }

    @Test
    void rejectsSpecForAnotherService() {
        assertThatThrownBy(() -> module.validateSpec(Manifests.spec(ServiceType.DELIVERY, 50)))
                .isInstanceOf(ManifestValidationException.class)
                .hasMessage("Invalid serviceType: expected 'inspection', got 'delivery'");
    }

    @Test
    void rejectsQualityMinAboveHundred() {
        assertThatThrownBy(() -> module.validateSpec(Manifests.spec(ServiceType.INSPECTION, 101)))
                .hasMessage("Invalid qualityMin: must be 0-100, got 101");
    }

    @Test
    void verifyCompletionReportsShortfall() {
        ExecutionManifest manifest = withInspection(new Inspection(5, 10, null));

        VerificationResult result = module.verifyCompletion(manifest, spec);

        assertThat(result.ok()).isFalse();
        assertThat(result.reason()).isEqualTo("Quality score 40 below minimum 80");
        assertThat(result.qualityScore()).isEqualTo(40);
        assertThat(result.workUnits()).isEqualTo(5);
    }

    @Test
    void verifyCompletionReturnsZeroScoresForInvalidManifest() {
        ExecutionManifest manifest = withInspection(null);

        VerificationResult result = module.verifyCompletion(manifest, spec);

        assertThat(result).isEqualTo(VerificationResult.invalid("Missing required field: manifest.inspection"));
    }

    @Test
    void buildsManifestFromEvents() {
        List<Map<String, Object>> events = List.of(
                Map.of("type", "start", "timestamp", 1702500000L),
                Map.of("type", "coverage", "visited", 8, "total", 10),
                Map.of("type", "artifact", "artifactType", "photo", "sha256", "aa", "bytes", 512),
                Map.of("type", "anomaly"),
                Map.of("type", "anomaly"),
                Map.of("type", "route", "digest", "0xroute"),
                Map.of("type", "unknown"));

        ExecutionManifest manifest = module.buildManifest(events, spec, 7, "robot-1", "0xabc");

        assertThat(manifest.serviceType()).isEqualTo(ServiceType.INSPECTION);
        assertThat(manifest.startTs()).isEqualTo(1702500000L);
        assertThat(manifest.endTs()).isEqualTo(NOW.getEpochSecond());
        assertThat(manifest.inspection()).isEqualTo(new Inspection(8, 10, 2));
        assertThat(manifest.artifacts()).hasSize(1);
        assertThat(manifest.routeDigest()).isEqualTo("0xroute");
        assertThat(module.computeQualityScore(manifest, spec)).isEqualTo(84);
    }

    @Test
    void missingEventsFallBackToDefaults() {
        ExecutionManifest manifest = module.buildManifest(List.of(), spec, 7, "robot-1", "0xabc");

        assertThat(manifest.startTs()).isEqualTo(NOW.getEpochSecond() - 300);
        assertThat(manifest.inspection()).isEqualTo(new Inspection(0, 10, null));
        assertThat(manifest.artifacts()).isNull();
    }

    private static ExecutionManifest withInspection(Inspection inspection) {
        return new ExecutionManifest(null, null, null, 1, "r", "0xabc", ServiceType.INSPECTION,
                1, 2, null, null, inspection, null, null);
    }
}
