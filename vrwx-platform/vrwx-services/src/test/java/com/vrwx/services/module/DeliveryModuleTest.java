package com.vrwx.services.module;

import com.vrwx.core.domain.ServiceType;
import com.vrwx.services.Manifests;
import com.vrwx.services.manifest.ExecutionManifest;
import com.vrwx.services.manifest.ExecutionManifest.Delivery;
import com.vrwx.services.manifest.JobSpec;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class DeliveryModuleTest {

    private final DeliveryModule module = new DeliveryModule(Clock.fixed(Instant.ofEpochSecond(1702600000L), ZoneOffset.UTC));
    private final JobSpec spec = Manifests.spec(ServiceType.DELIVERY, 80);

    @Test
    void bothProofsOnTimeWithoutRoute() {
        ExecutionManifest manifest = Manifests.delivery();

        assertThat(module.computeQualityScore(manifest, spec)).isEqualTo(90);
        assertThat(module.computeWorkUnits(manifest, spec)).isEqualTo(1);
    }

    @Test
    void lateDropoffLosesTimingPoints() {
        ExecutionManifest manifest = withDelivery(new Delivery("0xp", "0xd", null, Manifests.WINDOW.end() + 1), "0xroute");

        assertThat(module.computeQualityScore(manifest, spec)).isEqualTo(90);
    }

    @Test
    void everythingPresentScoresHundred() {
        ExecutionManifest manifest = withDelivery(new Delivery("0xp", "0xd", null, Manifests.WINDOW.start()), "0xroute");

        assertThat(module.computeQualityScore(manifest, spec)).isEqualTo(100);
    }

    @Test
    void missingDropoffProofFailsValidation() {
        ExecutionManifest manifest = withDelivery(new Delivery("0xp", "", null, null), null);

        VerificationResult result = module.verifyCompletion(manifest, spec);

        assertThat(result.ok()).isFalse();
        assertThat(result.reason()).isEqualTo("Missing required field: manifest.delivery.dropoffProofHash");
        assertThat(result.workUnits()).isZero();
    }

    @Test
    void buildsManifestFromPickupAndDropoff() {
        List<Map<String, Object>> events = List.of(
                Map.of("type", "pickup", "proofHash", "0xpick", "timestamp", 1702510000L),
                Map.of("type", "dropoff", "proofHash", "0xdrop", "timestamp", 1702511000L),
                Map.of("type", "route", "digest", "0xroute"));

        ExecutionManifest manifest = module.buildManifest(events, spec, 3, "robot-3", "0x123");

        assertThat(manifest.startTs()).isEqualTo(1702510000L);
        assertThat(manifest.endTs()).isEqualTo(1702511000L);
        assertThat(manifest.delivery()).isEqualTo(new Delivery("0xpick", "0xdrop", 1702510000L, 1702511000L));
        assertThat(module.verifyCompletion(manifest, spec)).isEqualTo(VerificationResult.success(100, 1));
    }

    private static ExecutionManifest withDelivery(Delivery delivery, String routeDigest) {
        return new ExecutionManifest(null, null, null, 3, "r", "0xabc", ServiceType.DELIVERY,
                1, 2, routeDigest, null, null, null, delivery);
    }
}
