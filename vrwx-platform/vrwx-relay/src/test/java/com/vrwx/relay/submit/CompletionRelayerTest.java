package com.vrwx.relay.submit;

import com.vrwx.core.domain.Address;
import com.vrwx.core.domain.CompletionClaim;
import com.vrwx.core.domain.JobStatus;
import com.vrwx.core.domain.JobView;
import com.vrwx.core.domain.ServiceType;
import com.vrwx.core.exception.ErrorCode;
import com.vrwx.core.exception.LedgerException;
import com.vrwx.relay.RelayFixture;
import com.vrwx.relay.config.RelayMode;
import com.vrwx.services.manifest.ExecutionManifest;
import com.vrwx.services.manifest.ExecutionManifest.Inspection;
import com.vrwx.services.manifest.JobSpec;
import com.vrwx.services.manifest.ManifestHasher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.ECKeyPair;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class CompletionRelayerTest {

    private final RelayFixture f = new RelayFixture();
    private CompletionRelayer relayer;

    @AfterEach
    void stop() {
        if (relayer != null) {
            relayer.shutdown();
        }
    }

    private CompletionRelayer relayer() {
        relayer = f.relayer();
        return relayer;
    }

    private CompletionRequest signedRequest(BigInteger jobId, int quality, long workUnits, Address submitter) {
        CompletionClaim claim = f.claim(jobId, f.completionHash, quality, workUnits);
        return new CompletionRequest(jobId, f.completionHash, quality, workUnits,
                f.sign(f.controllerKey, claim), submitter);
    }

    private static RelayResult await(CompletableFuture<RelayResult> future) throws Exception {
        return future.get(10, TimeUnit.SECONDS);
    }

    @Nested
    class Relaying {

        @Test
        void validCompletionOpensChallengeWindow() throws Exception {
            BigInteger jobId = f.fundedJob(1000);

            RelayResult result = await(relayer().submit(signedRequest(jobId, 90, 5, null)));

            assertThat(result.success()).isTrue();
            assertThat(result.signer()).isEqualTo(Address.of(f.relayProperties.getRelayerAddress()));
            assertThat(result.settleAfter()).isEqualTo(RelayFixture.NOW.plus(Duration.ofHours(24)));
            JobView job = f.jobs.requireJob(jobId);
            assertThat(job.status()).isEqualTo(JobStatus.COMPLETED);
            assertThat(job.completionHash()).isEqualTo(f.completionHash);
        }

        @Test
        void replayReportsStableCause() throws Exception {
            BigInteger jobId = f.fundedJob(1000);
            CompletionRequest request = signedRequest(jobId, 90, 5, null);
            CompletionRelayer relayer = relayer();

            assertThat(await(relayer.submit(request)).success()).isTrue();
            RelayResult replay = await(relayer.submit(request));

            assertThat(replay.success()).isFalse();
            assertThat(replay.error()).isEqualTo("Completion already submitted (anti-replay)");
        }

        @Test
        void foreignSignatureIsRejectedBeforeSubmission() throws Exception {
            BigInteger jobId = f.fundedJob(1000);
            CompletionClaim claim = f.claim(jobId, f.completionHash, 90, 5);
            String forged = f.sign(ECKeyPair.create(BigInteger.valueOf(0xBAD)), claim);

            RelayResult result = await(relayer().submit(
                    new CompletionRequest(jobId, f.completionHash, 90, 5, forged, null)));

            assertThat(result.success()).isFalse();
            assertThat(result.error()).contains("does not match controller");
            assertThat(f.jobs.requireJob(jobId).status()).isEqualTo(JobStatus.FUNDED);
        }

        @Test
        void unknownJobIsReported() throws Exception {
            RelayResult result = await(relayer().submit(new CompletionRequest(BigInteger.valueOf(404),
                    f.completionHash, 90, 5, "0x00", null)));

            assertThat(result.error()).isEqualTo("Job not found");
        }

        @Test
        void unparsableSignatureIsInvalid() throws Exception {
            BigInteger jobId = f.fundedJob(1000);

            RelayResult result = await(relayer().submit(
                    new CompletionRequest(jobId, f.completionHash, 90, 5, "", null)));

            assertThat(result.error()).isEqualTo("Invalid controller signature");
        }

        @Test
        void zeroWorkUnitsFailOnLedger() throws Exception {
            BigInteger jobId = f.fundedJob(1000);

            RelayResult result = await(relayer().submit(signedRequest(jobId, 90, 0, null)));

            assertThat(result.success()).isFalse();
            assertThat(result.error()).isNotBlank();
            assertThat(f.jobs.isClaimConsumed(jobId)).isFalse();
        }

        @Test
        void manyJobsRelayThroughOneQueue() throws Exception {
            CompletionRelayer relayer = relayer();
            List<CompletableFuture<RelayResult>> futures = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                futures.add(relayer.submit(signedRequest(f.fundedJob(100), 80, 2, null)));
            }

            for (CompletableFuture<RelayResult> future : futures) {
                assertThat(await(future).success()).isTrue();
            }
            assertThat(relayer.activeSigners()).isEmpty();
        }

        @Test
        void submissionsFromOneSignerRunInOrder() throws Exception {
            CompletionRelayer relayer = relayer();
            BigInteger jobId = f.fundedJob(100);

            CompletableFuture<RelayResult> first = relayer.submit(signedRequest(jobId, 80, 2, null));
            CompletableFuture<RelayResult> second = relayer.submit(signedRequest(jobId, 80, 2, null));

            assertThat(await(first).success()).isTrue();
            assertThat(await(second).error()).isEqualTo(ErrorCode.CLAIM_ALREADY_CONSUMED.description());
        }
    }

    @Nested
    class SelfSubmit {

        @Test
        void eachSubmitterUsesOwnQueue() throws Exception {
            f.relayProperties.setMode(RelayMode.SELF_SUBMIT);
            CompletionRelayer relayer = relayer();
            Address other = Address.of("0x00000000000000000000000000000000000000aa");

            RelayResult first = await(relayer.submit(signedRequest(f.fundedJob(100), 80, 2, f.controller)));
            RelayResult second = await(relayer.submit(signedRequest(f.fundedJob(100), 80, 2, other)));

            assertThat(first.signer()).isEqualTo(f.controller);
            assertThat(second.signer()).isEqualTo(other);
            assertThat(relayer.activeSigners()).isEmpty();
        }

        @Test
        void finishedSubmittersDoNotAccumulate() throws Exception {
            f.relayProperties.setMode(RelayMode.SELF_SUBMIT);
            f.relayProperties.setWorkerThreads(2);
            CompletionRelayer relayer = relayer();
            List<CompletableFuture<RelayResult>> futures = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                Address submitter = Address.of(String.format("0x%040x", 0x1000 + i));
                futures.add(relayer.submit(signedRequest(f.fundedJob(100), 80, 2, submitter)));
            }

            for (CompletableFuture<RelayResult> future : futures) {
                assertThat(await(future).success()).isTrue();
            }
            assertThat(relayer.activeSigners()).isEmpty();
        }
    }

    @Nested
    class ManifestBacked {

        private final JobSpec spec = new JobSpec(ServiceType.INSPECTION, "8928308280fffff",
                new JobSpec.TimeWindow(0, Long.MAX_VALUE), 50, null, null);

        private ExecutionManifest manifest(BigInteger jobId) {
            return new ExecutionManifest(null, null, null, jobId.longValue(), "robot-relay",
                    f.controller.value(), ServiceType.INSPECTION, 1, 2, null, null,
                    new Inspection(9, 10, null), null, null).versioned();
        }

        private String sign(BigInteger jobId, ExecutionManifest manifest, int quality, long workUnits) {
            CompletionClaim claim = f.claim(jobId, ManifestHasher.hash(manifest), quality, workUnits);
            return f.sign(f.controllerKey, claim);
        }

        @Test
        void storesManifestAndCompletesWithItsHash() throws Exception {
            BigInteger jobId = f.fundedJob(1000);
            ExecutionManifest manifest = manifest(jobId);

            RelayResult result = await(relayer().submitManifest(manifest, spec, 72, 9,
                    sign(jobId, manifest, 72, 9), null));

            assertThat(result.success()).isTrue();
            assertThat(result.manifestUrl()).isEqualTo("/manifests/" + ManifestHasher.hashHex(manifest));
            assertThat(f.storage.exists(ManifestHasher.hashHex(manifest))).isTrue();
            assertThat(f.jobs.requireJob(jobId).completionHash()).isEqualTo(ManifestHasher.hash(manifest));
        }

        @Test
        void strictProofRejectsInflatedScore() throws Exception {
            BigInteger jobId = f.fundedJob(1000);
            ExecutionManifest manifest = manifest(jobId);

            RelayResult result = await(relayer().submitManifest(manifest, spec, 95, 9,
                    sign(jobId, manifest, 95, 9), null));

            assertThat(result.success()).isFalse();
            assertThat(result.error()).isEqualTo("Quality mismatch: claimed 95, computed 72");
            assertThat(f.storage.size()).isZero();
        }

        @Test
        void lenientProofRelaysAnyway() throws Exception {
            f.relayProperties.setStrictProof(false);
            BigInteger jobId = f.fundedJob(1000);
            ExecutionManifest manifest = manifest(jobId);

            RelayResult result = await(relayer().submitManifest(manifest, spec, 95, 9,
                    sign(jobId, manifest, 95, 9), null));

            assertThat(result.success()).isTrue();
            assertThat(f.jobs.requireJob(jobId).qualityScore()).isEqualTo(95);
        }
    }

    @Test
    void onlyKnownCodesAreRewritten() {
        assertThat(CompletionRelayer.describe(LedgerException.of(ErrorCode.JOB_NOT_FUNDED, "job 7 is SETTLED")))
                .isEqualTo("Job is not in FUNDED status");
        assertThat(CompletionRelayer.describe(LedgerException.of(ErrorCode.DEADLINE_PASSED, "late")))
                .isEqualTo("Job deadline has passed");
        assertThat(CompletionRelayer.describe(LedgerException.of(ErrorCode.QUALITY_OUT_OF_RANGE, "quality 300")))
                .isEqualTo("quality 300");
    }
}
