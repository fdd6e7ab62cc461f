package com.vrwx.relay.submit;

import com.vrwx.core.crypto.ClaimSignatures;
import com.vrwx.core.domain.Address;
import com.vrwx.core.domain.Bytes32;
import com.vrwx.core.domain.CompletionClaim;
import com.vrwx.core.domain.JobView;
import com.vrwx.core.exception.ErrorCode;
import com.vrwx.core.exception.LedgerException;
import com.vrwx.ledger.job.JobEngine;
import com.vrwx.relay.claim.ClaimAssembler;
import com.vrwx.relay.claim.ClaimVerifier;
import com.vrwx.relay.claim.VerifyResult;
import com.vrwx.relay.config.RelayMode;
import com.vrwx.relay.config.RelayProperties;
import com.vrwx.services.manifest.ExecutionManifest;
import com.vrwx.services.manifest.JobSpec;
import com.vrwx.services.manifest.ManifestHasher;
import com.vrwx.services.module.VerificationResult;
import com.vrwx.services.proof.ProofVerifier;
import com.vrwx.services.storage.ManifestStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Verifies signed completions and submits them to the job engine. Submissions from one signing
 * account are serialized by chaining each onto that account's previous submission; different
 * accounts submit in parallel on a shared, fixed-size worker pool. A signer's chain is dropped
 * as soon as its last submission finishes.
 */
@Service
public class CompletionRelayer {

    private static final Logger log = LoggerFactory.getLogger(CompletionRelayer.class);

    /** Ledger errors reported by their stable description rather than the raw message. */
    private static final Set<ErrorCode> STABLE_CAUSES = EnumSet.of(
            ErrorCode.JOB_NOT_FUNDED,
            ErrorCode.DEADLINE_PASSED,
            ErrorCode.CLAIM_ALREADY_CONSUMED,
            ErrorCode.INVALID_SIGNATURE,
            ErrorCode.ROBOT_NOT_FOUND);

    private final JobEngine jobEngine;
    private final ClaimAssembler claimAssembler;
    private final ClaimVerifier claimVerifier;
    private final ProofVerifier proofVerifier;
    private final ManifestStore manifestStore;
    private final RelayProperties properties;
    private final Address relayerAddress;
    private final ExecutorService workers;
    private final Map<Address, CompletableFuture<RelayResult>> tails = new ConcurrentHashMap<>();

    public CompletionRelayer(JobEngine jobEngine,
                             ClaimAssembler claimAssembler,
                             ClaimVerifier claimVerifier,
                             ProofVerifier proofVerifier,
                             ManifestStore manifestStore,
                             RelayProperties properties) {
        this.jobEngine = jobEngine;
        this.claimAssembler = claimAssembler;
        this.claimVerifier = claimVerifier;
        this.proofVerifier = proofVerifier;
        this.manifestStore = manifestStore;
        this.properties = properties;
        this.relayerAddress = Address.of(properties.getRelayerAddress());
        AtomicInteger threadCount = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(properties.getWorkerThreads(), runnable -> {
            Thread thread = new Thread(runnable, "relay-worker-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        log.info("Completion relayer started in {} mode with relayer {}", properties.getMode(), relayerAddress);
    }

    // ==================== Submission ====================

    public CompletableFuture<RelayResult> submit(CompletionRequest request) {
        Address signer = signerFor(request);
        return enqueue(signer, () -> relay(request, signer, null));
    }

    /**
     * Recomputes scores from the manifest, stores it and relays the completion with the
     * manifest hash as completion hash.
     */
    public CompletableFuture<RelayResult> submitManifest(ExecutionManifest manifest, JobSpec jobSpec,
                                                         int qualityScore, long workUnits,
                                                         String signature, Address submitter) {
        BigInteger jobId = BigInteger.valueOf(manifest.jobId());
        Bytes32 manifestHash = ManifestHasher.hash(manifest);
        CompletionRequest request = new CompletionRequest(jobId, manifestHash, qualityScore, workUnits,
                signature, submitter);
        Address signer = signerFor(request);

        VerificationResult scores = proofVerifier.verifyScores(manifest, jobSpec, qualityScore, (int) workUnits);
        if (!scores.ok()) {
            if (properties.isStrictProof()) {
                return CompletableFuture.completedFuture(RelayResult.failure(jobId, signer, scores.reason()));
            }
            log.warn("Relaying job {} despite proof mismatch: {}", jobId, scores.reason());
        }

        return enqueue(signer, () -> {
            String url = manifestStore.store(manifestHash.toHex(), manifest);
            return relay(request, signer, url);
        });
    }

    // ==================== Internal ====================

    private RelayResult relay(CompletionRequest request, Address signer, String manifestUrl) {
        BigInteger jobId = request.jobId();
        Optional<CompletionClaim> claim = claimAssembler.assemble(jobId, request.completionHash(),
                request.qualityScore(), request.workUnits());
        if (claim.isEmpty()) {
            return RelayResult.failure(jobId, signer, jobEngine.getJob(jobId).isEmpty()
                    ? ErrorCode.JOB_NOT_FOUND.description()
                    : ErrorCode.ROBOT_NOT_FOUND.description());
        }

        byte[] signature;
        try {
            signature = ClaimSignatures.parseHex(request.signature());
        } catch (SignatureException e) {
            return RelayResult.failure(jobId, signer, ErrorCode.INVALID_SIGNATURE.description());
        }

        VerifyResult verified = claimVerifier.verify(claim.get(), signature);
        if (!verified.valid()) {
            log.info("Rejected completion for job {}: {}", jobId, verified.message());
            return RelayResult.failure(jobId, signer, verified.message());
        }

        try {
            log.info("Submitting completion for job {} via {}", jobId, signer);
            JobView job = jobEngine.submitCompletion(jobId, request.completionHash(), request.qualityScore(),
                    request.workUnits(), signature);
            return RelayResult.success(job, signer, manifestUrl);
        } catch (LedgerException e) {
            log.warn("Completion for job {} failed: {}", jobId, e.getMessage());
            return RelayResult.failure(jobId, signer, describe(e));
        }
    }

    static String describe(LedgerException e) {
        if (STABLE_CAUSES.contains(e.getCode())) {
            return e.getCode().description();
        }
        return e.getMessage();
    }

    private Address signerFor(CompletionRequest request) {
        if (properties.getMode() == RelayMode.SELF_SUBMIT && request.submitter() != null) {
            return request.submitter();
        }
        return relayerAddress;
    }

    /**
     * Runs {@code task} after every earlier submission of {@code signer} has finished, whether
     * it succeeded or failed. The returned future completes after the signer's entry has been
     * cleared, unless a later submission is already chained behind it.
     */
    private CompletableFuture<RelayResult> enqueue(Address signer, Supplier<RelayResult> task) {
        CompletableFuture<RelayResult> next = tails.compute(signer, (s, tail) -> tail == null
                ? CompletableFuture.supplyAsync(task, workers)
                : tail.handleAsync((result, error) -> task.get(), workers));
        return next.whenComplete((result, error) -> tails.remove(signer, next));
    }

    /**
     * Signers with a submission queued or running.
     */
    public Set<Address> activeSigners() {
        return Set.copyOf(tails.keySet());
    }

    @PreDestroy
    public void shutdown() {
        long timeoutMs = properties.getShutdownTimeout().toMillis();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Completion relayer stopped");
    }
}
