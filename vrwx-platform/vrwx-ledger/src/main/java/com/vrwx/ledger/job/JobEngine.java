package com.vrwx.ledger.job;

import com.vrwx.core.crypto.ClaimSignatures;
import com.vrwx.core.crypto.Eip712Domain;
import com.vrwx.core.domain.Address;
import com.vrwx.core.domain.Bytes32;
import com.vrwx.core.domain.CompletionClaim;
import com.vrwx.core.domain.Job;
import com.vrwx.core.domain.JobFinal;
import com.vrwx.core.domain.JobStatus;
import com.vrwx.core.domain.JobView;
import com.vrwx.core.domain.Receipt;
import com.vrwx.core.domain.Robot;
import com.vrwx.core.domain.ServiceType;
import com.vrwx.core.exception.AuthorizationException;
import com.vrwx.core.exception.ErrorCode;
import com.vrwx.core.exception.InsufficientResourceException;
import com.vrwx.core.exception.InvalidStateException;
import com.vrwx.core.exception.LedgerException;
import com.vrwx.core.exception.ValidationException;
import com.vrwx.core.crypto.Keccak;
import com.vrwx.core.protocol.ProtocolConstants;
import com.vrwx.ledger.access.AccessControl;
import com.vrwx.ledger.access.Role;
import com.vrwx.ledger.bond.BondManager;
import com.vrwx.ledger.config.LedgerProperties;
import com.vrwx.ledger.config.SystemAccounts;
import com.vrwx.ledger.fee.FeeRouter;
import com.vrwx.ledger.identity.IdentityRegistry;
import com.vrwx.ledger.receipt.ReceiptLedger;
import com.vrwx.ledger.reputation.ReputationLedger;
import com.vrwx.ledger.rewards.RewardsDistributor;
import com.vrwx.ledger.support.EntityLocks;
import com.vrwx.ledger.token.TokenLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.security.SignatureException;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Job lifecycle and escrow. Buyer funds are held on the engine's own account from funding
 * until settlement, dispute closure or expiry refund.
 *
 * Every operation checks its preconditions under the job lock before the first write.
 * Cross-component effects that can still fail are compensated before the exception propagates.
 */
@Service
public class JobEngine {

    private static final Logger log = LoggerFactory.getLogger(JobEngine.class);

    private final IdentityRegistry identityRegistry;
    private final BondManager bondManager;
    private final ReceiptLedger receiptLedger;
    private final ReputationLedger reputationLedger;
    private final RewardsDistributor rewardsDistributor;
    private final FeeRouter feeRouter;
    private final TokenLedger stableToken;
    private final TokenLedger vrwxToken;
    private final AccessControl accessControl;
    private final Clock clock;
    private final Address self;
    private final Eip712Domain domain;

    private final Map<BigInteger, Job> jobs = new ConcurrentHashMap<>();
    private final Set<BigInteger> consumedClaims = ConcurrentHashMap.newKeySet();
    private final EntityLocks<BigInteger> locks = new EntityLocks<>();
    private final AtomicLong nextJobId = new AtomicLong(1);

    public JobEngine(IdentityRegistry identityRegistry,
                     BondManager bondManager,
                     ReceiptLedger receiptLedger,
                     ReputationLedger reputationLedger,
                     RewardsDistributor rewardsDistributor,
                     FeeRouter feeRouter,
                     @Qualifier("stableToken") TokenLedger stableToken,
                     @Qualifier("vrwxToken") TokenLedger vrwxToken,
                     AccessControl accessControl,
                     SystemAccounts accounts,
                     LedgerProperties properties,
                     Clock clock) {
        this.identityRegistry = identityRegistry;
        this.bondManager = bondManager;
        this.receiptLedger = receiptLedger;
        this.reputationLedger = reputationLedger;
        this.rewardsDistributor = rewardsDistributor;
        this.feeRouter = feeRouter;
        this.stableToken = stableToken;
        this.vrwxToken = vrwxToken;
        this.accessControl = accessControl;
        this.clock = clock;
        this.self = accounts.jobEngine();
        this.domain = Eip712Domain.vrwx(properties.getChainId(), self);
    }

    // ==================== Creation and funding ====================

    public BigInteger createJob(Address buyer, ServiceType serviceType, Bytes32 robotId, Bytes32 jobSpecHash,
                                BigInteger price, Instant deadline) {
        Job job = newJob(buyer, serviceType, robotId, jobSpecHash, price, deadline);
        jobs.put(job.getJobId(), job);
        log.info("Created job {} for robot {} at price {}", job.getJobId(), robotId, price);
        return job.getJobId();
    }

    /**
     * Locks the minimum bond against the robot and moves the price from the buyer into escrow.
     */
    public void fund(Address buyer, BigInteger jobId) {
        locks.withLock(jobId, () -> {
            Job job = requireJobEntity(jobId);
            if (!job.getBuyer().equals(buyer)) {
                throw new AuthorizationException(ErrorCode.NOT_BUYER);
            }
            fundLocked(job, buyer);
        });
    }

    /**
     * Creates and funds a job in one step on behalf of {@code buyer}. If funding fails the job
     * is never registered.
     */
    public BigInteger createAndFund(Address matcher, Address buyer, ServiceType serviceType, Bytes32 robotId,
                                    Bytes32 jobSpecHash, BigInteger price, Instant deadline) {
        accessControl.checkRole(Role.MATCHER, matcher);
        Job job = newJob(buyer, serviceType, robotId, jobSpecHash, price, deadline);
        return locks.withLock(job.getJobId(), () -> {
            fundLocked(job, buyer);
            jobs.put(job.getJobId(), job);
            log.info("Created and funded job {} for robot {} via matcher", job.getJobId(), robotId);
            return job.getJobId();
        });
    }

    private Job newJob(Address buyer, ServiceType serviceType, Bytes32 robotId, Bytes32 jobSpecHash,
                       BigInteger price, Instant deadline) {
        Objects.requireNonNull(buyer, "Buyer cannot be null");
        Objects.requireNonNull(serviceType, "Service type cannot be null");
        Objects.requireNonNull(jobSpecHash, "Job spec hash cannot be null");
        if (price == null || price.signum() <= 0) {
            throw new ValidationException(ErrorCode.INVALID_PRICE);
        }
        Instant now = clock.instant();
        if (deadline == null || !deadline.isAfter(now)) {
            throw new ValidationException(ErrorCode.INVALID_DEADLINE);
        }
        identityRegistry.requireActiveRobot(robotId);
        BigInteger jobId = BigInteger.valueOf(nextJobId.getAndIncrement());
        return new Job(jobId, buyer, robotId, serviceType, jobSpecHash, price, deadline, now);
    }

    private void fundLocked(Job job, Address payer) {
        if (job.getStatus() != JobStatus.CREATED) {
            throw new InvalidStateException(ErrorCode.JOB_NOT_CREATED);
        }
        BigInteger minBond = minBondFor(job.getPrice());
        if (stableToken.balanceOf(payer).compareTo(job.getPrice()) < 0) {
            throw new InsufficientResourceException(ErrorCode.INSUFFICIENT_BALANCE,
                    "Buyer " + payer + " cannot cover price " + job.getPrice());
        }
        if (bondManager.available(job.getRobotId()).compareTo(minBond) < 0) {
            throw new InsufficientResourceException(ErrorCode.INSUFFICIENT_BOND,
                    "Robot " + job.getRobotId() + " cannot cover minimum bond " + minBond);
        }

        if (minBond.signum() > 0) {
            bondManager.lock(self, job.getRobotId(), minBond);
        }
        try {
            stableToken.transfer(payer, self, job.getPrice());
        } catch (LedgerException e) {
            if (minBond.signum() > 0) {
                bondManager.unlock(self, job.getRobotId(), minBond);
            }
            throw e;
        }
        job.markFunded(minBond);
        log.info("Funded job {} with {} escrowed and {} bond locked", job.getJobId(), job.getPrice(), minBond);
    }

    // ==================== Completion ====================

    /**
     * Accepts the controller-signed completion claim. The claim for a job is consumed at most
     * once, atomically with the transition to COMPLETED.
     */
    public JobView submitCompletion(BigInteger jobId, Bytes32 completionHash, int qualityScore, long workUnits,
                                    byte[] signature) {
        Objects.requireNonNull(completionHash, "Completion hash cannot be null");
        return locks.withLock(jobId, () -> {
            Job job = requireJobEntity(jobId);
            if (consumedClaims.contains(jobId)) {
                throw new InvalidStateException(ErrorCode.CLAIM_ALREADY_CONSUMED);
            }
            if (job.getStatus() != JobStatus.FUNDED) {
                throw new InvalidStateException(ErrorCode.JOB_NOT_FUNDED);
            }
            Instant now = clock.instant();
            if (now.isAfter(job.getDeadline())) {
                throw new InvalidStateException(ErrorCode.DEADLINE_PASSED);
            }
            if (qualityScore < 0 || qualityScore > ProtocolConstants.MAX_JOB_QUALITY_SCORE) {
                throw new ValidationException(ErrorCode.QUALITY_OUT_OF_RANGE);
            }
            if (workUnits < 1 || workUnits > ProtocolConstants.MAX_JOB_WORK_UNITS) {
                throw new ValidationException(ErrorCode.WORK_UNITS_OUT_OF_RANGE);
            }

            Robot robot = identityRegistry.requireRobot(job.getRobotId());
            CompletionClaim claim = claimFor(job, completionHash, qualityScore, workUnits, robot.controller());
            verifySignature(claim, signature);

            consumedClaims.add(jobId);
            job.markCompleted(completionHash, qualityScore, (int) workUnits,
                    now.plus(ProtocolConstants.CHALLENGE_WINDOW));
            log.info("Job {} completed with quality {} and {} work units", jobId, qualityScore, workUnits);
            return job.view();
        });
    }

    /**
     * Rebuilds the claim a controller must sign for the job's current state.
     */
    public CompletionClaim claimFor(JobView job, Bytes32 completionHash, int qualityScore, long workUnits,
                                    Address controller) {
        return new CompletionClaim(job.jobId(), job.jobSpecHash(), completionHash, job.robotId(), controller,
                BigInteger.valueOf(job.deadline().getEpochSecond()), qualityScore, workUnits);
    }

    private CompletionClaim claimFor(Job job, Bytes32 completionHash, int qualityScore, long workUnits,
                                     Address controller) {
        return claimFor(job.view(), completionHash, qualityScore, workUnits, controller);
    }

    private void verifySignature(CompletionClaim claim, byte[] signature) {
        Address recovered;
        try {
            recovered = ClaimSignatures.recover(domain, claim, signature);
        } catch (SignatureException e) {
            throw new ValidationException(ErrorCode.INVALID_SIGNATURE, "Invalid controller signature: " + e.getMessage());
        }
        if (!recovered.equals(claim.controller())) {
            throw new ValidationException(ErrorCode.INVALID_SIGNATURE,
                    "Invalid controller signature: recovered " + recovered);
        }
    }

    // ==================== Settlement ====================

    /**
     * Pays the controller, routes the protocol fee, releases the bond, mints the receipt and
     * notifies reputation and rewards. Callable by anyone once the challenge window has elapsed.
     */
    public Settlement settle(BigInteger jobId) {
        return locks.withLock(jobId, () -> {
            Job job = requireJobEntity(jobId);
            if (job.getStatus() != JobStatus.COMPLETED) {
                throw new InvalidStateException(ErrorCode.JOB_NOT_COMPLETED);
            }
            if (clock.instant().isBefore(job.getSettleAfter())) {
                throw new InvalidStateException(ErrorCode.CHALLENGE_WINDOW_OPEN,
                        "Job " + jobId + " settles after " + job.getSettleAfter());
            }
            Address controller = identityRegistry.getController(job.getRobotId());
            BigInteger tokenId = Keccak.receiptTokenId(job.getJobSpecHash(), job.getCompletionHash());
            if (receiptLedger.exists(tokenId)) {
                throw new InvalidStateException(ErrorCode.RECEIPT_EXISTS);
            }
            if (rewardsDistributor.isRewarded(jobId)) {
                throw new InvalidStateException(ErrorCode.REWARD_ALREADY_PAID);
            }
            requireSettlementRights();
            BigInteger settleFee = feeRouter.getSettleFee();
            if (vrwxToken.balanceOf(controller).compareTo(settleFee) < 0) {
                throw new InsufficientResourceException(ErrorCode.INSUFFICIENT_BALANCE,
                        "Controller " + controller + " cannot cover settle fee " + settleFee);
            }

            Settlement quote = settlementFor(job.getPrice());
            feeRouter.burnSettleFee(self, controller);
            stableToken.transfer(self, controller, quote.payout());
            feeRouter.routeStableFee(self, self, quote.fee());
            bondManager.release(self, job.getRobotId(), job.getLockedBond());
            Receipt receipt = receiptLedger.mint(self, controller, jobId, job.getJobSpecHash(), job.getCompletionHash());
            reputationLedger.recordJobComplete(self, job.getRobotId());
            BigInteger reward = rewardsDistributor.onJobFinal(self, jobId,
                    new JobFinal(job.getRobotId(), controller, job.getQualityScore(), job.getWorkUnits()));
            job.markSettled(receipt.tokenId());

            log.info("Settled job {}: payout {} fee {} reward {}", jobId, quote.payout(), quote.fee(), reward);
            return new Settlement(jobId, job.getPrice(), quote.fee(), quote.payout(), receipt.tokenId(), reward);
        });
    }

    /**
     * Every grant the settlement chain relies on, checked before the first write.
     */
    private void requireSettlementRights() {
        if (!feeRouter.isAuthorizedCaller(self)) {
            throw new AuthorizationException(ErrorCode.NOT_AUTHORIZED_CALLER,
                    self + " is not an authorized fee caller");
        }
        accessControl.checkRole(Role.BOND_OPERATOR, self);
        accessControl.checkRole(Role.REPUTATION_WRITER, self);
        accessControl.checkRole(Role.REWARD_NOTIFIER, self);
    }

    /**
     * Refunds a funded job whose deadline passed without a completion.
     */
    public void refundExpired(BigInteger jobId) {
        locks.withLock(jobId, () -> {
            Job job = requireJobEntity(jobId);
            if (job.getStatus() != JobStatus.FUNDED) {
                throw new InvalidStateException(ErrorCode.JOB_NOT_FUNDED);
            }
            if (!clock.instant().isAfter(job.getDeadline())) {
                throw new InvalidStateException(ErrorCode.DEADLINE_NOT_PASSED);
            }
            stableToken.transfer(self, job.getBuyer(), job.getPrice());
            bondManager.release(self, job.getRobotId(), job.getLockedBond());
            job.markExpiredRefund();
            log.info("Refunded expired job {} to {}", jobId, job.getBuyer());
        });
    }

    // ==================== Dispute hooks ====================

    public void markDisputed(Address caller, BigInteger jobId) {
        accessControl.checkRole(Role.DISPUTE_MANAGER, caller);
        locks.withLock(jobId, () -> {
            Job job = requireJobEntity(jobId);
            if (job.getStatus() != JobStatus.COMPLETED) {
                throw new InvalidStateException(ErrorCode.JOB_NOT_COMPLETED);
            }
            if (!clock.instant().isBefore(job.getSettleAfter())) {
                throw new InvalidStateException(ErrorCode.CHALLENGE_WINDOW_CLOSED);
            }
            job.markDisputed();
        });
    }

    public void restoreCompleted(Address caller, BigInteger jobId) {
        accessControl.checkRole(Role.DISPUTE_MANAGER, caller);
        locks.withLock(jobId, () -> {
            Job job = requireJobEntity(jobId);
            if (job.getStatus() != JobStatus.DISPUTED) {
                throw new InvalidStateException(ErrorCode.JOB_NOT_DISPUTED);
            }
            job.restoreCompleted();
        });
    }

    /**
     * Refunds the buyer and closes a disputed job as {@code terminalStatus}. Returns the bond
     * amount that was locked for the job so the caller can slash it.
     */
    public BigInteger closeFraudulent(Address caller, BigInteger jobId, JobStatus terminalStatus) {
        accessControl.checkRole(Role.DISPUTE_MANAGER, caller);
        if (terminalStatus != JobStatus.SLASHED && terminalStatus != JobStatus.REFUNDED) {
            throw new ValidationException(ErrorCode.INVALID_PARAMETER, "Terminal status must be SLASHED or REFUNDED");
        }
        return locks.withLock(jobId, () -> {
            Job job = requireJobEntity(jobId);
            if (job.getStatus() != JobStatus.DISPUTED) {
                throw new InvalidStateException(ErrorCode.JOB_NOT_DISPUTED);
            }
            BigInteger lockedBond = job.getLockedBond();
            stableToken.transfer(self, job.getBuyer(), job.getPrice());
            job.closeDisputed(terminalStatus);
            log.info("Closed disputed job {} as {}, buyer refunded {}", jobId, terminalStatus, job.getPrice());
            return lockedBond;
        });
    }

    // ==================== Reads ====================

    public Optional<JobView> getJob(BigInteger jobId) {
        Job job = jobs.get(jobId);
        return job == null ? Optional.empty() : Optional.of(locks.withLock(jobId, job::view));
    }

    public JobView requireJob(BigInteger jobId) {
        return getJob(jobId).orElseThrow(() -> new InsufficientResourceException(ErrorCode.JOB_NOT_FOUND,
                "Job " + jobId + " not found"));
    }

    public boolean isClaimConsumed(BigInteger jobId) {
        return consumedClaims.contains(jobId);
    }

    public BigInteger minBondFor(BigInteger price) {
        return price.multiply(BigInteger.valueOf(ProtocolConstants.MIN_BOND_RATIO_BPS))
                .divide(ProtocolConstants.BPS_DENOMINATOR);
    }

    public Settlement settlementFor(BigInteger price) {
        BigInteger fee = price.multiply(BigInteger.valueOf(ProtocolConstants.TAU_BPS))
                .divide(ProtocolConstants.BPS_DENOMINATOR);
        return Settlement.quote(price, fee);
    }

    public Eip712Domain getDomain() {
        return domain;
    }

    public Address getAddress() {
        return self;
    }

    private Job requireJobEntity(BigInteger jobId) {
        Job job = jobs.get(jobId);
        if (job == null) {
            throw new InsufficientResourceException(ErrorCode.JOB_NOT_FOUND, "Job " + jobId + " not found");
        }
        return job;
    }
}
