package com.vrwx.ledger.dispute;

import com.vrwx.core.domain.Address;
import com.vrwx.core.domain.Bytes32;
import com.vrwx.core.domain.Dispute;
import com.vrwx.core.domain.JobStatus;
import com.vrwx.core.domain.JobView;
import com.vrwx.core.domain.Verdict;
import com.vrwx.core.exception.ErrorCode;
import com.vrwx.core.exception.InvalidStateException;
import com.vrwx.core.exception.ValidationException;
import com.vrwx.ledger.access.AccessControl;
import com.vrwx.ledger.access.Role;
import com.vrwx.ledger.bond.BondManager;
import com.vrwx.ledger.config.SystemAccounts;
import com.vrwx.ledger.identity.IdentityRegistry;
import com.vrwx.ledger.job.JobEngine;
import com.vrwx.ledger.reputation.ReputationLedger;
import com.vrwx.ledger.stake.StakingGate;
import com.vrwx.ledger.support.EntityLocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Challenges against completed jobs during the challenge window and their adjudication.
 *
 * A VALID verdict returns the job to normal settlement. FRAUD and NON_DELIVERY refund the
 * buyer, slash the job's locked bond and a share of the operator's stake to the challenger,
 * and record a dispute and a slash against the robot.
 */
@Service
public class DisputeManager {

    private static final Logger log = LoggerFactory.getLogger(DisputeManager.class);

    private final JobEngine jobEngine;
    private final BondManager bondManager;
    private final StakingGate stakingGate;
    private final ReputationLedger reputationLedger;
    private final IdentityRegistry identityRegistry;
    private final AccessControl accessControl;
    private final Clock clock;
    private final Address self;
    private final Map<BigInteger, Dispute> disputes = new ConcurrentHashMap<>();
    private final EntityLocks<BigInteger> locks = new EntityLocks<>();

    public DisputeManager(JobEngine jobEngine,
                          BondManager bondManager,
                          StakingGate stakingGate,
                          ReputationLedger reputationLedger,
                          IdentityRegistry identityRegistry,
                          AccessControl accessControl,
                          SystemAccounts accounts,
                          Clock clock) {
        this.jobEngine = jobEngine;
        this.bondManager = bondManager;
        this.stakingGate = stakingGate;
        this.reputationLedger = reputationLedger;
        this.identityRegistry = identityRegistry;
        this.accessControl = accessControl;
        this.clock = clock;
        this.self = accounts.disputeManager();
    }

    // ==================== Opening ====================

    /**
     * Opens the single dispute allowed for a job. Only valid while the job is COMPLETED and
     * the challenge window is still open.
     */
    public Dispute openDispute(Address challenger, BigInteger jobId, Bytes32 reasonHash) {
        Objects.requireNonNull(challenger, "Challenger cannot be null");
        Objects.requireNonNull(reasonHash, "Reason hash cannot be null");
        return locks.withLock(jobId, () -> {
            if (disputes.containsKey(jobId)) {
                throw new InvalidStateException(ErrorCode.DISPUTE_EXISTS);
            }
            jobEngine.markDisputed(self, jobId);
            Dispute dispute = Dispute.open(jobId, challenger, reasonHash, clock.instant());
            disputes.put(jobId, dispute);
            log.info("Dispute opened on job {} by {}", jobId, challenger);
            return dispute;
        });
    }

    // ==================== Resolution ====================

    public DisputeOutcome resolve(Address adjudicator, BigInteger jobId, Verdict verdict) {
        accessControl.checkRole(Role.ADJUDICATOR, adjudicator);
        if (verdict == null || verdict == Verdict.PENDING) {
            throw new ValidationException(ErrorCode.INVALID_VERDICT);
        }
        return locks.withLock(jobId, () -> {
            Dispute dispute = disputes.get(jobId);
            if (dispute == null) {
                throw new InvalidStateException(ErrorCode.DISPUTE_NOT_FOUND);
            }
            if (dispute.isResolved()) {
                throw new InvalidStateException(ErrorCode.DISPUTE_RESOLVED);
            }

            DisputeOutcome outcome = verdict.isSlashing()
                    ? punish(dispute, verdict)
                    : clear(jobId);

            disputes.put(jobId, dispute.resolve(verdict, clock.instant()));
            log.info("Dispute on job {} resolved as {}", jobId, verdict);
            return outcome;
        });
    }

    private DisputeOutcome clear(BigInteger jobId) {
        jobEngine.restoreCompleted(self, jobId);
        return new DisputeOutcome(jobId, Verdict.VALID, JobStatus.COMPLETED, BigInteger.ZERO, BigInteger.ZERO);
    }

    private DisputeOutcome punish(Dispute dispute, Verdict verdict) {
        BigInteger jobId = dispute.jobId();
        JobView job = jobEngine.requireJob(jobId);
        Address operator = identityRegistry.getController(job.robotId());
        JobStatus terminal = verdict == Verdict.FRAUD ? JobStatus.SLASHED : JobStatus.REFUNDED;
        if (job.status() != JobStatus.DISPUTED) {
            throw new InvalidStateException(ErrorCode.JOB_NOT_DISPUTED);
        }
        accessControl.checkRole(Role.DISPUTE_MANAGER, self);
        accessControl.checkRole(Role.BOND_OPERATOR, self);
        accessControl.checkRole(Role.SLASHER, self);
        accessControl.checkRole(Role.REPUTATION_WRITER, self);

        BigInteger lockedBond = jobEngine.closeFraudulent(self, jobId, terminal);
        BigInteger bondSlashed = bondManager.slashLocked(self, job.robotId(), lockedBond, dispute.challenger());
        BigInteger stakeSlashed = stakingGate.slashStake(self, operator, dispute.challenger());
        reputationLedger.recordDispute(self, job.robotId());
        reputationLedger.recordSlash(self, job.robotId());

        log.info("Job {} closed as {}: bond slashed {}, stake slashed {}", jobId, terminal, bondSlashed, stakeSlashed);
        return new DisputeOutcome(jobId, verdict, terminal, bondSlashed, stakeSlashed);
    }

    // ==================== Reads ====================

    public Optional<Dispute> getDispute(BigInteger jobId) {
        return Optional.ofNullable(disputes.get(jobId));
    }

    public List<Dispute> pendingDisputes() {
        return disputes.values().stream().filter(d -> !d.isResolved()).toList();
    }

    public record DisputeOutcome(
            BigInteger jobId,
            Verdict verdict,
            JobStatus jobStatus,
            BigInteger bondSlashed,
            BigInteger stakeSlashed
    ) {}
}
