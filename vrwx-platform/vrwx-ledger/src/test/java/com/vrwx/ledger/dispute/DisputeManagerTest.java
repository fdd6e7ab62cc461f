package com.vrwx.ledger.dispute;

import com.vrwx.core.crypto.Keccak;
import com.vrwx.core.domain.Bytes32;
import com.vrwx.core.domain.JobStatus;
import com.vrwx.core.domain.ReputationData;
import com.vrwx.core.domain.Verdict;
import com.vrwx.core.exception.ErrorCode;
import com.vrwx.core.exception.LedgerException;
import com.vrwx.ledger.LedgerFixture;
import com.vrwx.ledger.access.Role;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;

import static com.vrwx.ledger.LedgerFixture.BUYER;
import static com.vrwx.ledger.LedgerFixture.CHALLENGER;
import static com.vrwx.ledger.LedgerFixture.STRANGER;
import static org.assertj.core.api.Assertions.*;

class DisputeManagerTest {

    private static final Bytes32 REASON = Keccak.hashUtf8("robot never arrived");

    private LedgerFixture f;

    @BeforeEach
    void setUp() {
        f = new LedgerFixture().withBondedRobot(500).withOperatorStake(2000);
    }

    private static BigInteger big(long value) {
        return BigInteger.valueOf(value);
    }

    private static ErrorCode codeOf(Throwable t) {
        return ((LedgerException) t).getCode();
    }

    @Test
    void fraudVerdictSlashesBondAndStakeWithoutPayout() {
        BigInteger jobId = f.completedJob(1000, 90, 2);
        f.clock.advance(Duration.ofHours(1));

        f.disputes.openDispute(CHALLENGER, jobId, REASON);
        DisputeManager.DisputeOutcome outcome = f.disputes.resolve(f.admin, jobId, Verdict.FRAUD);

        assertThat(outcome.jobStatus()).isEqualTo(JobStatus.SLASHED);
        assertThat(outcome.bondSlashed()).isEqualTo(big(100));
        assertThat(outcome.stakeSlashed()).isEqualTo(big(500));

        assertThat(f.bonds.bonded(f.robotId)).isEqualTo(big(400));
        assertThat(f.bonds.locked(f.robotId)).isZero();
        assertThat(f.staking.staked(f.controller)).isEqualTo(big(1500));
        assertThat(f.stable.balanceOf(CHALLENGER)).isEqualTo(big(100));
        assertThat(f.vrwx.balanceOf(CHALLENGER)).isEqualTo(big(500));

        assertThat(f.stable.balanceOf(BUYER)).isEqualTo(big(1000));
        assertThat(f.stable.balanceOf(f.controller)).isZero();

        ReputationData rep = f.reputation.getReputation(f.robotId);
        assertThat(rep.totalDisputes()).isEqualTo(1);
        assertThat(rep.totalSlashes()).isEqualTo(1);
        assertThat(rep.reliabilityBps()).isEqualTo(8500);
        assertThat(f.disputes.getDispute(jobId)).hasValueSatisfying(d -> {
            assertThat(d.verdict()).isEqualTo(Verdict.FRAUD);
            assertThat(d.resolvedAt()).isNotNull();
        });
    }

    @Test
    void slashedJobCanNeverSettle() {
        BigInteger jobId = f.completedJob(1000, 90, 2);
        f.disputes.openDispute(CHALLENGER, jobId, REASON);
        f.disputes.resolve(f.admin, jobId, Verdict.FRAUD);
        f.clock.advance(Duration.ofDays(2));

        assertThatThrownBy(() -> f.jobs.settle(jobId))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.JOB_NOT_COMPLETED));
    }

    @Test
    void revokedSlasherLeavesDisputeOpenAndRetryable() {
        BigInteger jobId = f.completedJob(1000, 90, 2);
        f.disputes.openDispute(CHALLENGER, jobId, REASON);
        f.access.revokeRole(f.admin, Role.SLASHER, f.accounts.disputeManager());

        assertThatThrownBy(() -> f.disputes.resolve(f.admin, jobId, Verdict.FRAUD))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.MISSING_ROLE));
        assertThat(f.jobs.requireJob(jobId).status()).isEqualTo(JobStatus.DISPUTED);
        assertThat(f.stable.balanceOf(BUYER)).isZero();
        assertThat(f.stable.balanceOf(CHALLENGER)).isZero();
        assertThat(f.bonds.bonded(f.robotId)).isEqualTo(big(500));
        assertThat(f.bonds.locked(f.robotId)).isEqualTo(big(100));
        assertThat(f.reputation.getReputation(f.robotId).totalDisputes()).isZero();
        assertThat(f.disputes.getDispute(jobId)).hasValueSatisfying(d -> assertThat(d.isResolved()).isFalse());

        f.access.grantRole(f.admin, Role.SLASHER, f.accounts.disputeManager());
        DisputeManager.DisputeOutcome outcome = f.disputes.resolve(f.admin, jobId, Verdict.FRAUD);

        assertThat(outcome.jobStatus()).isEqualTo(JobStatus.SLASHED);
        assertThat(f.stable.balanceOf(BUYER)).isEqualTo(big(1000));
        assertThat(f.bonds.bonded(f.robotId)).isEqualTo(big(400));
    }

    @Test
    void revokedBondOperatorBlocksRefundVerdict() {
        BigInteger jobId = f.completedJob(1000, 90, 2);
        f.disputes.openDispute(CHALLENGER, jobId, REASON);
        f.access.revokeRole(f.admin, Role.BOND_OPERATOR, f.accounts.disputeManager());

        assertThatThrownBy(() -> f.disputes.resolve(f.admin, jobId, Verdict.NON_DELIVERY))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.MISSING_ROLE));
        assertThat(f.jobs.requireJob(jobId).status()).isEqualTo(JobStatus.DISPUTED);
        assertThat(f.stable.balanceOf(f.jobs.getAddress())).isEqualTo(big(1000));
    }

    @Test
    void nonDeliveryVerdictRefundsBuyer() {
        BigInteger jobId = f.completedJob(1000, 90, 2);
        f.disputes.openDispute(CHALLENGER, jobId, REASON);

        f.disputes.resolve(f.admin, jobId, Verdict.NON_DELIVERY);

        assertThat(f.jobs.requireJob(jobId).status()).isEqualTo(JobStatus.REFUNDED);
        assertThat(f.stable.balanceOf(BUYER)).isEqualTo(big(1000));
        assertThat(f.staking.staked(f.controller)).isEqualTo(big(1500));
    }

    @Test
    void validVerdictReturnsJobToSettlement() {
        BigInteger jobId = f.completedJob(1000, 100, 1);
        f.disputes.openDispute(CHALLENGER, jobId, REASON);
        assertThat(f.jobs.requireJob(jobId).status()).isEqualTo(JobStatus.DISPUTED);

        f.disputes.resolve(f.admin, jobId, Verdict.VALID);
        assertThat(f.jobs.requireJob(jobId).status()).isEqualTo(JobStatus.COMPLETED);

        f.clock.advance(Duration.ofHours(24));
        f.jobs.settle(jobId);

        assertThat(f.stable.balanceOf(f.controller)).isEqualTo(big(975));
        assertThat(f.reputation.getReputation(f.robotId).totalDisputes()).isZero();
    }

    @Test
    void disputedJobCannotSettleUntilResolved() {
        BigInteger jobId = f.completedJob(1000, 100, 1);
        f.disputes.openDispute(CHALLENGER, jobId, REASON);
        f.clock.advance(Duration.ofHours(25));

        assertThatThrownBy(() -> f.jobs.settle(jobId))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.JOB_NOT_COMPLETED));
    }

    @Test
    void disputeAfterChallengeWindowIsRejected() {
        BigInteger jobId = f.completedJob(1000, 90, 2);
        f.clock.advance(Duration.ofHours(24));

        assertThatThrownBy(() -> f.disputes.openDispute(CHALLENGER, jobId, REASON))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.CHALLENGE_WINDOW_CLOSED));
        assertThat(f.disputes.getDispute(jobId)).isEmpty();
    }

    @Test
    void disputeOnFundedJobIsRejected() {
        BigInteger jobId = f.fundedJob(1000);

        assertThatThrownBy(() -> f.disputes.openDispute(CHALLENGER, jobId, REASON))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.JOB_NOT_COMPLETED));
    }

    @Test
    void onlyOneDisputePerJob() {
        BigInteger jobId = f.completedJob(1000, 90, 2);
        f.disputes.openDispute(CHALLENGER, jobId, REASON);
        f.disputes.resolve(f.admin, jobId, Verdict.VALID);

        assertThatThrownBy(() -> f.disputes.openDispute(STRANGER, jobId, REASON))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.DISPUTE_EXISTS));
    }

    @Test
    void disputeResolvesOnlyOnce() {
        BigInteger jobId = f.completedJob(1000, 90, 2);
        f.disputes.openDispute(CHALLENGER, jobId, REASON);
        f.disputes.resolve(f.admin, jobId, Verdict.VALID);

        assertThatThrownBy(() -> f.disputes.resolve(f.admin, jobId, Verdict.FRAUD))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.DISPUTE_RESOLVED));
    }

    @Test
    void resolutionRequiresAdjudicator() {
        BigInteger jobId = f.completedJob(1000, 90, 2);
        f.disputes.openDispute(CHALLENGER, jobId, REASON);

        assertThatThrownBy(() -> f.disputes.resolve(STRANGER, jobId, Verdict.FRAUD))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.MISSING_ROLE));
        assertThatThrownBy(() -> f.disputes.resolve(f.admin, jobId, Verdict.PENDING))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.INVALID_VERDICT));
    }

    @Test
    void jobEngineHooksRejectOtherCallers() {
        BigInteger jobId = f.completedJob(1000, 90, 2);

        assertThatThrownBy(() -> f.jobs.markDisputed(STRANGER, jobId))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.MISSING_ROLE));
        assertThatThrownBy(() -> f.jobs.closeFraudulent(STRANGER, jobId, JobStatus.SLASHED))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.MISSING_ROLE));
    }
}
