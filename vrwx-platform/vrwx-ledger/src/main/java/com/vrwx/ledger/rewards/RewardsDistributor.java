package com.vrwx.ledger.rewards;

import com.vrwx.core.domain.Address;
import com.vrwx.core.domain.Bytes32;
import com.vrwx.core.domain.JobFinal;
import com.vrwx.core.exception.ErrorCode;
import com.vrwx.core.exception.InvalidStateException;
import com.vrwx.core.exception.ValidationException;
import com.vrwx.core.protocol.ProtocolConstants;
import com.vrwx.ledger.access.AccessControl;
import com.vrwx.ledger.access.Role;
import com.vrwx.ledger.config.LedgerProperties;
import com.vrwx.ledger.reputation.ReputationLedger;
import com.vrwx.ledger.token.TokenLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Mints VRWX to controllers of settled jobs.
 *
 * reward = baseReward * workUnits * qualityMult * reliabilityMult / 1e8, where qualityMult
 * runs from 8000 to 12000 over scores 80..120 and reliabilityMult from 5000 to 15000 over
 * reliability 0..10000 bps.
 */
@Service
public class RewardsDistributor {

    private static final Logger log = LoggerFactory.getLogger(RewardsDistributor.class);

    private static final BigInteger MULTIPLIER_SCALE = BigInteger.valueOf(100_000_000L);

    private final ReputationLedger reputationLedger;
    private final TokenLedger vrwxToken;
    private final AccessControl accessControl;
    private final Set<BigInteger> rewardedJobs = ConcurrentHashMap.newKeySet();

    private volatile BigInteger baseReward;

    public RewardsDistributor(ReputationLedger reputationLedger,
                              @Qualifier("vrwxToken") TokenLedger vrwxToken,
                              AccessControl accessControl,
                              LedgerProperties properties) {
        this.reputationLedger = reputationLedger;
        this.vrwxToken = vrwxToken;
        this.accessControl = accessControl;
        this.baseReward = properties.getBaseReward();
    }

    /**
     * Distributes the reward for a finalized job. Each job is rewarded at most once.
     */
    public BigInteger onJobFinal(Address caller, BigInteger jobId, JobFinal outcome) {
        accessControl.checkRole(Role.REWARD_NOTIFIER, caller);
        Objects.requireNonNull(outcome, "Outcome cannot be null");
        if (!rewardedJobs.add(jobId)) {
            throw new InvalidStateException(ErrorCode.REWARD_ALREADY_PAID, "Job " + jobId + " already rewarded");
        }
        BigInteger reward = previewReward(outcome.robotId(), outcome.qualityScore(), outcome.workUnits());
        if (reward.signum() > 0) {
            vrwxToken.mint(outcome.controller(), reward);
        }
        log.info("Job {} rewarded {} VRWX to {}", jobId, reward, outcome.controller());
        return reward;
    }

    public BigInteger previewReward(Bytes32 robotId, int qualityScore, long workUnits) {
        return computeReward(baseReward, workUnits, qualityScore, reputationLedger.reliabilityBps(robotId));
    }

    public boolean isRewarded(BigInteger jobId) {
        return rewardedJobs.contains(jobId);
    }

    public BigInteger getBaseReward() {
        return baseReward;
    }

    public void setBaseReward(Address caller, BigInteger value) {
        accessControl.checkRole(Role.ADMIN, caller);
        if (value == null || value.signum() < 0) {
            throw new ValidationException(ErrorCode.INVALID_PARAMETER, "Base reward cannot be negative");
        }
        this.baseReward = value;
    }

    // ==================== Formula ====================

    public static BigInteger computeReward(BigInteger baseReward, long workUnits, int qualityScore, int reliabilityBps) {
        return baseReward
                .multiply(BigInteger.valueOf(workUnits))
                .multiply(BigInteger.valueOf(qualityMultiplier(qualityScore)))
                .multiply(BigInteger.valueOf(reliabilityMultiplier(reliabilityBps)))
                .divide(MULTIPLIER_SCALE);
    }

    public static int qualityMultiplier(int qualityScore) {
        if (qualityScore < ProtocolConstants.QUALITY_FLOOR) {
            return ProtocolConstants.MIN_QUALITY_MULT;
        }
        if (qualityScore >= ProtocolConstants.QUALITY_CEILING) {
            return ProtocolConstants.MAX_QUALITY_MULT;
        }
        return ProtocolConstants.MIN_QUALITY_MULT + (qualityScore - ProtocolConstants.QUALITY_FLOOR) * 100;
    }

    public static int reliabilityMultiplier(int reliabilityBps) {
        int clamped = Math.max(0, Math.min(reliabilityBps, 10_000));
        return ProtocolConstants.MIN_RELIABILITY_MULT + clamped * 10_000 / 10_000;
    }
}
