package com.vrwx.ledger.reputation;

import com.vrwx.core.domain.Address;
import com.vrwx.core.domain.Bytes32;
import com.vrwx.core.domain.ReputationData;
import com.vrwx.core.protocol.ProtocolConstants;
import com.vrwx.ledger.access.AccessControl;
import com.vrwx.ledger.access.Role;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-robot job, dispute and slash counters with a derived reliability score in basis points.
 */
@Service
public class ReputationLedger {

    private final AccessControl accessControl;
    private final Map<Bytes32, ReputationData> reputations = new ConcurrentHashMap<>();

    public ReputationLedger(AccessControl accessControl) {
        this.accessControl = accessControl;
    }

    public ReputationData recordJobComplete(Address caller, Bytes32 robotId) {
        accessControl.checkRole(Role.REPUTATION_WRITER, caller);
        return reputations.compute(robotId, (id, r) -> {
            ReputationData current = r == null ? ReputationData.unseen() : r;
            return withScore(current.totalJobs() + 1, current.totalDisputes(), current.totalSlashes());
        });
    }

    public ReputationData recordDispute(Address caller, Bytes32 robotId) {
        accessControl.checkRole(Role.REPUTATION_WRITER, caller);
        return reputations.compute(robotId, (id, r) -> {
            ReputationData current = r == null ? ReputationData.unseen() : r;
            return withScore(current.totalJobs(), current.totalDisputes() + 1, current.totalSlashes());
        });
    }

    public ReputationData recordSlash(Address caller, Bytes32 robotId) {
        accessControl.checkRole(Role.REPUTATION_WRITER, caller);
        return reputations.compute(robotId, (id, r) -> {
            ReputationData current = r == null ? ReputationData.unseen() : r;
            return withScore(current.totalJobs(), current.totalDisputes(), current.totalSlashes() + 1);
        });
    }

    public ReputationData getReputation(Bytes32 robotId) {
        return reputations.getOrDefault(robotId, ReputationData.unseen());
    }

    public int reliabilityBps(Bytes32 robotId) {
        return getReputation(robotId).reliabilityBps();
    }

    /**
     * 10000 minus capped dispute and slash penalties, floored at zero.
     */
    public static int computeReliability(long disputes, long slashes) {
        long disputePenalty = Math.min(ProtocolConstants.MAX_DISPUTE_PENALTY_BPS,
                saturatingMultiply(disputes, ProtocolConstants.DISPUTE_PENALTY_BPS));
        long slashPenalty = Math.min(ProtocolConstants.MAX_SLASH_PENALTY_BPS,
                saturatingMultiply(slashes, ProtocolConstants.SLASH_PENALTY_BPS));
        long penalty = disputePenalty + slashPenalty;
        if (penalty >= ReputationData.MAX_RELIABILITY_BPS) {
            return 0;
        }
        return (int) (ReputationData.MAX_RELIABILITY_BPS - penalty);
    }

    private static ReputationData withScore(long jobs, long disputes, long slashes) {
        return new ReputationData(jobs, disputes, slashes, computeReliability(disputes, slashes));
    }

    private static long saturatingMultiply(long count, int penalty) {
        return count > Long.MAX_VALUE / penalty ? Long.MAX_VALUE : count * penalty;
    }
}
