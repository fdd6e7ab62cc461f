package com.vrwx.core.domain;

/**
 * Counters and derived reliability score of a robot, in basis points.
 */
public record ReputationData(long totalJobs, long totalDisputes, long totalSlashes, int reliabilityBps) {

    public static final int MAX_RELIABILITY_BPS = 10_000;

    public static ReputationData unseen() {
        return new ReputationData(0, 0, 0, MAX_RELIABILITY_BPS);
    }
}
