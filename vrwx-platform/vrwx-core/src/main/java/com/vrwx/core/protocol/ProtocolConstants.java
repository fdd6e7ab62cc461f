package com.vrwx.core.protocol;

import java.math.BigInteger;
import java.time.Duration;

/**
 * Protocol parameters. Values marked as defaults can be overridden through ledger configuration.
 */
public final class ProtocolConstants {

    private ProtocolConstants() {}

    public static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(10_000);

    public static final Duration CHALLENGE_WINDOW = Duration.ofHours(24);
    public static final Duration UNLOCK_DELAY = Duration.ofDays(7);

    /** Protocol fee taken from each settlement, in basis points. */
    public static final int TAU_BPS = 250;
    public static final int MIN_BOND_RATIO_BPS = 1000;

    public static final int DEFAULT_SLASH_PERCENT_BPS = 2500;
    public static final BigInteger DEFAULT_MIN_STAKE = BigInteger.valueOf(1000);
    public static final BigInteger DEFAULT_LISTING_FEE = BigInteger.TEN;
    public static final BigInteger DEFAULT_SETTLE_FEE = BigInteger.ZERO;
    public static final BigInteger DEFAULT_BASE_REWARD = BigInteger.valueOf(100);

    // Reputation
    public static final int DISPUTE_PENALTY_BPS = 500;
    public static final int SLASH_PENALTY_BPS = 1000;
    public static final int MAX_DISPUTE_PENALTY_BPS = 5000;
    public static final int MAX_SLASH_PENALTY_BPS = 5000;

    // Rewards
    public static final int MIN_QUALITY_MULT = 8000;
    public static final int MAX_QUALITY_MULT = 12000;
    public static final int QUALITY_FLOOR = 80;
    public static final int QUALITY_CEILING = 120;
    public static final int MIN_RELIABILITY_MULT = 5000;

    public static final int MAX_JOB_QUALITY_SCORE = 255;
    public static final int MAX_JOB_WORK_UNITS = 65_535;

    public static final long DEFAULT_CHAIN_ID = 8453L;
}
