package com.vrwx.core.domain;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Objects;

/**
 * VRWX stake of an operator. At most one unlock request is pending at a time and
 * the pending amount never exceeds what is staked.
 */
public class Stake {

    private final Address operator;
    private BigInteger staked;
    private BigInteger unlockAmount;
    private Instant unlockRequestedAt;

    public Stake(Address operator) {
        this.operator = Objects.requireNonNull(operator, "Operator cannot be null");
        this.staked = BigInteger.ZERO;
        this.unlockAmount = BigInteger.ZERO;
    }

    public void add(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
        this.staked = this.staked.add(amount);
    }

    public void requestUnlock(BigInteger amount, Instant at) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
        if (hasPendingUnlock()) {
            throw new IllegalStateException("Unlock already pending");
        }
        if (amount.compareTo(staked) > 0) {
            throw new IllegalStateException("Cannot unlock more than staked");
        }
        this.unlockAmount = amount;
        this.unlockRequestedAt = at;
    }

    /**
     * Completes the pending unlock and returns the amount released.
     */
    public BigInteger completeUnlock() {
        if (!hasPendingUnlock()) {
            throw new IllegalStateException("No pending unlock");
        }
        BigInteger amount = unlockAmount;
        this.staked = this.staked.subtract(amount);
        cancelUnlock();
        return amount;
    }

    public void cancelUnlock() {
        this.unlockAmount = BigInteger.ZERO;
        this.unlockRequestedAt = null;
    }

    /**
     * Removes stake. A pending unlock larger than the remaining stake is cancelled.
     */
    public void slash(BigInteger amount) {
        if (amount.compareTo(staked) > 0) {
            throw new IllegalStateException("Cannot slash more than staked");
        }
        this.staked = this.staked.subtract(amount);
        if (unlockAmount.compareTo(staked) > 0) {
            cancelUnlock();
        }
    }

    public boolean hasPendingUnlock() {
        return unlockAmount.signum() > 0;
    }

    public BigInteger getEffective() {
        return staked.subtract(unlockAmount);
    }

    public Address getOperator() { return operator; }
    public BigInteger getStaked() { return staked; }
    public BigInteger getUnlockAmount() { return unlockAmount; }
    public Instant getUnlockRequestedAt() { return unlockRequestedAt; }
}
