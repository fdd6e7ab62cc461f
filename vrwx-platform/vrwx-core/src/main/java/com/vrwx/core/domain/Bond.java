package com.vrwx.core.domain;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Collateral posted for a robot in the stable token.
 * Invariant: bonded >= locked >= 0 after every operation.
 */
public class Bond {

    private final Bytes32 robotId;
    private BigInteger bonded;
    private BigInteger locked;

    public Bond(Bytes32 robotId) {
        this.robotId = Objects.requireNonNull(robotId, "Robot ID cannot be null");
        this.bonded = BigInteger.ZERO;
        this.locked = BigInteger.ZERO;
    }

    public void deposit(BigInteger amount) {
        requirePositive(amount);
        this.bonded = this.bonded.add(amount);
    }

    public void withdraw(BigInteger amount) {
        requirePositive(amount);
        if (amount.compareTo(getAvailable()) > 0) {
            throw new IllegalStateException("Insufficient available bond to withdraw");
        }
        this.bonded = this.bonded.subtract(amount);
    }

    public void lock(BigInteger amount) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Amount cannot be negative");
        }
        if (amount.compareTo(getAvailable()) > 0) {
            throw new IllegalStateException("Insufficient available bond to lock");
        }
        this.locked = this.locked.add(amount);
    }

    public void unlock(BigInteger amount) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Amount cannot be negative");
        }
        if (amount.compareTo(this.locked) > 0) {
            throw new IllegalStateException("Cannot unlock more than locked");
        }
        this.locked = this.locked.subtract(amount);
    }

    /**
     * Removes collateral. Locked is clamped down so that it never exceeds what remains bonded.
     */
    public void slash(BigInteger amount) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("Amount cannot be negative");
        }
        if (amount.compareTo(this.bonded) > 0) {
            throw new IllegalStateException("Cannot slash more than bonded");
        }
        this.bonded = this.bonded.subtract(amount);
        if (this.locked.compareTo(this.bonded) > 0) {
            this.locked = this.bonded;
        }
    }

    public BigInteger getAvailable() {
        return bonded.subtract(locked);
    }

    public Bytes32 getRobotId() { return robotId; }
    public BigInteger getBonded() { return bonded; }
    public BigInteger getLocked() { return locked; }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive");
        }
    }
}
