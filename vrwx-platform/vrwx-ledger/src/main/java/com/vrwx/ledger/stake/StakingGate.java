package com.vrwx.ledger.stake;

import com.vrwx.core.domain.Address;
import com.vrwx.core.domain.Stake;
import com.vrwx.core.exception.ErrorCode;
import com.vrwx.core.exception.InsufficientResourceException;
import com.vrwx.core.exception.InvalidStateException;
import com.vrwx.core.exception.ValidationException;
import com.vrwx.core.protocol.ProtocolConstants;
import com.vrwx.ledger.access.AccessControl;
import com.vrwx.ledger.access.Role;
import com.vrwx.ledger.config.LedgerProperties;
import com.vrwx.ledger.config.SystemAccounts;
import com.vrwx.ledger.support.EntityLocks;
import com.vrwx.ledger.token.TokenLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Operator stakes in VRWX. Listing offers requires a minimum effective stake; withdrawals go
 * through a delayed unlock; dispute resolution can slash a percentage of the stake.
 */
@Service
public class StakingGate {

    private static final Logger log = LoggerFactory.getLogger(StakingGate.class);

    private final TokenLedger vrwxToken;
    private final AccessControl accessControl;
    private final Clock clock;
    private final Address vault;
    private final Map<Address, Stake> stakes = new ConcurrentHashMap<>();
    private final EntityLocks<Address> locks = new EntityLocks<>();

    private volatile BigInteger minStake;
    private volatile int slashPercentBps;

    public StakingGate(@Qualifier("vrwxToken") TokenLedger vrwxToken,
                       AccessControl accessControl,
                       SystemAccounts accounts,
                       LedgerProperties properties,
                       Clock clock) {
        this.vrwxToken = vrwxToken;
        this.accessControl = accessControl;
        this.clock = clock;
        this.vault = accounts.stakingGate();
        this.minStake = properties.getMinStake();
        this.slashPercentBps = properties.getSlashPercentBps();
    }

    public void stake(Address operator, BigInteger amount) {
        requirePositive(amount);
        locks.withLock(operator, () -> {
            vrwxToken.transfer(operator, vault, amount);
            stakes.computeIfAbsent(operator, Stake::new).add(amount);
            log.debug("Operator {} staked {}", operator, amount);
        });
    }

    public void requestUnlock(Address operator, BigInteger amount) {
        requirePositive(amount);
        locks.withLock(operator, () -> {
            Stake stake = stakes.computeIfAbsent(operator, Stake::new);
            if (stake.hasPendingUnlock()) {
                throw new InvalidStateException(ErrorCode.UNLOCK_PENDING);
            }
            if (amount.compareTo(stake.getStaked()) > 0) {
                throw new InsufficientResourceException(ErrorCode.INSUFFICIENT_STAKE,
                        "Cannot unlock " + amount + ", staked is " + stake.getStaked());
            }
            stake.requestUnlock(amount, clock.instant());
        });
    }

    /**
     * Withdraws the pending unlock once the unlock delay has elapsed.
     */
    public BigInteger unstake(Address operator) {
        return locks.withLock(operator, () -> {
            Stake stake = stakes.get(operator);
            if (stake == null || !stake.hasPendingUnlock()) {
                throw new InvalidStateException(ErrorCode.NO_PENDING_UNLOCK);
            }
            Instant unlockAt = stake.getUnlockRequestedAt().plus(ProtocolConstants.UNLOCK_DELAY);
            if (clock.instant().isBefore(unlockAt)) {
                throw new InvalidStateException(ErrorCode.UNLOCK_DELAY_NOT_ELAPSED,
                        "Unlock available at " + unlockAt);
            }
            BigInteger amount = stake.completeUnlock();
            vrwxToken.transfer(vault, operator, amount);
            log.debug("Operator {} unstaked {}", operator, amount);
            return amount;
        });
    }

    public void cancelUnlock(Address operator) {
        locks.withLock(operator, () -> {
            Stake stake = stakes.get(operator);
            if (stake == null || !stake.hasPendingUnlock()) {
                throw new InvalidStateException(ErrorCode.NO_PENDING_UNLOCK);
            }
            stake.cancelUnlock();
        });
    }

    /**
     * Slashes {@code slashPercentBps} of the operator's stake to {@code recipient}.
     * Returns the amount removed, which is zero for an operator without stake.
     */
    public BigInteger slashStake(Address caller, Address operator, Address recipient) {
        accessControl.checkRole(Role.SLASHER, caller);
        return locks.withLock(operator, () -> {
            Stake stake = stakes.get(operator);
            if (stake == null) {
                return BigInteger.ZERO;
            }
            BigInteger amount = stake.getStaked()
                    .multiply(BigInteger.valueOf(slashPercentBps))
                    .divide(ProtocolConstants.BPS_DENOMINATOR);
            if (amount.signum() == 0) {
                return BigInteger.ZERO;
            }
            stake.slash(amount);
            vrwxToken.transfer(vault, recipient, amount);
            log.info("Slashed {} VRWX stake of {} to {}", amount, operator, recipient);
            return amount;
        });
    }

    // ==================== Reads ====================

    public boolean hasMinStake(Address operator) {
        Stake stake = stakes.get(operator);
        BigInteger effective = stake == null ? BigInteger.ZERO : stake.getEffective();
        return effective.compareTo(minStake) >= 0;
    }

    public BigInteger staked(Address operator) {
        Stake stake = stakes.get(operator);
        return stake == null ? BigInteger.ZERO : stake.getStaked();
    }

    public Optional<StakeInfo> getStake(Address operator) {
        Stake stake = stakes.get(operator);
        if (stake == null) {
            return Optional.empty();
        }
        return locks.withLock(operator, () -> Optional.of(new StakeInfo(
                stake.getStaked(), stake.getUnlockAmount(), stake.getUnlockRequestedAt())));
    }

    public BigInteger getMinStake() {
        return minStake;
    }

    public int getSlashPercentBps() {
        return slashPercentBps;
    }

    // ==================== Admin ====================

    public void setMinStake(Address caller, BigInteger value) {
        accessControl.checkRole(Role.ADMIN, caller);
        if (value == null || value.signum() < 0) {
            throw new ValidationException(ErrorCode.INVALID_PARAMETER, "Min stake cannot be negative");
        }
        this.minStake = value;
    }

    public void setSlashPercentBps(Address caller, int value) {
        accessControl.checkRole(Role.ADMIN, caller);
        if (value < 0 || value > ProtocolConstants.BPS_DENOMINATOR.intValue()) {
            throw new ValidationException(ErrorCode.INVALID_PARAMETER, "Slash percent must be within 0..10000 bps");
        }
        this.slashPercentBps = value;
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT);
        }
    }

    public record StakeInfo(BigInteger staked, BigInteger unlockAmount, Instant unlockRequestedAt) {}
}
