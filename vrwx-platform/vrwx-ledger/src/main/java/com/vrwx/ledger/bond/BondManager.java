package com.vrwx.ledger.bond;

import com.vrwx.core.domain.Address;
import com.vrwx.core.domain.Bond;
import com.vrwx.core.domain.Bytes32;
import com.vrwx.core.exception.AuthorizationException;
import com.vrwx.core.exception.ErrorCode;
import com.vrwx.core.exception.InsufficientResourceException;
import com.vrwx.core.exception.ValidationException;
import com.vrwx.ledger.access.AccessControl;
import com.vrwx.ledger.access.Role;
import com.vrwx.ledger.config.SystemAccounts;
import com.vrwx.ledger.identity.IdentityRegistry;
import com.vrwx.ledger.support.EntityLocks;
import com.vrwx.ledger.token.TokenLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Custody of robot bonds in the stable token. Bonded funds sit on the bond manager's account;
 * locked portions back funded jobs and can be slashed by dispute resolution.
 *
 * Invariant: for every robot bonded >= locked.
 */
@Service
public class BondManager {

    private static final Logger log = LoggerFactory.getLogger(BondManager.class);

    private final IdentityRegistry identityRegistry;
    private final TokenLedger stableToken;
    private final AccessControl accessControl;
    private final Address vault;
    private final Map<Bytes32, Bond> bonds = new ConcurrentHashMap<>();
    private final EntityLocks<Bytes32> locks = new EntityLocks<>();

    public BondManager(IdentityRegistry identityRegistry,
                       @Qualifier("stableToken") TokenLedger stableToken,
                       AccessControl accessControl,
                       SystemAccounts accounts) {
        this.identityRegistry = identityRegistry;
        this.stableToken = stableToken;
        this.accessControl = accessControl;
        this.vault = accounts.bondManager();
    }

    // ==================== Deposits and withdrawals ====================

    /**
     * Moves {@code amount} of the stable token from the caller into the robot's bond.
     */
    public void deposit(Address caller, Bytes32 robotId, BigInteger amount) {
        requirePositive(amount);
        identityRegistry.requireRobot(robotId);
        locks.withLock(robotId, () -> {
            stableToken.transfer(caller, vault, amount);
            bonds.computeIfAbsent(robotId, Bond::new).deposit(amount);
            log.debug("Bond deposit {} for robot {}", amount, robotId);
        });
    }

    /**
     * Returns unlocked bond to the robot's controller.
     */
    public void withdraw(Address caller, Bytes32 robotId, BigInteger amount) {
        requirePositive(amount);
        Address controller = identityRegistry.getController(robotId);
        if (!controller.equals(caller)) {
            throw new AuthorizationException(ErrorCode.NOT_CONTROLLER);
        }
        locks.withLock(robotId, () -> {
            Bond bond = requireAvailable(robotId, amount);
            bond.withdraw(amount);
            stableToken.transfer(vault, controller, amount);
            log.debug("Bond withdrawal {} for robot {}", amount, robotId);
        });
    }

    // ==================== Operator actions ====================

    public void lock(Address caller, Bytes32 robotId, BigInteger amount) {
        accessControl.checkRole(Role.BOND_OPERATOR, caller);
        locks.withLock(robotId, () -> {
            requireAvailable(robotId, amount).lock(amount);
        });
    }

    public void unlock(Address caller, Bytes32 robotId, BigInteger amount) {
        accessControl.checkRole(Role.BOND_OPERATOR, caller);
        locks.withLock(robotId, () -> {
            Bond bond = bonds.computeIfAbsent(robotId, Bond::new);
            if (amount.compareTo(bond.getLocked()) > 0) {
                throw new InsufficientResourceException(ErrorCode.INSUFFICIENT_BOND,
                        "Cannot unlock " + amount + ", locked is " + bond.getLocked());
            }
            bond.unlock(amount);
        });
    }

    /**
     * Unlocks up to {@code amount}, capped at what is currently locked, and returns the amount
     * released. Used when a job ends; an intervening slash may already have reduced the lock.
     */
    public BigInteger release(Address caller, Bytes32 robotId, BigInteger amount) {
        accessControl.checkRole(Role.BOND_OPERATOR, caller);
        return locks.withLock(robotId, () -> {
            Bond bond = bonds.computeIfAbsent(robotId, Bond::new);
            BigInteger released = amount.min(bond.getLocked());
            bond.unlock(released);
            return released;
        });
    }

    /**
     * Transfers {@code amount} of bonded funds to {@code recipient}. Locked is clamped so that
     * it never exceeds what remains bonded.
     */
    public BigInteger slash(Address caller, Bytes32 robotId, BigInteger amount, Address recipient) {
        accessControl.checkRole(Role.BOND_OPERATOR, caller);
        Objects.requireNonNull(recipient, "Recipient cannot be null");
        return locks.withLock(robotId, () -> {
            Bond bond = bonds.computeIfAbsent(robotId, Bond::new);
            if (amount.compareTo(bond.getBonded()) > 0) {
                throw new InsufficientResourceException(ErrorCode.INSUFFICIENT_BOND,
                        "Cannot slash " + amount + ", bonded is " + bond.getBonded());
            }
            bond.slash(amount);
            if (amount.signum() > 0) {
                stableToken.transfer(vault, recipient, amount);
            }
            log.info("Slashed {} from robot {} bond to {}", amount, robotId, recipient);
            return amount;
        });
    }

    /**
     * Releases a job's lock and slashes the same amount in one step, so the freed collateral
     * cannot be re-locked in between. The amount is capped at what is currently locked.
     */
    public BigInteger slashLocked(Address caller, Bytes32 robotId, BigInteger amount, Address recipient) {
        accessControl.checkRole(Role.BOND_OPERATOR, caller);
        return locks.withLock(robotId, () -> {
            Bond bond = bonds.computeIfAbsent(robotId, Bond::new);
            BigInteger slashed = amount.min(bond.getLocked());
            bond.unlock(slashed);
            return slash(caller, robotId, slashed, recipient);
        });
    }

    // ==================== Reads ====================

    public BigInteger bonded(Bytes32 robotId) {
        Bond bond = bonds.get(robotId);
        return bond == null ? BigInteger.ZERO : bond.getBonded();
    }

    public BigInteger locked(Bytes32 robotId) {
        Bond bond = bonds.get(robotId);
        return bond == null ? BigInteger.ZERO : bond.getLocked();
    }

    public BigInteger available(Bytes32 robotId) {
        Bond bond = bonds.get(robotId);
        return bond == null ? BigInteger.ZERO : bond.getAvailable();
    }

    private Bond requireAvailable(Bytes32 robotId, BigInteger amount) {
        Bond bond = bonds.computeIfAbsent(robotId, Bond::new);
        if (amount.compareTo(bond.getAvailable()) > 0) {
            throw new InsufficientResourceException(ErrorCode.INSUFFICIENT_BOND,
                    "Robot " + robotId + " has " + bond.getAvailable() + " available, needs " + amount);
        }
        return bond;
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT);
        }
    }
}
