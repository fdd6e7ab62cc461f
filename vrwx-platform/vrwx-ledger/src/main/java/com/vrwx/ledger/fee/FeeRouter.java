package com.vrwx.ledger.fee;

import com.vrwx.core.domain.Address;
import com.vrwx.core.exception.AuthorizationException;
import com.vrwx.core.exception.ErrorCode;
import com.vrwx.core.exception.ValidationException;
import com.vrwx.ledger.access.AccessControl;
import com.vrwx.ledger.access.Role;
import com.vrwx.ledger.config.LedgerProperties;
import com.vrwx.ledger.config.SystemAccounts;
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
 * Burns VRWX listing and settle fees and forwards stable protocol fees to the treasury.
 * Only allowlisted callers may move fees.
 */
@Service
public class FeeRouter {

    private static final Logger log = LoggerFactory.getLogger(FeeRouter.class);

    private final TokenLedger stableToken;
    private final TokenLedger vrwxToken;
    private final AccessControl accessControl;
    private final Set<Address> authorizedCallers = ConcurrentHashMap.newKeySet();

    private volatile Address treasury;
    private volatile BigInteger listingFee;
    private volatile BigInteger settleFee;

    public FeeRouter(@Qualifier("stableToken") TokenLedger stableToken,
                     @Qualifier("vrwxToken") TokenLedger vrwxToken,
                     AccessControl accessControl,
                     SystemAccounts accounts,
                     LedgerProperties properties) {
        this.stableToken = stableToken;
        this.vrwxToken = vrwxToken;
        this.accessControl = accessControl;
        this.treasury = accounts.treasury();
        this.listingFee = properties.getListingFee();
        this.settleFee = properties.getSettleFee();
        authorizedCallers.add(accounts.jobEngine());
        authorizedCallers.add(accounts.offerMatcher());
    }

    // ==================== Fee movements ====================

    public BigInteger burnListingFee(Address caller, Address operator) {
        requireAuthorized(caller);
        BigInteger fee = listingFee;
        if (fee.signum() > 0) {
            vrwxToken.burn(operator, fee);
            log.debug("Burned listing fee {} from {}", fee, operator);
        }
        return fee;
    }

    /**
     * Burns the settle fee from {@code payer}; a zero fee is a no-op.
     */
    public BigInteger burnSettleFee(Address caller, Address payer) {
        requireAuthorized(caller);
        BigInteger fee = settleFee;
        if (fee.signum() > 0) {
            vrwxToken.burn(payer, fee);
            log.debug("Burned settle fee {} from {}", fee, payer);
        }
        return fee;
    }

    public void routeStableFee(Address caller, Address from, BigInteger amount) {
        requireAuthorized(caller);
        if (amount.signum() > 0) {
            stableToken.transfer(from, treasury, amount);
        }
    }

    // ==================== Admin ====================

    public void addAuthorizedCaller(Address admin, Address caller) {
        accessControl.checkRole(Role.ADMIN, admin);
        authorizedCallers.add(Objects.requireNonNull(caller, "Caller cannot be null"));
    }

    public void removeAuthorizedCaller(Address admin, Address caller) {
        accessControl.checkRole(Role.ADMIN, admin);
        authorizedCallers.remove(caller);
    }

    public void setListingFee(Address admin, BigInteger value) {
        accessControl.checkRole(Role.ADMIN, admin);
        this.listingFee = requireNonNegative(value);
    }

    public void setSettleFee(Address admin, BigInteger value) {
        accessControl.checkRole(Role.ADMIN, admin);
        this.settleFee = requireNonNegative(value);
    }

    public void setTreasury(Address admin, Address value) {
        accessControl.checkRole(Role.ADMIN, admin);
        if (value == null || value.isZero()) {
            throw new ValidationException(ErrorCode.INVALID_PARAMETER, "Treasury cannot be the zero address");
        }
        this.treasury = value;
    }

    // ==================== Reads ====================

    public boolean isAuthorizedCaller(Address caller) {
        return authorizedCallers.contains(caller);
    }

    public Address getTreasury() { return treasury; }
    public BigInteger getListingFee() { return listingFee; }
    public BigInteger getSettleFee() { return settleFee; }

    private void requireAuthorized(Address caller) {
        if (caller == null || !authorizedCallers.contains(caller)) {
            throw new AuthorizationException(ErrorCode.NOT_AUTHORIZED_CALLER);
        }
    }

    private static BigInteger requireNonNegative(BigInteger value) {
        if (value == null || value.signum() < 0) {
            throw new ValidationException(ErrorCode.INVALID_PARAMETER, "Fee cannot be negative");
        }
        return value;
    }
}
