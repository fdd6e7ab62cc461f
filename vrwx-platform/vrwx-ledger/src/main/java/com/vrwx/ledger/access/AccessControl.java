package com.vrwx.ledger.access;

import com.vrwx.core.domain.Address;
import com.vrwx.core.exception.AuthorizationException;
import com.vrwx.core.exception.ErrorCode;
import com.vrwx.ledger.config.SystemAccounts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Flat role table keyed by address. Components consult it before privileged writes.
 *
 * The protocol wiring is granted on construction: the job engine and dispute manager operate
 * bonds and write reputation, the dispute manager slashes stakes, the offer matcher creates
 * funded jobs and the admin adjudicates disputes.
 */
@Service
public class AccessControl {

    private static final Logger log = LoggerFactory.getLogger(AccessControl.class);

    private final Map<Role, Set<Address>> members = new EnumMap<>(Role.class);

    public AccessControl(SystemAccounts accounts) {
        for (Role role : Role.values()) {
            members.put(role, ConcurrentHashMap.newKeySet());
        }
        members.get(Role.ADMIN).add(accounts.admin());
        members.get(Role.ADJUDICATOR).add(accounts.admin());
        members.get(Role.BOND_OPERATOR).add(accounts.jobEngine());
        members.get(Role.BOND_OPERATOR).add(accounts.disputeManager());
        members.get(Role.SLASHER).add(accounts.disputeManager());
        members.get(Role.REPUTATION_WRITER).add(accounts.jobEngine());
        members.get(Role.REPUTATION_WRITER).add(accounts.disputeManager());
        members.get(Role.REWARD_NOTIFIER).add(accounts.jobEngine());
        members.get(Role.MATCHER).add(accounts.offerMatcher());
        members.get(Role.DISPUTE_MANAGER).add(accounts.disputeManager());
    }

    public boolean hasRole(Role role, Address account) {
        return account != null && members.get(role).contains(account);
    }

    public void checkRole(Role role, Address account) {
        if (!hasRole(role, account)) {
            throw new AuthorizationException(ErrorCode.MISSING_ROLE, account + " lacks role " + role);
        }
    }

    public void grantRole(Address caller, Role role, Address account) {
        checkRole(Role.ADMIN, caller);
        Objects.requireNonNull(account, "Account cannot be null");
        if (members.get(role).add(account)) {
            log.info("Granted {} to {}", role, account);
        }
    }

    public void revokeRole(Address caller, Role role, Address account) {
        checkRole(Role.ADMIN, caller);
        if (members.get(role).remove(account)) {
            log.info("Revoked {} from {}", role, account);
        }
    }
}
