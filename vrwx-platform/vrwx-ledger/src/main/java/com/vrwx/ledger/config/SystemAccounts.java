package com.vrwx.ledger.config;

import com.vrwx.core.crypto.Keccak;
import com.vrwx.core.domain.Address;
import org.web3j.utils.Numeric;

import java.util.Arrays;

/**
 * Addresses of the ledger components. Component accounts hold custody balances
 * (escrow, bonds, stakes) and act as callers when one component invokes another.
 * They are derived deterministically from the component name.
 */
public record SystemAccounts(
        Address admin,
        Address treasury,
        Address jobEngine,
        Address bondManager,
        Address stakingGate,
        Address disputeManager,
        Address offerMatcher,
        Address rewardsDistributor,
        Address feeRouter
) {

    public static SystemAccounts of(Address admin, Address treasury) {
        return new SystemAccounts(
                admin,
                treasury,
                derive("JobEngine"),
                derive("BondManager"),
                derive("StakingGate"),
                derive("DisputeManager"),
                derive("OfferMatcher"),
                derive("RewardsDistributor"),
                derive("FeeRouter"));
    }

    public static SystemAccounts from(LedgerProperties properties) {
        return of(Address.of(properties.getAdmin()), Address.of(properties.getTreasury()));
    }

    static Address derive(String component) {
        byte[] hash = Keccak.hashUtf8("vrwx.component." + component).toArray();
        return Address.of(Numeric.toHexString(Arrays.copyOfRange(hash, 12, 32)));
    }
}
