package com.vrwx.ledger.access;

public enum Role {
    ADMIN,
    BOND_OPERATOR,
    SLASHER,
    REPUTATION_WRITER,
    REWARD_NOTIFIER,
    MATCHER,
    DISPUTE_MANAGER,
    ADJUDICATOR
}
