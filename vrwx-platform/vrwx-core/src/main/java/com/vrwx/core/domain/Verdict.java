package com.vrwx.core.domain;

public enum Verdict {
    PENDING,
    VALID,
    FRAUD,
    NON_DELIVERY;

    public boolean isSlashing() {
        return this == FRAUD || this == NON_DELIVERY;
    }
}
