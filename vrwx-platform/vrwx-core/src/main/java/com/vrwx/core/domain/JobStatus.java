package com.vrwx.core.domain;

public enum JobStatus {
    CREATED,
    FUNDED,
    COMPLETED,
    DISPUTED,
    SETTLED,
    SLASHED,
    REFUNDED;

    public boolean isTerminal() {
        return this == SETTLED || this == SLASHED || this == REFUNDED;
    }
}
