package com.vrwx.relay.config;

/**
 * Which account's submission queue a completion goes through.
 */
public enum RelayMode {
    /** One configured relayer account submits every completion. */
    RELAY,
    /** Each submitter's own account submits its completions. */
    SELF_SUBMIT
}
