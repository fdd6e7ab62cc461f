package com.vrwx.relay.claim;

import com.vrwx.core.domain.Address;

/**
 * Outcome of checking a completion claim's signature against the identity registry.
 * Addresses are present when they could be determined.
 */
public record VerifyResult(
        boolean valid,
        Address recoveredAddress,
        Address expectedController,
        Error error,
        String message
) {

    public enum Error {
        ROBOT_NOT_FOUND,
        ROBOT_DEACTIVATED,
        SIGNATURE_MISMATCH,
        CONTROLLER_MISMATCH,
        MALFORMED_SIGNATURE
    }

    public static VerifyResult valid(Address recovered, Address controller) {
        return new VerifyResult(true, recovered, controller, null, null);
    }

    public static VerifyResult invalid(Error error, String message) {
        return new VerifyResult(false, null, null, error, message);
    }

    public static VerifyResult invalid(Error error, String message, Address recovered, Address controller) {
        return new VerifyResult(false, recovered, controller, error, message);
    }
}
