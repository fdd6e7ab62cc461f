package com.vrwx.core.crypto;

import com.vrwx.core.domain.Address;

import java.util.Objects;

/**
 * Signing domain for completion claims.
 */
public record Eip712Domain(String name, String version, long chainId, Address verifyingContract) {

    public static final String DEFAULT_NAME = "VRWX";
    public static final String DEFAULT_VERSION = "1";

    public Eip712Domain {
        Objects.requireNonNull(name, "Domain name cannot be null");
        Objects.requireNonNull(version, "Domain version cannot be null");
        Objects.requireNonNull(verifyingContract, "Verifying contract cannot be null");
        if (chainId <= 0) {
            throw new IllegalArgumentException("Chain ID must be positive");
        }
    }

    public static Eip712Domain vrwx(long chainId, Address verifyingContract) {
        return new Eip712Domain(DEFAULT_NAME, DEFAULT_VERSION, chainId, verifyingContract);
    }
}
