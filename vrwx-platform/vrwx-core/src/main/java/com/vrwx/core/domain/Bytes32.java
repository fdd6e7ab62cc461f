package com.vrwx.core.domain;

import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Arrays;

/**
 * Immutable 32-byte value used for robot ids, spec hashes, completion hashes and reason hashes.
 */
public final class Bytes32 {

    public static final Bytes32 ZERO = new Bytes32(new byte[32]);

    private final byte[] bytes;

    private Bytes32(byte[] bytes) {
        this.bytes = bytes;
    }

    public static Bytes32 of(byte[] bytes) {
        if (bytes == null || bytes.length != 32) {
            throw new IllegalArgumentException("Expected exactly 32 bytes");
        }
        return new Bytes32(bytes.clone());
    }

    public static Bytes32 fromHex(String hex) {
        if (hex == null) {
            throw new IllegalArgumentException("Hex value cannot be null");
        }
        String clean = Numeric.cleanHexPrefix(hex.trim());
        if (clean.length() != 64) {
            throw new IllegalArgumentException("Expected 64 hex characters, got " + clean.length());
        }
        return new Bytes32(Numeric.hexStringToByteArray(clean));
    }

    public byte[] toArray() {
        return bytes.clone();
    }

    public String toHex() {
        return Numeric.toHexString(bytes);
    }

    public BigInteger toUnsignedInteger() {
        return new BigInteger(1, bytes);
    }

    public boolean isZero() {
        return equals(ZERO);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Bytes32 other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
