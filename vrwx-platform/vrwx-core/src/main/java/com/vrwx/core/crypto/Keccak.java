package com.vrwx.core.crypto;

import com.vrwx.core.domain.Bytes32;
import org.web3j.crypto.Hash;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * keccak256 helpers shared by the ledger, the scoring modules and the relayer.
 */
public final class Keccak {

    private Keccak() {}

    public static Bytes32 hash(byte[] input) {
        return Bytes32.of(Hash.sha3(input));
    }

    public static Bytes32 hashUtf8(String input) {
        return hash(input.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * keccak256(abi.encode(a, b)) for two bytes32 words, which is the hash of their concatenation.
     */
    public static Bytes32 hashPair(Bytes32 a, Bytes32 b) {
        byte[] packed = new byte[64];
        System.arraycopy(a.toArray(), 0, packed, 0, 32);
        System.arraycopy(b.toArray(), 0, packed, 32, 32);
        return hash(packed);
    }

    /**
     * Token id of the receipt minted for a settled job.
     */
    public static BigInteger receiptTokenId(Bytes32 jobSpecHash, Bytes32 completionHash) {
        return hashPair(jobSpecHash, completionHash).toUnsignedInteger();
    }
}
