package com.vrwx.core.crypto;

import com.vrwx.core.domain.Address;
import com.vrwx.core.domain.CompletionClaim;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.Arrays;

/**
 * Signs and recovers completion claims. Signatures are 65 bytes laid out as r || s || v,
 * with v in {27, 28}; a v of 0 or 1 is accepted and shifted.
 */
public final class ClaimSignatures {

    public static final int SIGNATURE_LENGTH = 65;

    private ClaimSignatures() {}

    public static byte[] sign(Eip712Domain domain, CompletionClaim claim, ECKeyPair keyPair) {
        Sign.SignatureData sig = Sign.signMessage(ClaimTypedData.digest(domain, claim), keyPair, false);
        return encode(sig);
    }

    public static String signHex(Eip712Domain domain, CompletionClaim claim, ECKeyPair keyPair) {
        return Numeric.toHexString(sign(domain, claim, keyPair));
    }

    /**
     * Recovers the address that produced {@code signature} over the claim digest.
     *
     * @throws SignatureException if the signature is not 65 bytes or does not recover to a key
     */
    public static Address recover(Eip712Domain domain, CompletionClaim claim, byte[] signature)
            throws SignatureException {
        Sign.SignatureData sig = decode(signature);
        byte[] digest = ClaimTypedData.digest(domain, claim);
        BigInteger publicKey;
        try {
            publicKey = Sign.signedMessageHashToKey(digest, sig);
        } catch (IllegalArgumentException e) {
            throw new SignatureException("Signature does not recover to a public key", e);
        }
        return Address.of(Keys.getAddress(publicKey));
    }

    public static Address recover(Eip712Domain domain, CompletionClaim claim, String signatureHex)
            throws SignatureException {
        return recover(domain, claim, parseHex(signatureHex));
    }

    public static byte[] parseHex(String signatureHex) throws SignatureException {
        if (signatureHex == null || signatureHex.isBlank()) {
            throw new SignatureException("Signature is empty");
        }
        try {
            return Numeric.hexStringToByteArray(signatureHex.trim());
        } catch (RuntimeException e) {
            throw new SignatureException("Signature is not valid hex", e);
        }
    }

    static byte[] encode(Sign.SignatureData sig) {
        byte[] out = new byte[SIGNATURE_LENGTH];
        System.arraycopy(sig.getR(), 0, out, 0, 32);
        System.arraycopy(sig.getS(), 0, out, 32, 32);
        out[64] = sig.getV()[0];
        return out;
    }

    static Sign.SignatureData decode(byte[] signature) throws SignatureException {
        if (signature == null || signature.length != SIGNATURE_LENGTH) {
            throw new SignatureException("Signature must be " + SIGNATURE_LENGTH + " bytes");
        }
        int v = signature[64] & 0xFF;
        if (v < 27) {
            v += 27;
        }
        if (v != 27 && v != 28) {
            throw new SignatureException("Invalid recovery id: " + v);
        }
        byte[] r = Arrays.copyOfRange(signature, 0, 32);
        byte[] s = Arrays.copyOfRange(signature, 32, 64);
        return new Sign.SignatureData((byte) v, r, s);
    }
}
