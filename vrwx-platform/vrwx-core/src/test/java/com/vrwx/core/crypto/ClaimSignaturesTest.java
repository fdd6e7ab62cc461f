package com.vrwx.core.crypto;

import com.vrwx.core.domain.Address;
import com.vrwx.core.domain.Bytes32;
import com.vrwx.core.domain.CompletionClaim;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;

import java.math.BigInteger;
import java.security.SignatureException;

import static org.assertj.core.api.Assertions.*;

class ClaimSignaturesTest {

    private static final ECKeyPair CONTROLLER_KEY = ECKeyPair.create(BigInteger.valueOf(0xC0FFEEL));
    private static final ECKeyPair OTHER_KEY = ECKeyPair.create(BigInteger.valueOf(0xBADL));
    private static final Eip712Domain DOMAIN =
            Eip712Domain.vrwx(8453, Address.of("0x00000000000000000000000000000000000000e1"));

    private static Address addressOf(ECKeyPair key) {
        return Address.of(Keys.getAddress(key));
    }

    private static CompletionClaim claim(int quality) {
        return new CompletionClaim(
                BigInteger.valueOf(7),
                Keccak.hashUtf8("spec"),
                Keccak.hashUtf8("manifest"),
                Keccak.hashUtf8("robot-1"),
                addressOf(CONTROLLER_KEY),
                BigInteger.valueOf(1_900_000_000L),
                quality,
                12);
    }

    @Test
    void recoversSigner() throws SignatureException {
        byte[] signature = ClaimSignatures.sign(DOMAIN, claim(90), CONTROLLER_KEY);

        assertThat(signature).hasSize(65);
        assertThat(ClaimSignatures.recover(DOMAIN, claim(90), signature)).isEqualTo(addressOf(CONTROLLER_KEY));
    }

    @Test
    void alteredClaimRecoversDifferentAddress() throws SignatureException {
        byte[] signature = ClaimSignatures.sign(DOMAIN, claim(90), CONTROLLER_KEY);

        assertThat(ClaimSignatures.recover(DOMAIN, claim(91), signature)).isNotEqualTo(addressOf(CONTROLLER_KEY));
    }

    @Test
    void differentDomainChangesDigest() {
        Eip712Domain otherChain = Eip712Domain.vrwx(1, DOMAIN.verifyingContract());

        assertThat(ClaimTypedData.digest(DOMAIN, claim(90)))
                .hasSize(32)
                .isNotEqualTo(ClaimTypedData.digest(otherChain, claim(90)));
    }

    @Test
    void otherKeyDoesNotRecoverToController() throws SignatureException {
        String signature = ClaimSignatures.signHex(DOMAIN, claim(90), OTHER_KEY);

        assertThat(ClaimSignatures.recover(DOMAIN, claim(90), signature))
                .isEqualTo(addressOf(OTHER_KEY))
                .isNotEqualTo(addressOf(CONTROLLER_KEY));
    }

    @Test
    void acceptsZeroBasedRecoveryId() throws SignatureException {
        byte[] signature = ClaimSignatures.sign(DOMAIN, claim(90), CONTROLLER_KEY);
        signature[64] = (byte) (signature[64] - 27);

        assertThat(ClaimSignatures.recover(DOMAIN, claim(90), signature)).isEqualTo(addressOf(CONTROLLER_KEY));
    }

    @Test
    void rejectsShortSignature() {
        assertThatThrownBy(() -> ClaimSignatures.recover(DOMAIN, claim(90), new byte[64]))
                .isInstanceOf(SignatureException.class);
        assertThatThrownBy(() -> ClaimSignatures.recover(DOMAIN, claim(90), "0x"))
                .isInstanceOf(SignatureException.class);
    }

    @Test
    void typedDataCarriesClaimFields() {
        var typed = ClaimTypedData.toTypedData(DOMAIN, claim(90));

        assertThat(typed.get("primaryType").asText()).isEqualTo("CompletionClaimV2");
        assertThat(typed.get("domain").get("name").asText()).isEqualTo("VRWX");
        assertThat(typed.get("message").get("qualityScore").asText()).isEqualTo("90");
        assertThat(typed.get("types").get("CompletionClaimV2")).hasSize(8);
    }
}
