package com.vrwx.relay.claim;

import com.vrwx.core.crypto.ClaimTypedData;
import com.vrwx.core.domain.CompletionClaim;
import com.vrwx.relay.RelayFixture;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.ECKeyPair;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.*;

class ClaimAssemblerTest {

    private final RelayFixture f = new RelayFixture();

    @Test
    void claimMirrorsLedgerJob() {
        BigInteger jobId = f.fundedJob(500);

        CompletionClaim claim = f.assembler.assemble(jobId, f.completionHash, 77, 3).orElseThrow();

        assertThat(claim.jobId()).isEqualTo(jobId);
        assertThat(claim.jobSpecHash()).isEqualTo(f.jobSpecHash);
        assertThat(claim.robotId()).isEqualTo(f.robotId);
        assertThat(claim.controller()).isEqualTo(f.controller);
        assertThat(claim.deadline()).isEqualTo(BigInteger.valueOf(RelayFixture.NOW.plusSeconds(2 * 86400).getEpochSecond()));
        assertThat(claim.qualityScore()).isEqualTo(77);
        assertThat(claim.workUnits()).isEqualTo(3);
    }

    @Test
    void unknownJobAssemblesNothing() {
        assertThat(f.assembler.assemble(BigInteger.valueOf(999), f.completionHash, 1, 1)).isEmpty();
        assertThat(f.assembler.forSigning(BigInteger.valueOf(999), f.completionHash, 1, 1)).isEmpty();
    }

    @Test
    void typedDataUsesEngineDomain() {
        BigInteger jobId = f.fundedJob(500);

        ClaimForSigning toSign = f.assembler.forSigning(jobId, f.completionHash, 77, 3).orElseThrow();

        assertThat(toSign.domain()).isEqualTo(f.jobs.getDomain());
        assertThat(toSign.typedData().get("primaryType").asText()).isEqualTo(ClaimTypedData.PRIMARY_TYPE);
        assertThat(toSign.typedData().get("domain").get("chainId").asLong()).isEqualTo(8453L);
        assertThat(toSign.typedData().get("message").get("qualityScore").asText()).isEqualTo("77");
    }

    @Test
    void controllerSignatureFromSignerVerifies() {
        BigInteger jobId = f.fundedJob(500);
        ClaimForSigning toSign = f.assembler.forSigning(jobId, f.completionHash, 77, 3).orElseThrow();
        ClaimSigner signer = new ClaimSigner(f.controllerKey);

        String signature = signer.sign(toSign);

        assertThat(signer.getAddress()).isEqualTo(f.controller);
        assertThat(f.verifier.verify(toSign.claim(), signature).valid()).isTrue();
    }

    @Test
    void signerRefusesClaimsOfOtherControllers() {
        BigInteger jobId = f.fundedJob(500);
        ClaimForSigning toSign = f.assembler.forSigning(jobId, f.completionHash, 77, 3).orElseThrow();
        ClaimSigner stranger = new ClaimSigner(ECKeyPair.create(BigInteger.valueOf(0xBAD)));

        assertThatThrownBy(() -> stranger.sign(toSign))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("is not the controller");
    }
}
