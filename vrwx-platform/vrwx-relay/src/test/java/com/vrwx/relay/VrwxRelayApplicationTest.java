package com.vrwx.relay;

import com.vrwx.core.crypto.ClaimSignatures;
import com.vrwx.core.crypto.Keccak;
import com.vrwx.core.domain.Address;
import com.vrwx.core.domain.Bytes32;
import com.vrwx.core.domain.CompletionClaim;
import com.vrwx.core.domain.JobStatus;
import com.vrwx.core.domain.ServiceType;
import com.vrwx.ledger.bond.BondManager;
import com.vrwx.ledger.identity.IdentityRegistry;
import com.vrwx.ledger.job.JobEngine;
import com.vrwx.ledger.token.TokenLedger;
import com.vrwx.relay.claim.ClaimAssembler;
import com.vrwx.relay.submit.CompletionRelayer;
import com.vrwx.relay.submit.CompletionRequest;
import com.vrwx.relay.submit.RelayResult;
import com.vrwx.services.module.ServiceModuleRegistry;
import com.vrwx.services.storage.ManifestStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class VrwxRelayApplicationTest {

    @Autowired
    private IdentityRegistry identity;

    @Autowired
    private BondManager bonds;

    @Autowired
    private JobEngine jobs;

    @Autowired
    @Qualifier("stableToken")
    private TokenLedger stable;

    @Autowired
    private ClaimAssembler assembler;

    @Autowired
    private CompletionRelayer relayer;

    @Autowired
    private ServiceModuleRegistry modules;

    @Autowired
    private ManifestStore manifestStore;

    @Test
    void contextWiresServicesAndStorage() {
        assertThat(modules.supportedTypes()).hasSize(3);
        assertThat(manifestStore.provider()).isEqualTo("memory");
        assertThat(manifestStore.isStrict()).isTrue();
        assertThat(jobs.getDomain().chainId()).isEqualTo(8453L);
    }

    @Test
    void relaysSignedCompletionEndToEnd() throws Exception {
        ECKeyPair key = ECKeyPair.create(BigInteger.valueOf(0x5EED_0003L));
        Address controller = Address.of(Keys.getAddress(key));
        Address buyer = Address.of("0x00000000000000000000000000000000000000b1");
        Bytes32 robotId = Keccak.hashUtf8("robot-context");

        identity.registerRobot(controller, robotId, new byte[]{1}, Keccak.hashUtf8("meta"));
        stable.mint(controller, BigInteger.valueOf(500));
        bonds.deposit(controller, robotId, BigInteger.valueOf(500));
        stable.mint(buyer, BigInteger.valueOf(1000));
        BigInteger jobId = jobs.createJob(buyer, ServiceType.DELIVERY, robotId, Keccak.hashUtf8("spec"),
                BigInteger.valueOf(1000), Instant.now().plus(Duration.ofDays(1)));
        jobs.fund(buyer, jobId);

        Bytes32 completionHash = Keccak.hashUtf8("delivered");
        CompletionClaim claim = assembler.assemble(jobId, completionHash, 100, 1).orElseThrow();
        String signature = ClaimSignatures.signHex(jobs.getDomain(), claim, key);

        RelayResult result = relayer.submit(new CompletionRequest(jobId, completionHash, 100, 1, signature, null))
                .get(10, TimeUnit.SECONDS);

        assertThat(result.success()).isTrue();
        assertThat(jobs.requireJob(jobId).status()).isEqualTo(JobStatus.COMPLETED);
    }
}
