package com.vrwx.relay.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Completion relayer settings.
 */
@Validated
@ConfigurationProperties(prefix = "vrwx.relay")
public class RelayProperties {

    @NotNull
    @Pattern(regexp = "^0x[0-9a-fA-F]{40}$")
    private String relayerAddress = "0x000000000000000000000000000000000000beef";

    @NotNull
    private RelayMode mode = RelayMode.RELAY;

    /**
     * When set, claimed quality and work units must match the recomputed values before a
     * manifest-backed completion is relayed.
     */
    private boolean strictProof = true;

    /**
     * Size of the shared pool that runs queued submissions across all signers.
     */
    @Min(1)
    private int workerThreads = 4;

    @NotNull
    private Duration shutdownTimeout = Duration.ofSeconds(10);

    public String getRelayerAddress() { return relayerAddress; }
    public void setRelayerAddress(String relayerAddress) { this.relayerAddress = relayerAddress; }
    public RelayMode getMode() { return mode; }
    public void setMode(RelayMode mode) { this.mode = mode; }
    public boolean isStrictProof() { return strictProof; }
    public void setStrictProof(boolean strictProof) { this.strictProof = strictProof; }
    public int getWorkerThreads() { return workerThreads; }
    public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
    public Duration getShutdownTimeout() { return shutdownTimeout; }
    public void setShutdownTimeout(Duration shutdownTimeout) { this.shutdownTimeout = shutdownTimeout; }
}
