package com.vrwx.ledger.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigInteger;

/**
 * Initial values of the admin-tunable ledger parameters and the two externally owned accounts.
 * Protocol constants that are not tunable live in {@code ProtocolConstants}.
 */
@Validated
@ConfigurationProperties(prefix = "vrwx.ledger")
public class LedgerProperties {

    private static final String ADDRESS_REGEX = "^0x[0-9a-fA-F]{40}$";

    @NotNull
    @Pattern(regexp = ADDRESS_REGEX)
    private String admin = "0x00000000000000000000000000000000000000ad";

    @NotNull
    @Pattern(regexp = ADDRESS_REGEX)
    private String treasury = "0x0000000000000000000000000000000000007ea5";

    @Min(1)
    private long chainId = 8453L;

    @NotNull
    @Min(0)
    private BigInteger minStake = BigInteger.valueOf(1000);

    @Min(0)
    @Max(10_000)
    private int slashPercentBps = 2500;

    @NotNull
    @Min(0)
    private BigInteger listingFee = BigInteger.TEN;

    @NotNull
    @Min(0)
    private BigInteger settleFee = BigInteger.ZERO;

    @NotNull
    @Min(0)
    private BigInteger baseReward = BigInteger.valueOf(100);

    public String getAdmin() { return admin; }
    public void setAdmin(String admin) { this.admin = admin; }
    public String getTreasury() { return treasury; }
    public void setTreasury(String treasury) { this.treasury = treasury; }
    public long getChainId() { return chainId; }
    public void setChainId(long chainId) { this.chainId = chainId; }
    public BigInteger getMinStake() { return minStake; }
    public void setMinStake(BigInteger minStake) { this.minStake = minStake; }
    public int getSlashPercentBps() { return slashPercentBps; }
    public void setSlashPercentBps(int slashPercentBps) { this.slashPercentBps = slashPercentBps; }
    public BigInteger getListingFee() { return listingFee; }
    public void setListingFee(BigInteger listingFee) { this.listingFee = listingFee; }
    public BigInteger getSettleFee() { return settleFee; }
    public void setSettleFee(BigInteger settleFee) { this.settleFee = settleFee; }
    public BigInteger getBaseReward() { return baseReward; }
    public void setBaseReward(BigInteger baseReward) { this.baseReward = baseReward; }
}
