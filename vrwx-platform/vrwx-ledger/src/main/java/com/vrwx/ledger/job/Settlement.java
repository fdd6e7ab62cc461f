package com.vrwx.ledger.job;

import java.math.BigInteger;

/**
 * Amounts moved by a settlement. {@code receiptTokenId} and {@code reward} are null for quotes.
 */
public record Settlement(
        BigInteger jobId,
        BigInteger price,
        BigInteger fee,
        BigInteger payout,
        BigInteger receiptTokenId,
        BigInteger reward
) {
    public static Settlement quote(BigInteger price, BigInteger fee) {
        return new Settlement(null, price, fee, price.subtract(fee), null, null);
    }
}
