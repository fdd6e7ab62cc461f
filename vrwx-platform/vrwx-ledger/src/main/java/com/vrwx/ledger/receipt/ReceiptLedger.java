package com.vrwx.ledger.receipt;

import com.vrwx.core.crypto.Keccak;
import com.vrwx.core.domain.Address;
import com.vrwx.core.domain.Bytes32;
import com.vrwx.core.domain.Receipt;
import com.vrwx.core.exception.AuthorizationException;
import com.vrwx.core.exception.ErrorCode;
import com.vrwx.core.exception.InvalidStateException;
import com.vrwx.ledger.config.SystemAccounts;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Non-transferable settlement receipts. Only the job engine mints; there is no transfer operation.
 */
@Service
public class ReceiptLedger {

    private final Address minter;
    private final Clock clock;
    private final Map<BigInteger, Receipt> receipts = new ConcurrentHashMap<>();

    public ReceiptLedger(SystemAccounts accounts, Clock clock) {
        this.minter = accounts.jobEngine();
        this.clock = clock;
    }

    public Receipt mint(Address caller, Address owner, BigInteger jobId, Bytes32 jobSpecHash, Bytes32 completionHash) {
        if (!minter.equals(caller)) {
            throw new AuthorizationException(ErrorCode.MISSING_ROLE, "Only the job engine mints receipts");
        }
        BigInteger tokenId = Keccak.receiptTokenId(jobSpecHash, completionHash);
        Receipt receipt = new Receipt(tokenId, owner, jobId, completionHash, clock.instant());
        if (receipts.putIfAbsent(tokenId, receipt) != null) {
            throw new InvalidStateException(ErrorCode.RECEIPT_EXISTS, "Receipt " + tokenId + " already minted");
        }
        return receipt;
    }

    public boolean exists(BigInteger tokenId) {
        return receipts.containsKey(tokenId);
    }

    public Optional<Receipt> getReceipt(BigInteger tokenId) {
        return Optional.ofNullable(receipts.get(tokenId));
    }

    public List<Receipt> receiptsOf(Address owner) {
        return receipts.values().stream().filter(r -> r.owner().equals(owner)).toList();
    }
}
