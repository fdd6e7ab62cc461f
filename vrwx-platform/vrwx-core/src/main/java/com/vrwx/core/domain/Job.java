package com.vrwx.core.domain;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Objects;

/**
 * Escrowed unit of robotic work.
 *
 * CREATED -> FUNDED -> COMPLETED -> (DISPUTED ->) SETTLED | SLASHED | REFUNDED.
 * A FUNDED job whose deadline passes without a completion may be REFUNDED.
 */
public class Job {

    private final BigInteger jobId;
    private final Address buyer;
    private final Bytes32 robotId;
    private final ServiceType serviceType;
    private final Bytes32 jobSpecHash;
    private final BigInteger price;
    private final Instant deadline;
    private final Instant createdAt;

    private JobStatus status;
    private Bytes32 completionHash;
    private int qualityScore;
    private int workUnits;
    private Instant settleAfter;
    private BigInteger receiptTokenId;
    private BigInteger lockedBond;

    public Job(BigInteger jobId, Address buyer, Bytes32 robotId, ServiceType serviceType,
               Bytes32 jobSpecHash, BigInteger price, Instant deadline, Instant createdAt) {
        this.jobId = Objects.requireNonNull(jobId, "Job ID cannot be null");
        this.buyer = Objects.requireNonNull(buyer, "Buyer cannot be null");
        this.robotId = Objects.requireNonNull(robotId, "Robot ID cannot be null");
        this.serviceType = Objects.requireNonNull(serviceType, "Service type cannot be null");
        this.jobSpecHash = Objects.requireNonNull(jobSpecHash, "Job spec hash cannot be null");
        this.price = Objects.requireNonNull(price, "Price cannot be null");
        this.deadline = Objects.requireNonNull(deadline, "Deadline cannot be null");
        this.createdAt = createdAt;
        this.status = JobStatus.CREATED;
        this.lockedBond = BigInteger.ZERO;
        this.completionHash = Bytes32.ZERO;
    }

    public void markFunded(BigInteger bondLocked) {
        requireStatus(JobStatus.CREATED);
        this.lockedBond = bondLocked;
        this.status = JobStatus.FUNDED;
    }

    public void markCompleted(Bytes32 completionHash, int qualityScore, int workUnits, Instant settleAfter) {
        requireStatus(JobStatus.FUNDED);
        this.completionHash = completionHash;
        this.qualityScore = qualityScore;
        this.workUnits = workUnits;
        this.settleAfter = settleAfter;
        this.status = JobStatus.COMPLETED;
    }

    public void markDisputed() {
        requireStatus(JobStatus.COMPLETED);
        this.status = JobStatus.DISPUTED;
    }

    public void restoreCompleted() {
        requireStatus(JobStatus.DISPUTED);
        this.status = JobStatus.COMPLETED;
    }

    public void markSettled(BigInteger receiptTokenId) {
        requireStatus(JobStatus.COMPLETED);
        this.receiptTokenId = receiptTokenId;
        this.lockedBond = BigInteger.ZERO;
        this.status = JobStatus.SETTLED;
    }

    public void closeDisputed(JobStatus terminal) {
        if (terminal != JobStatus.SLASHED && terminal != JobStatus.REFUNDED) {
            throw new IllegalArgumentException("Dispute can only close as SLASHED or REFUNDED");
        }
        requireStatus(JobStatus.DISPUTED);
        this.lockedBond = BigInteger.ZERO;
        this.status = terminal;
    }

    public void markExpiredRefund() {
        requireStatus(JobStatus.FUNDED);
        this.lockedBond = BigInteger.ZERO;
        this.status = JobStatus.REFUNDED;
    }

    private void requireStatus(JobStatus expected) {
        if (status != expected) {
            throw new IllegalStateException("Job " + jobId + " is " + status + ", expected " + expected);
        }
    }

    // Getters
    public BigInteger getJobId() { return jobId; }
    public Address getBuyer() { return buyer; }
    public Bytes32 getRobotId() { return robotId; }
    public ServiceType getServiceType() { return serviceType; }
    public Bytes32 getJobSpecHash() { return jobSpecHash; }
    public BigInteger getPrice() { return price; }
    public Instant getDeadline() { return deadline; }
    public Instant getCreatedAt() { return createdAt; }
    public JobStatus getStatus() { return status; }
    public Bytes32 getCompletionHash() { return completionHash; }
    public int getQualityScore() { return qualityScore; }
    public int getWorkUnits() { return workUnits; }
    public Instant getSettleAfter() { return settleAfter; }
    public BigInteger getReceiptTokenId() { return receiptTokenId; }
    public BigInteger getLockedBond() { return lockedBond; }

    /**
     * Immutable copy for callers outside the owning service.
     */
    public JobView view() {
        return new JobView(jobId, buyer, robotId, serviceType, jobSpecHash, price, deadline, status,
                completionHash, qualityScore, workUnits, settleAfter, receiptTokenId, lockedBond);
    }
}
