package com.vrwx.core.exception;

/**
 * Stable error codes raised by ledger operations. Descriptions are part of the contract
 * with off-ledger callers and must not change.
 */
public enum ErrorCode {
    // Authorization
    NOT_BUYER(ErrorCategory.AUTHORIZATION, "Caller is not the job buyer"),
    NOT_CONTROLLER(ErrorCategory.AUTHORIZATION, "Caller is not the robot controller"),
    NOT_OPERATOR(ErrorCategory.AUTHORIZATION, "Caller is not the offer operator"),
    MISSING_ROLE(ErrorCategory.AUTHORIZATION, "Caller lacks the required role"),
    NOT_AUTHORIZED_CALLER(ErrorCategory.AUTHORIZATION, "Caller is not an authorized fee caller"),

    // State
    JOB_NOT_CREATED(ErrorCategory.STATE, "Job is not in CREATED status"),
    JOB_NOT_FUNDED(ErrorCategory.STATE, "Job is not in FUNDED status"),
    JOB_NOT_COMPLETED(ErrorCategory.STATE, "Job is not in COMPLETED status"),
    JOB_NOT_DISPUTED(ErrorCategory.STATE, "Job is not in DISPUTED status"),
    DEADLINE_PASSED(ErrorCategory.STATE, "Job deadline has passed"),
    DEADLINE_NOT_PASSED(ErrorCategory.STATE, "Job deadline has not passed"),
    CLAIM_ALREADY_CONSUMED(ErrorCategory.STATE, "Completion already submitted (anti-replay)"),
    CHALLENGE_WINDOW_OPEN(ErrorCategory.STATE, "Challenge window has not elapsed"),
    CHALLENGE_WINDOW_CLOSED(ErrorCategory.STATE, "Challenge window has closed"),
    DISPUTE_EXISTS(ErrorCategory.STATE, "Dispute already opened for job"),
    DISPUTE_NOT_FOUND(ErrorCategory.STATE, "No dispute for job"),
    DISPUTE_RESOLVED(ErrorCategory.STATE, "Dispute already resolved"),
    UNLOCK_PENDING(ErrorCategory.STATE, "Unlock already pending"),
    NO_PENDING_UNLOCK(ErrorCategory.STATE, "No pending unlock"),
    UNLOCK_DELAY_NOT_ELAPSED(ErrorCategory.STATE, "Unlock delay has not elapsed"),
    ROBOT_ALREADY_REGISTERED(ErrorCategory.STATE, "Robot already registered"),
    ROBOT_INACTIVE(ErrorCategory.STATE, "Robot is deactivated"),
    RECEIPT_EXISTS(ErrorCategory.STATE, "Receipt already minted"),
    REWARD_ALREADY_PAID(ErrorCategory.STATE, "Reward already distributed for job"),
    OFFER_INACTIVE(ErrorCategory.STATE, "Offer is not active"),
    OFFER_EXPIRED(ErrorCategory.STATE, "Offer has expired"),

    // Validation
    INVALID_AMOUNT(ErrorCategory.VALIDATION, "Amount must be positive"),
    INVALID_PRICE(ErrorCategory.VALIDATION, "Price must be positive"),
    INVALID_DEADLINE(ErrorCategory.VALIDATION, "Deadline must be in the future"),
    INVALID_SIGNATURE(ErrorCategory.VALIDATION, "Invalid controller signature"),
    INVALID_VERDICT(ErrorCategory.VALIDATION, "Verdict must not be PENDING"),
    INVALID_PARAMETER(ErrorCategory.VALIDATION, "Parameter out of range"),
    QUALITY_OUT_OF_RANGE(ErrorCategory.VALIDATION, "Quality score out of range"),
    WORK_UNITS_OUT_OF_RANGE(ErrorCategory.VALIDATION, "Work units out of range"),

    // Resource
    ROBOT_NOT_FOUND(ErrorCategory.RESOURCE, "Robot not found in IdentityRegistry"),
    JOB_NOT_FOUND(ErrorCategory.RESOURCE, "Job not found"),
    OFFER_NOT_FOUND(ErrorCategory.RESOURCE, "Offer not found"),
    INSUFFICIENT_BALANCE(ErrorCategory.RESOURCE, "Insufficient token balance"),
    INSUFFICIENT_BOND(ErrorCategory.RESOURCE, "Insufficient available bond"),
    INSUFFICIENT_STAKE(ErrorCategory.RESOURCE, "Insufficient stake");

    private final ErrorCategory category;
    private final String description;

    ErrorCode(ErrorCategory category, String description) {
        this.category = category;
        this.description = description;
    }

    public ErrorCategory category() {
        return category;
    }

    public String description() {
        return description;
    }
}
