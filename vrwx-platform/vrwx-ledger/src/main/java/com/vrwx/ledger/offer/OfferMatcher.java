package com.vrwx.ledger.offer;

import com.vrwx.core.domain.Address;
import com.vrwx.core.domain.Bytes32;
import com.vrwx.core.domain.Offer;
import com.vrwx.core.domain.Robot;
import com.vrwx.core.domain.ServiceType;
import com.vrwx.core.exception.AuthorizationException;
import com.vrwx.core.exception.ErrorCode;
import com.vrwx.core.exception.InsufficientResourceException;
import com.vrwx.core.exception.InvalidStateException;
import com.vrwx.core.exception.ValidationException;
import com.vrwx.ledger.bond.BondManager;
import com.vrwx.ledger.config.SystemAccounts;
import com.vrwx.ledger.fee.FeeRouter;
import com.vrwx.ledger.identity.IdentityRegistry;
import com.vrwx.ledger.job.JobEngine;
import com.vrwx.ledger.stake.StakingGate;
import com.vrwx.ledger.support.EntityLocks;
import com.vrwx.ledger.token.TokenLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Marketplace of fixed-price offers listed by staked operators. Buying an offer creates and
 * funds a job in one step; each offer is consumed at most once.
 *
 * The offer's expiry doubles as the deadline of the job it produces.
 */
@Service
public class OfferMatcher {

    private static final Logger log = LoggerFactory.getLogger(OfferMatcher.class);

    private final JobEngine jobEngine;
    private final StakingGate stakingGate;
    private final FeeRouter feeRouter;
    private final IdentityRegistry identityRegistry;
    private final BondManager bondManager;
    private final TokenLedger vrwxToken;
    private final Clock clock;
    private final Address self;
    private final Map<BigInteger, Offer> offers = new ConcurrentHashMap<>();
    private final EntityLocks<BigInteger> locks = new EntityLocks<>();
    private final AtomicLong nextOfferId = new AtomicLong(1);

    public OfferMatcher(JobEngine jobEngine,
                        StakingGate stakingGate,
                        FeeRouter feeRouter,
                        IdentityRegistry identityRegistry,
                        BondManager bondManager,
                        @Qualifier("vrwxToken") TokenLedger vrwxToken,
                        SystemAccounts accounts,
                        Clock clock) {
        this.jobEngine = jobEngine;
        this.stakingGate = stakingGate;
        this.feeRouter = feeRouter;
        this.identityRegistry = identityRegistry;
        this.bondManager = bondManager;
        this.vrwxToken = vrwxToken;
        this.clock = clock;
        this.self = accounts.offerMatcher();
    }

    /**
     * Lists an offer. The operator must control the robot, hold the minimum stake, have at least
     * {@code minBond} of the robot's bond available and pay the listing fee, which is burned.
     */
    public Offer createOffer(Address operator, ServiceType serviceType, Bytes32 robotId, Bytes32 jobSpecHash,
                             BigInteger price, Instant expiresAt, BigInteger minBond) {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(serviceType, "Service type cannot be null");
        Objects.requireNonNull(jobSpecHash, "Job spec hash cannot be null");
        if (price == null || price.signum() <= 0) {
            throw new ValidationException(ErrorCode.INVALID_PRICE);
        }
        if (expiresAt == null || !expiresAt.isAfter(clock.instant())) {
            throw new ValidationException(ErrorCode.INVALID_DEADLINE);
        }
        BigInteger requiredBond = minBond == null ? BigInteger.ZERO : minBond;
        if (requiredBond.signum() < 0) {
            throw new ValidationException(ErrorCode.INVALID_AMOUNT, "Minimum bond cannot be negative");
        }

        Robot robot = identityRegistry.requireActiveRobot(robotId);
        if (!robot.controller().equals(operator)) {
            throw new AuthorizationException(ErrorCode.NOT_CONTROLLER);
        }
        if (!stakingGate.hasMinStake(operator)) {
            throw new InsufficientResourceException(ErrorCode.INSUFFICIENT_STAKE,
                    "Operator " + operator + " is below the minimum stake of " + stakingGate.getMinStake());
        }
        if (bondManager.available(robotId).compareTo(requiredBond) < 0) {
            throw new InsufficientResourceException(ErrorCode.INSUFFICIENT_BOND,
                    "Robot " + robotId + " has less than " + requiredBond + " bond available");
        }
        if (vrwxToken.balanceOf(operator).compareTo(feeRouter.getListingFee()) < 0) {
            throw new InsufficientResourceException(ErrorCode.INSUFFICIENT_BALANCE,
                    "Operator " + operator + " cannot cover the listing fee");
        }

        feeRouter.burnListingFee(self, operator);
        BigInteger offerId = BigInteger.valueOf(nextOfferId.getAndIncrement());
        Offer offer = new Offer(offerId, operator, robotId, serviceType, jobSpecHash, price, expiresAt,
                requiredBond, true);
        offers.put(offerId, offer);
        log.info("Offer {} listed by {} for robot {} at {}", offerId, operator, robotId, price);
        return offer;
    }

    /**
     * Buys an active, unexpired offer. Returns the id of the funded job.
     */
    public BigInteger buyOffer(Address buyer, BigInteger offerId) {
        Objects.requireNonNull(buyer, "Buyer cannot be null");
        return locks.withLock(offerId, () -> {
            Offer offer = requireOffer(offerId);
            if (!offer.active()) {
                throw new InvalidStateException(ErrorCode.OFFER_INACTIVE);
            }
            if (!clock.instant().isBefore(offer.expiresAt())) {
                throw new InvalidStateException(ErrorCode.OFFER_EXPIRED);
            }
            BigInteger jobId = jobEngine.createAndFund(self, buyer, offer.serviceType(), offer.robotId(),
                    offer.jobSpecHash(), offer.price(), offer.expiresAt());
            offers.put(offerId, offer.deactivated());
            log.info("Offer {} bought by {} as job {}", offerId, buyer, jobId);
            return jobId;
        });
    }

    /**
     * Withdraws an offer. The listing fee is not refunded.
     */
    public void cancelOffer(Address operator, BigInteger offerId) {
        locks.withLock(offerId, () -> {
            Offer offer = requireOffer(offerId);
            if (!offer.operator().equals(operator)) {
                throw new AuthorizationException(ErrorCode.NOT_OPERATOR);
            }
            if (!offer.active()) {
                throw new InvalidStateException(ErrorCode.OFFER_INACTIVE);
            }
            offers.put(offerId, offer.deactivated());
            log.info("Offer {} cancelled by {}", offerId, operator);
        });
    }

    public Optional<Offer> getOffer(BigInteger offerId) {
        return Optional.ofNullable(offers.get(offerId));
    }

    public List<Offer> activeOffers() {
        Instant now = clock.instant();
        return offers.values().stream()
                .filter(o -> o.active() && now.isBefore(o.expiresAt()))
                .toList();
    }

    private Offer requireOffer(BigInteger offerId) {
        Offer offer = offers.get(offerId);
        if (offer == null) {
            throw new InsufficientResourceException(ErrorCode.OFFER_NOT_FOUND, "Offer " + offerId + " not found");
        }
        return offer;
    }
}
