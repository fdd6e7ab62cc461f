package com.vrwx.ledger.identity;

import com.vrwx.core.domain.Address;
import com.vrwx.core.domain.Bytes32;
import com.vrwx.core.domain.Robot;
import com.vrwx.core.exception.AuthorizationException;
import com.vrwx.core.exception.ErrorCode;
import com.vrwx.core.exception.InsufficientResourceException;
import com.vrwx.core.exception.InvalidStateException;
import com.vrwx.ledger.access.AccessControl;
import com.vrwx.ledger.access.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of robots and the controller address that signs for each of them.
 */
@Service
public class IdentityRegistry {

    private static final Logger log = LoggerFactory.getLogger(IdentityRegistry.class);

    private final AccessControl accessControl;
    private final Clock clock;
    private final Map<Bytes32, Robot> robots = new ConcurrentHashMap<>();

    public IdentityRegistry(AccessControl accessControl, Clock clock) {
        this.accessControl = accessControl;
        this.clock = clock;
    }

    /**
     * Registers a robot controlled by the caller. A robot id can be registered once.
     */
    public Robot registerRobot(Address caller, Bytes32 robotId, byte[] publicKey, Bytes32 metadataHash) {
        Objects.requireNonNull(caller, "Caller cannot be null");
        Objects.requireNonNull(robotId, "Robot ID cannot be null");

        Robot robot = new Robot(robotId, caller, publicKey, metadataHash, true, clock.instant());
        Robot existing = robots.putIfAbsent(robotId, robot);
        if (existing != null) {
            throw new InvalidStateException(ErrorCode.ROBOT_ALREADY_REGISTERED, "Robot " + robotId + " already registered");
        }
        log.info("Registered robot {} controlled by {}", robotId, caller);
        return robot;
    }

    /**
     * Rotates the public key and metadata. Controller only; allowed after deactivation so history stays accurate.
     */
    public Robot updateRobot(Address caller, Bytes32 robotId, byte[] publicKey, Bytes32 metadataHash) {
        return robots.compute(robotId, (id, robot) -> {
            requireController(robot, id, caller);
            return robot.withKey(publicKey, metadataHash);
        });
    }

    /**
     * Deactivates a robot for new work. Callable by the controller or an admin.
     */
    public void deactivateRobot(Address caller, Bytes32 robotId) {
        robots.compute(robotId, (id, robot) -> {
            if (robot == null) {
                throw new InsufficientResourceException(ErrorCode.ROBOT_NOT_FOUND);
            }
            if (!robot.controller().equals(caller) && !accessControl.hasRole(Role.ADMIN, caller)) {
                throw new AuthorizationException(ErrorCode.NOT_CONTROLLER);
            }
            log.info("Deactivated robot {}", id);
            return robot.deactivated();
        });
    }

    public Optional<Robot> getRobot(Bytes32 robotId) {
        return Optional.ofNullable(robots.get(robotId));
    }

    public boolean exists(Bytes32 robotId) {
        return robots.containsKey(robotId);
    }

    public boolean isActive(Bytes32 robotId) {
        Robot robot = robots.get(robotId);
        return robot != null && robot.active();
    }

    /**
     * Returns the robot or throws {@code ROBOT_NOT_FOUND}.
     */
    public Robot requireRobot(Bytes32 robotId) {
        return getRobot(robotId).orElseThrow(() -> new InsufficientResourceException(ErrorCode.ROBOT_NOT_FOUND,
                "Robot " + robotId + " not found in IdentityRegistry"));
    }

    /**
     * Returns the robot if it exists and is active; used when assigning new work.
     */
    public Robot requireActiveRobot(Bytes32 robotId) {
        Robot robot = requireRobot(robotId);
        if (!robot.active()) {
            throw new InvalidStateException(ErrorCode.ROBOT_INACTIVE, "Robot " + robotId + " is deactivated");
        }
        return robot;
    }

    public Address getController(Bytes32 robotId) {
        return requireRobot(robotId).controller();
    }

    private static void requireController(Robot robot, Bytes32 robotId, Address caller) {
        if (robot == null) {
            throw new InsufficientResourceException(ErrorCode.ROBOT_NOT_FOUND, "Robot " + robotId + " not found in IdentityRegistry");
        }
        if (!robot.controller().equals(caller)) {
            throw new AuthorizationException(ErrorCode.NOT_CONTROLLER);
        }
    }
}
