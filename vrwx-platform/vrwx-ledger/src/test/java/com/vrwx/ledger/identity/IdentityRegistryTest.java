package com.vrwx.ledger.identity;

import com.vrwx.core.crypto.Keccak;
import com.vrwx.core.domain.Robot;
import com.vrwx.core.exception.ErrorCode;
import com.vrwx.core.exception.LedgerException;
import com.vrwx.ledger.LedgerFixture;
import org.junit.jupiter.api.Test;

import static com.vrwx.ledger.LedgerFixture.STRANGER;
import static org.assertj.core.api.Assertions.*;

class IdentityRegistryTest {

    private final LedgerFixture f = new LedgerFixture().withBondedRobot(0);

    private static ErrorCode codeOf(Throwable t) {
        return ((LedgerException) t).getCode();
    }

    @Test
    void robotIdRegistersOnce() {
        assertThatThrownBy(() -> f.identity.registerRobot(STRANGER, f.robotId, new byte[0], null))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.ROBOT_ALREADY_REGISTERED));
        assertThat(f.identity.getController(f.robotId)).isEqualTo(f.controller);
    }

    @Test
    void controllerRotatesKeyAndMetadata() {
        Robot updated = f.identity.updateRobot(f.controller, f.robotId, new byte[]{9}, Keccak.hashUtf8("v2"));

        assertThat(updated.publicKey()).containsExactly(9);
        assertThat(updated.metadataHash()).isEqualTo(Keccak.hashUtf8("v2"));
        assertThatThrownBy(() -> f.identity.updateRobot(STRANGER, f.robotId, new byte[0], null))
                .satisfies(e -> assertThat(codeOf(e)).isEqualTo(ErrorCode.NOT_CONTROLLER));
    }

    @Test
    void deactivationKeepsHistory() {
        f.identity.deactivateRobot(f.admin, f.robotId);

        assertThat(f.identity.isActive(f.robotId)).isFalse();
        assertThat(f.identity.getRobot(f.robotId)).hasValueSatisfying(r ->
                assertThat(r.controller()).isEqualTo(f.controller));
    }

    @Test
    void unknownRobotIsNotFound() {
        assertThatThrownBy(() -> f.identity.requireRobot(Keccak.hashUtf8("ghost")))
                .hasMessageContaining("not found in IdentityRegistry");
    }
}
