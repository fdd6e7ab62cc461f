package com.vrwx.ledger.fee;

import com.vrwx.core.domain.Address;
import com.vrwx.core.exception.AuthorizationException;
import com.vrwx.ledger.LedgerFixture;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.vrwx.ledger.LedgerFixture.STRANGER;
import static org.assertj.core.api.Assertions.*;

class FeeRouterTest {

    private final LedgerFixture f = new LedgerFixture();
    private final FeeRouter fees = f.fees;

    @Test
    void unlistedCallersCannotMoveFees() {
        assertThatThrownBy(() -> fees.burnListingFee(STRANGER, f.controller))
                .isInstanceOf(AuthorizationException.class);
        assertThatThrownBy(() -> fees.routeStableFee(STRANGER, f.controller, BigInteger.ONE))
                .isInstanceOf(AuthorizationException.class);
    }

    @Test
    void zeroSettleFeeIsNoOp() {
        assertThat(fees.burnSettleFee(f.accounts.jobEngine(), f.controller)).isZero();
    }

    @Test
    void stableFeesGoToCurrentTreasury() {
        Address newTreasury = Address.of("0x0000000000000000000000000000000000000777");
        fees.setTreasury(f.admin, newTreasury);
        f.stable.mint(f.accounts.jobEngine(), BigInteger.valueOf(25));

        fees.routeStableFee(f.accounts.jobEngine(), f.accounts.jobEngine(), BigInteger.valueOf(25));

        assertThat(f.stable.balanceOf(newTreasury)).isEqualTo(BigInteger.valueOf(25));
    }

    @Test
    void adminManagesAllowlist() {
        fees.addAuthorizedCaller(f.admin, STRANGER);
        assertThat(fees.isAuthorizedCaller(STRANGER)).isTrue();

        fees.removeAuthorizedCaller(f.admin, STRANGER);
        assertThat(fees.isAuthorizedCaller(STRANGER)).isFalse();

        assertThatThrownBy(() -> fees.addAuthorizedCaller(STRANGER, STRANGER))
                .isInstanceOf(AuthorizationException.class);
    }
}
