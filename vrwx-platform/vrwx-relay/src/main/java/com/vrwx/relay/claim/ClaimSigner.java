package com.vrwx.relay.claim;

import com.vrwx.core.crypto.ClaimSignatures;
import com.vrwx.core.domain.Address;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Keys;

/**
 * Controller-side signing of assembled claims.
 */
public class ClaimSigner {

    private final ECKeyPair keyPair;
    private final Address address;

    public ClaimSigner(ECKeyPair keyPair) {
        this.keyPair = keyPair;
        this.address = Address.of(Keys.getAddress(keyPair));
    }

    public Address getAddress() {
        return address;
    }

    /**
     * @return 65-byte {@code r||s||v} signature as 0x-prefixed hex
     * @throws IllegalArgumentException if this signer is not the claim's controller
     */
    public String sign(ClaimForSigning toSign) {
        if (!toSign.claim().controller().equals(address)) {
            throw new IllegalArgumentException(
                    "Signer " + address + " is not the controller " + toSign.claim().controller());
        }
        return ClaimSignatures.signHex(toSign.domain(), toSign.claim(), keyPair);
    }
}
