package com.vrwx.relay.claim;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vrwx.core.crypto.Eip712Domain;
import com.vrwx.core.domain.CompletionClaim;

/**
 * A claim together with its EIP-712 domain and the typed-data document a wallet signs.
 */
public record ClaimForSigning(CompletionClaim claim, Eip712Domain domain, ObjectNode typedData) {}
