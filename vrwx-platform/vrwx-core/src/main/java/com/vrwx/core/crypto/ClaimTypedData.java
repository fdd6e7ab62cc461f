package com.vrwx.core.crypto;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vrwx.core.domain.CompletionClaim;
import org.web3j.crypto.StructuredDataEncoder;

import java.io.IOException;

/**
 * EIP-712 encoding of {@code CompletionClaimV2}. Produces the typed-data document that wallets
 * display and the 32-byte digest that controllers sign.
 */
public final class ClaimTypedData {

    public static final String PRIMARY_TYPE = "CompletionClaimV2";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String[][] DOMAIN_FIELDS = {
            {"name", "string"},
            {"version", "string"},
            {"chainId", "uint256"},
            {"verifyingContract", "address"}
    };

    private static final String[][] CLAIM_FIELDS = {
            {"jobId", "uint256"},
            {"jobSpecHash", "bytes32"},
            {"completionHash", "bytes32"},
            {"robotId", "bytes32"},
            {"controller", "address"},
            {"deadline", "uint256"},
            {"qualityScore", "uint8"},
            {"workUnits", "uint32"}
    };

    private ClaimTypedData() {}

    public static ObjectNode toTypedData(Eip712Domain domain, CompletionClaim claim) {
        ObjectNode root = MAPPER.createObjectNode();

        ObjectNode types = root.putObject("types");
        types.set("EIP712Domain", fields(DOMAIN_FIELDS));
        types.set(PRIMARY_TYPE, fields(CLAIM_FIELDS));

        root.put("primaryType", PRIMARY_TYPE);

        ObjectNode domainNode = root.putObject("domain");
        domainNode.put("name", domain.name());
        domainNode.put("version", domain.version());
        domainNode.put("chainId", domain.chainId());
        domainNode.put("verifyingContract", domain.verifyingContract().value());

        // uint values travel as decimal strings so that uint256 never loses precision
        ObjectNode message = root.putObject("message");
        message.put("jobId", claim.jobId().toString());
        message.put("jobSpecHash", claim.jobSpecHash().toHex());
        message.put("completionHash", claim.completionHash().toHex());
        message.put("robotId", claim.robotId().toHex());
        message.put("controller", claim.controller().value());
        message.put("deadline", claim.deadline().toString());
        message.put("qualityScore", Integer.toString(claim.qualityScore()));
        message.put("workUnits", Long.toString(claim.workUnits()));
        return root;
    }

    public static String toJson(Eip712Domain domain, CompletionClaim claim) {
        return toTypedData(domain, claim).toString();
    }

    /**
     * keccak256("\x19\x01" || domainSeparator || hashStruct(claim)).
     */
    public static byte[] digest(Eip712Domain domain, CompletionClaim claim) {
        try {
            return new StructuredDataEncoder(toJson(domain, claim)).hashStructuredData();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode completion claim", e);
        }
    }

    private static ArrayNode fields(String[][] spec) {
        ArrayNode array = MAPPER.createArrayNode();
        for (String[] field : spec) {
            array.addObject().put("name", field[0]).put("type", field[1]);
        }
        return array;
    }
}
