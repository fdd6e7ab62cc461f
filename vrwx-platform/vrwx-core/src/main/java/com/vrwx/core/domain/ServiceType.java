package com.vrwx.core.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import com.vrwx.core.crypto.Keccak;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of services a job can be posted for. The wire id is hashed with keccak256 to form
 * the service type tag carried on offers and jobs.
 */
public enum ServiceType {
    INSPECTION("inspection"),
    SECURITY_PATROL("security_patrol"),
    DELIVERY("delivery");

    private final String id;
    private final Bytes32 typeHash;

    ServiceType(String id) {
        this.id = id;
        this.typeHash = Keccak.hashUtf8(id);
    }

    @JsonValue
    public String id() {
        return id;
    }

    public Bytes32 typeHash() {
        return typeHash;
    }

    public static Optional<ServiceType> fromId(String id) {
        return Arrays.stream(values()).filter(t -> t.id.equals(id)).findFirst();
    }

    public static Optional<ServiceType> fromHash(Bytes32 hash) {
        return Arrays.stream(values()).filter(t -> t.typeHash.equals(hash)).findFirst();
    }
}
