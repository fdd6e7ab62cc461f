package com.vrwx.services.module;

import com.vrwx.core.domain.Bytes32;
import com.vrwx.core.domain.ServiceType;

import java.math.BigDecimal;
import java.util.List;

/**
 * Catalogue entry describing a service for listings and pricing.
 */
public record ServiceDefinition(
        ServiceType id,
        Bytes32 typeHash,
        String label,
        String description,
        List<String> requiredCapabilities,
        BigDecimal baseRateUsd
) {

    public ServiceDefinition {
        requiredCapabilities = List.copyOf(requiredCapabilities);
    }
}
