package com.vrwx.services.manifest;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.vrwx.core.domain.ServiceType;

import java.util.Map;
import java.util.Optional;

/**
 * Buyer-side description of a job. The keccak256 of its canonical JSON is the job spec hash
 * carried on offers and jobs.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobSpec(
        ServiceType serviceType,
        String geoCell,
        TimeWindow timeWindow,
        int qualityMin,
        String deliverableManifestHash,
        Map<String, Object> serviceParams
) {

    public JobSpec {
        serviceParams = serviceParams == null ? null : Map.copyOf(serviceParams);
    }

    public Optional<Object> param(String key) {
        return serviceParams == null ? Optional.empty() : Optional.ofNullable(serviceParams.get(key));
    }

    /**
     * Inclusive window, in epoch seconds, in which the work is expected.
     */
    public record TimeWindow(long start, long end) {

        public boolean contains(long timestamp) {
            return timestamp >= start && timestamp <= end;
        }
    }
}
