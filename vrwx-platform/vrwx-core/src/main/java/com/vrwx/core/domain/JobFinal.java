package com.vrwx.core.domain;

/**
 * Outcome of a settled job handed to the rewards distributor.
 */
public record JobFinal(Bytes32 robotId, Address controller, int qualityScore, long workUnits) {}
