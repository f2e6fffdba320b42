package com.trustgate.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time snapshot of the denial counters.
 */
public record DenialStats(
    @JsonProperty("totalDenials")       long totalDenials,
    @JsonProperty("consecutiveDenials") int  consecutiveDenials,
    @JsonProperty("driftEscalations")   long driftEscalations
) {}
