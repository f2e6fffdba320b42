package com.trustgate.steering.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TrustStatsResponse(
    @JsonProperty("totalDenials")       long totalDenials,
    @JsonProperty("consecutiveDenials") int consecutiveDenials,
    @JsonProperty("driftEscalations")   long driftEscalations,
    @JsonProperty("sovereignty")        double sovereignty,
    @JsonProperty("threshold")          double threshold,
    @JsonProperty("pendingPredictions") int pendingPredictions,
    @JsonProperty("recoveryInFlight")   boolean recoveryInFlight
) {}
