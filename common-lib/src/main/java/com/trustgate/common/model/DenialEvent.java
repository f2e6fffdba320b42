package com.trustgate.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Immutable record of a single permission denial, handed to the denial hook.
 */
public record DenialEvent(
    @JsonProperty("action")           String action,
    @JsonProperty("skill")            String skill,
    @JsonProperty("overlap")          double overlap,
    @JsonProperty("sovereignty")      double sovereignty,
    @JsonProperty("threshold")        double threshold,
    @JsonProperty("minSovereignty")   double minSovereignty,
    @JsonProperty("failedCategories") List<TrustCategory> failedCategories,
    @JsonProperty("timestamp")        Instant timestamp
) {

    public DenialEvent {
        failedCategories = failedCategories != null ? List.copyOf(failedCategories) : List.of();
    }

    /** One-line summary used in logs and human-visible notices. */
    public String summary() {
        return String.format("%s denied for skill=%s overlap=%.2f<%.2f sovereignty=%.3f (min %.2f) failed=%s",
            action, skill, overlap, threshold, sovereignty, minSovereignty, failedCategories);
    }
}
