package com.trustgate.common.permission;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trustgate.common.model.DenialEvent;
import com.trustgate.common.model.TrustCategory;

import java.util.List;

/**
 * Outcome of {@link PermissionEngine#check}.
 *
 * <ul>
 *   <li>{@code registered}: false when the action has no requirement entry (fail-open)</li>
 *   <li>{@code denial}    : populated only when {@code allowed == false}</li>
 * </ul>
 */
public record PermissionDecision(
    @JsonProperty("action")           String action,
    @JsonProperty("allowed")          boolean allowed,
    @JsonProperty("registered")       boolean registered,
    @JsonProperty("overlap")          double overlap,
    @JsonProperty("sovereignty")      double sovereignty,
    @JsonProperty("threshold")        double threshold,
    @JsonProperty("minSovereignty")   double minSovereignty,
    @JsonProperty("failedCategories") List<TrustCategory> failedCategories,
    @JsonProperty("denial")           DenialEvent denial
) {

    public PermissionDecision {
        failedCategories = failedCategories != null ? List.copyOf(failedCategories) : List.of();
    }

    static PermissionDecision unregistered(String action, double sovereignty, double threshold) {
        return new PermissionDecision(action, true, false, 1.0, sovereignty, threshold, 0.0, List.of(), null);
    }
}
