package com.trustgate.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * What an action needs before it may run: a sparse set of per-category minimums
 * and a minimum sovereignty. Immutable for the process lifetime.
 */
public record ActionRequirement(
    @JsonProperty("action")         String action,
    @JsonProperty("requiredScores") Map<TrustCategory, Double> requiredScores,
    @JsonProperty("minSovereignty") double minSovereignty,
    @JsonProperty("description")    String description
) {

    public ActionRequirement {
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("ActionRequirement.action must not be blank");
        }
        EnumMap<TrustCategory, Double> copy = new EnumMap<>(TrustCategory.class);
        if (requiredScores != null) copy.putAll(requiredScores);
        requiredScores = Collections.unmodifiableMap(copy);
    }
}
