package com.trustgate.steering.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.trustgate.common.model.ActionRequirement;

import java.util.LinkedHashMap;
import java.util.Map;

public record RequirementView(
    @JsonProperty("action")         String action,
    @JsonProperty("requiredScores") Map<String, Double> requiredScores,
    @JsonProperty("minSovereignty") double minSovereignty,
    @JsonProperty("description")    String description
) {

    public static RequirementView of(ActionRequirement requirement) {
        Map<String, Double> scores = new LinkedHashMap<>();
        requirement.requiredScores().forEach((category, min) -> scores.put(category.key(), min));
        return new RequirementView(requirement.action(), scores, requirement.minSovereignty(), requirement.description());
    }
}
