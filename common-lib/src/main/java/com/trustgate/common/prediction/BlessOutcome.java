package com.trustgate.common.prediction;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

public record BlessOutcome(
    @JsonProperty("found")      boolean found,
    @JsonProperty("prediction") Prediction prediction,
    @JsonProperty("execution")  ExecutionResult execution
) {

    @JsonIgnore
    public boolean success() {
        return found && execution != null && execution.success();
    }

    static BlessOutcome notFound() {
        return new BlessOutcome(false, null, null);
    }
}
